package com.nomen.iupac.naming.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.naming.Smiles;
import com.nomen.iupac.naming.numbering.LocantOptimizer;
import com.nomen.iupac.ring.RingAnalysis;
import com.nomen.iupac.ring.RingClassifier;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentKind;
import com.nomen.iupac.rules.parent.RingParentNamer;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RingParentNamersTest {

    private final LocantOptimizer optimizer = new LocantOptimizer();

    private Optional<NamedParent> parent(RingParentNamer namer, String smiles) {
        Molecule molecule = Smiles.parse(smiles);
        RingAnalysis rings = new RingClassifier().analyze(molecule);
        return namer.name(molecule, rings.systems().get(0));
    }

    /**
     * Unsubstituted parent name under the numbering the optimizer picks.
     */
    private String render(RingParentNamer namer, String smiles) {
        Molecule molecule = Smiles.parse(smiles);
        NamedParent parent = parent(namer, smiles).orElseThrow();
        Numbering numbering = optimizer.choose(molecule, parent, IntLists.EMPTY_LIST, -1, List.of());
        return parent.render(numbering, 0);
    }

    @Nested
    @DisplayName("Monocycles")
    class Monocycles {

        private final MonocycleNamer namer = new MonocycleNamer();

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "c1ccccc1, benzene",
            "C1=CC=CC=C1, benzene",
            "C1CCCCC1, cyclohexane",
            "C1CC1, cyclopropane",
            "C1=CCCCC1, cyclohexene",
            "C1=CC=CCC1, 'cyclohexa-1,3-diene'",
            "c1ccncc1, pyridine",
            "c1cncnc1, pyrimidine",
            "c1ccoc1, furan",
            "c1ccsc1, thiophene",
            "c1cc[nH]c1, 1H-pyrrole",
            "C1CCNCC1, piperidine",
            "C1CCNC1, pyrrolidine",
            "C1COCCN1, morpholine",
            "C1CCOC1, oxolane",
            "C1CCOCC1, oxane",
            "C1COCO1, '1,3-dioxolane'"
        })
        @DisplayName("Retained, cycloalkane and Hantzsch-Widman names")
        void names(String smiles, String expected) {
            assertThat(render(namer, smiles)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Benzene and saturated carbocycles are homogeneous, heterocycles are not")
        void homogeneous() {
            assertThat(parent(namer, "c1ccccc1").orElseThrow().homogeneous()).isTrue();
            assertThat(parent(namer, "C1CCCCC1").orElseThrow().homogeneous()).isTrue();
            assertThat(parent(namer, "c1ccncc1").orElseThrow().homogeneous()).isFalse();
        }

        @Test
        @DisplayName("A six-membered ring allows twelve numberings")
        void numberings() {
            assertThat(parent(namer, "C1CCCCC1").orElseThrow().numberings()).hasSize(12);
        }
    }

    @Nested
    @DisplayName("Von Baeyer systems")
    class VonBaeyer {

        private final VonBaeyerNamer namer = new VonBaeyerNamer();

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "C1CC2CC1C2, 'bicyclo[2.1.1]hexane'",
            "C1CC2CCC1C2, 'bicyclo[2.2.1]heptane'",
            "C1CC2CCC1CC2, 'bicyclo[2.2.2]octane'",
            "C1CC2CCC1O2, '7-oxabicyclo[2.2.1]heptane'"
        })
        @DisplayName("Bridged bicycles")
        void bicycles(String smiles, String expected) {
            assertThat(render(namer, smiles)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Equal secondary bridges are cited by ascending superscripts")
        void cubane() {
            assertThat(render(namer, "C12C3C4C1C5C2C3C45"))
                .isEqualTo("pentacyclo[4.2.0.0^{2,5}.0^{3,8}.0^{4,7}]octane");
        }

        @Test
        @DisplayName("Von Baeyer parents report their kind")
        void kind() {
            assertThat(parent(namer, "C1CC2CCC1C2").orElseThrow().kind()).isEqualTo(ParentKind.VON_BAEYER);
        }
    }

    @Nested
    @DisplayName("Spiro systems")
    class Spiro {

        private final SpiroNamer namer = new SpiroNamer();

        @Test
        @DisplayName("Monospiro hydrocarbons cite the smaller ring first")
        void monospiro() {
            assertThat(render(namer, "C1CCC2(C1)CCCCC2")).isEqualTo("spiro[4.5]decane");
            assertThat(render(namer, "C1CC2(C1)CCC2")).isEqualTo("spiro[3.3]heptane");
        }

        @Test
        @DisplayName("Fused systems are declined")
        void declinesFused() {
            assertThat(parent(namer, "C1CCC2CCCCC2C1")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Fused systems")
    class Fused {

        private final FusedRingNamer namer = new FusedRingNamer();

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "c1ccc2ccccc2c1, naphthalene",
            "c1ccc2cc3ccccc3cc2c1, anthracene",
            "c1ccc2c(c1)ccc1ccccc12, phenanthrene",
            "c1ccc2ncccc2c1, quinoline",
            "c1ccc2[nH]ccc2c1, 1H-indole"
        })
        @DisplayName("Retained fused names")
        void retained(String smiles, String expected) {
            assertThat(render(namer, smiles)).isEqualTo(expected);
        }
    }
}
