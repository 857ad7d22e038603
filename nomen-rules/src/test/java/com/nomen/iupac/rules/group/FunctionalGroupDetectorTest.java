package com.nomen.iupac.rules.group;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.ring.RingClassifier;
import com.nomen.iupac.rules.TestStructures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FunctionalGroupDetectorTest {

    private final FunctionalGroupDetector detector = new FunctionalGroupDetector();

    private List<FunctionalGroup> detect(Molecule molecule) {
        return detector.detect(molecule, new RingClassifier().analyze(molecule));
    }

    static Stream<Arguments> singleGroups() {
        return Stream.of(
            Arguments.of("acetic acid", new String[]{"C", "C", "O", "O"},
                new int[][]{{0, 1}, {1, 2, 2}, {1, 3}}, FunctionalGroupType.ACID, 1),
            Arguments.of("methyl acetate", new String[]{"C", "C", "O", "O", "C"},
                new int[][]{{0, 1}, {1, 2, 2}, {1, 3}, {3, 4}}, FunctionalGroupType.ESTER, 1),
            Arguments.of("acetamide", new String[]{"C", "C", "O", "N"},
                new int[][]{{0, 1}, {1, 2, 2}, {1, 3}}, FunctionalGroupType.AMIDE, 1),
            Arguments.of("acetonitrile", new String[]{"C", "C", "N"},
                new int[][]{{0, 1}, {1, 2, 3}}, FunctionalGroupType.NITRILE, 1),
            Arguments.of("propanal", new String[]{"C", "C", "C", "O"},
                new int[][]{{0, 1}, {1, 2}, {2, 3, 2}}, FunctionalGroupType.ALDEHYDE, 2),
            Arguments.of("acetone", new String[]{"C", "C", "C", "O"},
                new int[][]{{0, 1}, {1, 2}, {1, 3, 2}}, FunctionalGroupType.KETONE, 1),
            Arguments.of("ethanol", new String[]{"C", "C", "O"},
                new int[][]{{0, 1}, {1, 2}}, FunctionalGroupType.ALCOHOL, 1),
            Arguments.of("ethanethiol", new String[]{"C", "C", "S"},
                new int[][]{{0, 1}, {1, 2}}, FunctionalGroupType.THIOL, 1),
            Arguments.of("methylamine", new String[]{"C", "N"},
                new int[][]{{0, 1}}, FunctionalGroupType.AMINE, 0));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("singleGroups")
    @DisplayName("Detects each group class on its bearing carbon")
    void detectsGroup(String name, String[] symbols, int[][] bonds, FunctionalGroupType type, int carbon) {
        List<FunctionalGroup> groups = detect(TestStructures.molecule(symbols, bonds));

        assertThat(groups).singleElement().satisfies(group -> {
            assertThat(group.type()).isEqualTo(type);
            assertThat(group.carbon()).isEqualTo(carbon);
            assertThat(group.principal()).isFalse();
        });
    }

    @Test
    @DisplayName("Ethers, secondary amines, N-substituted amides and anhydrides are not suffix groups")
    void ignoresNonSuffixGroups() {
        Molecule ether = TestStructures.molecule(new String[]{"C", "O", "C"}, new int[][]{{0, 1}, {1, 2}});
        Molecule dimethylamine = TestStructures.molecule(new String[]{"C", "N", "C"}, new int[][]{{0, 1}, {1, 2}});
        Molecule methylacetamide = TestStructures.molecule(new String[]{"C", "C", "O", "N", "C"},
            new int[][]{{0, 1}, {1, 2, 2}, {1, 3}, {3, 4}});
        Molecule anhydride = TestStructures.molecule(new String[]{"C", "C", "O", "O", "C", "O", "C"},
            new int[][]{{0, 1}, {1, 2, 2}, {1, 3}, {3, 4}, {4, 5, 2}, {4, 6}});

        assertThat(detect(ether)).isEmpty();
        assertThat(detect(dimethylamine)).isEmpty();
        assertThat(detect(methylacetamide)).isEmpty();
        assertThat(detect(anhydride)).isEmpty();
    }

    @Test
    @DisplayName("Carbamates are neither esters nor amides")
    void ignoresCarbamate() {
        // methyl carbamate
        Molecule molecule = TestStructures.molecule(new String[]{"N", "C", "O", "O", "C"},
            new int[][]{{0, 1}, {1, 2, 2}, {1, 3}, {3, 4}});

        assertThat(detect(molecule)).isEmpty();
    }

    @Test
    @DisplayName("Lactones stay ring ketones")
    void lactoneIsKetone() {
        // oxolan-2-one
        Molecule molecule = TestStructures.molecule(new String[]{"C", "C", "C", "C", "O", "O"},
            new int[][]{{0, 1}, {1, 2}, {2, 3}, {3, 4}, {4, 0}, {0, 5, 2}});

        assertThat(detect(molecule)).extracting(FunctionalGroup::type).containsExactly(FunctionalGroupType.KETONE);
    }

    @Test
    @DisplayName("Groups are ordered by seniority")
    void seniorityOrder() {
        // 4-hydroxybutanoic acid
        Molecule molecule = TestStructures.molecule(new String[]{"O", "C", "C", "C", "C", "O", "O"},
            new int[][]{{0, 1}, {1, 2}, {2, 3}, {3, 4}, {4, 5, 2}, {4, 6}});

        assertThat(detect(molecule)).extracting(FunctionalGroup::type)
            .containsExactly(FunctionalGroupType.ACID, FunctionalGroupType.ALCOHOL);
        assertThat(FunctionalGroupType.ACID.isSeniorTo(FunctionalGroupType.AMINE)).isTrue();
    }

    @Test
    @DisplayName("Acid derivatives rank between acids and aldehydes")
    void acidDerivativeSeniority() {
        assertThat(FunctionalGroupType.values()).containsSubsequence(
            FunctionalGroupType.ACID, FunctionalGroupType.ESTER, FunctionalGroupType.AMIDE,
            FunctionalGroupType.NITRILE, FunctionalGroupType.ALDEHYDE);

        // 4-cyanobutanamide: amide carbon 0, nitrile carbon 4
        Molecule molecule = TestStructures.molecule(new String[]{"C", "C", "C", "C", "C", "N", "O", "N"},
            new int[][]{{0, 1}, {1, 2}, {2, 3}, {3, 4}, {4, 5, 3}, {0, 6, 2}, {0, 7}});

        assertThat(detect(molecule)).extracting(FunctionalGroup::type)
            .containsExactly(FunctionalGroupType.AMIDE, FunctionalGroupType.NITRILE);
    }

    @Test
    @DisplayName("Ester groups expose the oxygen bonded to the alkyl group")
    void esterOxygen() {
        // ethyl acetate: acyl carbon 1, ester oxygen 3
        Molecule molecule = TestStructures.molecule(new String[]{"C", "C", "O", "O", "C", "C"},
            new int[][]{{0, 1}, {1, 2, 2}, {1, 3}, {3, 4}, {4, 5}});

        FunctionalGroup ester = detect(molecule).get(0);

        assertThat(ester.type()).isEqualTo(FunctionalGroupType.ESTER);
        assertThat(ester.esterOxygen()).isEqualTo(3);
    }

    @Test
    @DisplayName("Carboxyl on a ring is expressed at the ring atom in attached form")
    void attachedForm() {
        // benzoic acid: ring 0..5, carboxyl carbon 6
        Molecule molecule = TestStructures.molecule(new String[]{"C", "C", "C", "C", "C", "C", "C", "O", "O"},
            new int[][]{{0, 1, 4}, {1, 2, 4}, {2, 3, 4}, {3, 4, 4}, {4, 5, 4}, {5, 0, 4},
                {0, 6}, {6, 7, 2}, {6, 8}});

        FunctionalGroup acid = detect(molecule).get(0);

        assertThat(acid.type()).isEqualTo(FunctionalGroupType.ACID);
        assertThat(acid.expressedAt(molecule, atom -> atom < 6, true)).isZero();
        assertThat(acid.attachedForm(atom -> atom < 6)).isTrue();
        assertThat(acid.expressedAt(molecule, atom -> atom < 6, false)).isEqualTo(-1);
    }
}
