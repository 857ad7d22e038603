package com.nomen.iupac.ring;

import com.nomen.iupac.api.model.Atom;
import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.api.model.Molecule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RingClassifierTest {

    private RingClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new RingClassifier();
    }

    @Test
    @DisplayName("Acyclic molecule has no ring systems")
    void acyclic() {
        Molecule propane = TestMolecules.carbons(3, false, new int[][]{{0, 1}, {1, 2}});

        RingAnalysis analysis = classifier.analyze(propane);

        assertThat(analysis.hasRings()).isFalse();
        assertThat(analysis.systems()).isEmpty();
    }

    @Test
    @DisplayName("Cyclohexane is one isolated aliphatic system")
    void isolatedAliphatic() {
        RingAnalysis analysis = classifier.analyze(TestMolecules.cycle(6));

        assertThat(analysis.systems()).hasSize(1);
        RingSystem system = analysis.systems().get(0);
        assertThat(system.isIsolated()).isTrue();
        assertThat(system.type()).isEqualTo(RingSystemType.ALIPHATIC);
        assertThat(system.fused() || system.bridged() || system.spiro()).isFalse();
    }

    @Test
    @DisplayName("Ring heteroatom makes the system heterocyclic")
    void heterocyclic() {
        RingSystem system = classifier.analyze(TestMolecules.oxolane()).systems().get(0);

        assertThat(system.type()).isEqualTo(RingSystemType.HETEROCYCLIC);
        assertThat(system.heteroatoms().toIntArray()).containsExactly(0);
    }

    @Test
    @DisplayName("Naphthalene is a fused aromatic system of two rings")
    void fusedAromatic() {
        RingSystem system = classifier.analyze(TestMolecules.naphthalene()).systems().get(0);

        assertThat(system.ringCount()).isEqualTo(2);
        assertThat(system.fused()).isTrue();
        assertThat(system.bridged()).isFalse();
        assertThat(system.type()).isEqualTo(RingSystemType.AROMATIC);
    }

    @Test
    @DisplayName("Norbornane rings share three atoms and are bridged")
    void bridged() {
        Molecule norbornane = TestMolecules.norbornane();
        RingSystem system = classifier.analyze(norbornane).systems().get(0);

        assertThat(system.bridged()).isTrue();
        assertThat(system.fused()).isFalse();
        assertThat(system.bridgeheads(norbornane).toIntArray()).containsExactly(2, 5);
    }

    @Test
    @DisplayName("Spiro[4.5]decane shares a single atom")
    void spiro() {
        RingSystem system = classifier.analyze(TestMolecules.spiroDecane()).systems().get(0);

        assertThat(system.spiro()).isTrue();
        assertThat(system.bridged()).isFalse();
        assertThat(system.ringMembership(3)).isEqualTo(2);
    }

    @Test
    @DisplayName("Disconnected rings form separate systems")
    void separateSystems() {
        Molecule bicyclohexyl = TestMolecules.carbons(12, false, new int[][]{
                {0, 1}, {1, 2}, {2, 3}, {3, 4}, {4, 5}, {5, 0}, {0, 6},
                {6, 7}, {7, 8}, {8, 9}, {9, 10}, {10, 11}, {11, 6}});

        RingAnalysis analysis = classifier.analyze(bicyclohexyl);

        assertThat(analysis.systems()).hasSize(2);
        assertThat(analysis.isolated()).hasSize(2);
        assertThat(analysis.systemOf(7)).map(RingSystem::id).contains(1);
    }

    @Test
    @DisplayName("Invalid parser rings are ignored in favor of computed rings")
    void invalidParserRingsDropped() {
        Molecule molecule = Molecule.builder()
                .addAtom(Atom.of("C", 2)).addAtom(Atom.of("C", 2)).addAtom(Atom.of("C", 2))
                .addBond(0, 1, BondOrder.SINGLE).addBond(1, 2, BondOrder.SINGLE).addBond(2, 0, BondOrder.SINGLE)
                .addRing(0, 2)
                .build();

        RingAnalysis analysis = classifier.analyze(molecule);

        assertThat(analysis.rings()).hasSize(1);
        assertThat(analysis.rings().get(0).size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Ring count equals the cycle rank")
    void ringCountEqualsCycleRank() {
        Molecule norbornane = TestMolecules.norbornane();

        RingAnalysis analysis = classifier.analyze(norbornane);

        assertThat(analysis.rings()).hasSize(norbornane.bondCount() - norbornane.atomCount() + 1);
    }
}
