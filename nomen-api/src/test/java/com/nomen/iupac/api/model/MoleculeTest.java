package com.nomen.iupac.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MoleculeTest {

    private static Molecule propanol() {
        return Molecule.builder()
                .addAtom(Atom.of("C", 3))
                .addAtom(Atom.of("C", 2))
                .addAtom(Atom.of("C", 2))
                .addAtom(Atom.of("O", 1))
                .addBond(0, 1, BondOrder.SINGLE)
                .addBond(1, 2, BondOrder.SINGLE)
                .addBond(2, 3, BondOrder.SINGLE)
                .build();
    }

    @Test
    @DisplayName("Adjacency queries reflect the bond list")
    void adjacency() {
        Molecule molecule = propanol();

        assertThat(molecule.neighbors(1)).containsExactly(0, 2);
        assertThat(molecule.degree(3)).isEqualTo(1);
        assertThat(molecule.bonded(2, 3)).isTrue();
        assertThat(molecule.bonded(0, 3)).isFalse();
        assertThat(molecule.bondBetween(3, 2)).map(Bond::order).contains(BondOrder.SINGLE);
        assertThat(molecule.bondOrderSum(1)).isEqualTo(2.0);
        assertThat(molecule.carbonCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Duplicate bonds are ignored by the builder")
    void duplicateBondsIgnored() {
        Molecule molecule = Molecule.builder()
                .addAtom(Atom.of("C", 3))
                .addAtom(Atom.of("C", 3))
                .addBond(0, 1, BondOrder.SINGLE)
                .addBond(1, 0, BondOrder.SINGLE)
                .build();

        assertThat(molecule.bondCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Bonds to unknown atoms are rejected")
    void rejectsDanglingBond() {
        Molecule.Builder builder = Molecule.builder()
                .addAtom(Atom.of("C", 4))
                .addBond(0, 5, BondOrder.SINGLE);

        assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Sub-molecule re-indexes atoms and caps cut bonds with hydrogen")
    void subMoleculeCapsCutBonds() {
        Molecule fragment = propanol().subMolecule(new int[]{2, 3});

        assertThat(fragment.atomCount()).isEqualTo(2);
        assertThat(fragment.atom(0).symbol()).isEqualTo("C");
        assertThat(fragment.atom(0).implicitHydrogens()).isEqualTo(3);
        assertThat(fragment.atom(1).implicitHydrogens()).isEqualTo(1);
        assertThat(fragment.bonded(0, 1)).isTrue();
    }

    @Test
    @DisplayName("Aromatic symbols are normalized and get atomic numbers")
    void aromaticSymbolNormalized() {
        Atom atom = Atom.aromatic("c", 1);

        assertThat(atom.symbol()).isEqualTo("C");
        assertThat(atom.atomicNumber()).isEqualTo(6);
        assertThat(atom.aromatic()).isTrue();
        assertThat(Atom.of("Cl", 0).isHalogen()).isTrue();
    }
}
