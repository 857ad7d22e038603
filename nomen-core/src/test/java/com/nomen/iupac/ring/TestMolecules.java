package com.nomen.iupac.ring;

import com.nomen.iupac.api.model.Atom;
import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.api.model.Molecule;

/**
 * Hand-built molecules for ring tests. Hydrogen counts are not relevant here.
 */
final class TestMolecules {

    private TestMolecules() {
    }

    static Molecule carbons(int atoms, boolean aromatic, int[][] bonds) {
        Molecule.Builder builder = Molecule.builder();
        for (int i = 0; i < atoms; i++) {
            builder.addAtom(aromatic ? Atom.aromatic("C", 1) : Atom.of("C", 2));
        }
        for (int[] bond : bonds) {
            builder.addBond(bond[0], bond[1], aromatic ? BondOrder.AROMATIC : BondOrder.SINGLE);
        }
        return builder.build();
    }

    static Molecule cycle(int size) {
        int[][] bonds = new int[size][];
        for (int i = 0; i < size; i++) {
            bonds[i] = new int[]{i, (i + 1) % size};
        }
        return carbons(size, false, bonds);
    }

    static Molecule naphthalene() {
        return carbons(10, true, new int[][]{
                {0, 1}, {1, 2}, {2, 3}, {3, 4}, {4, 5}, {5, 6}, {6, 7}, {7, 8}, {8, 3}, {8, 9}, {9, 0}});
    }

    static Molecule norbornane() {
        return carbons(7, false, new int[][]{
                {0, 1}, {1, 2}, {2, 3}, {3, 4}, {4, 5}, {5, 0}, {5, 6}, {6, 2}});
    }

    static Molecule spiroDecane() {
        return carbons(10, false, new int[][]{
                {0, 1}, {1, 2}, {2, 3}, {3, 4}, {4, 0}, {3, 5}, {5, 6}, {6, 7}, {7, 8}, {8, 9}, {9, 3}});
    }

    static Molecule oxolane() {
        return Molecule.builder()
                .addAtom(Atom.of("O", 0))
                .addAtom(Atom.of("C", 2))
                .addAtom(Atom.of("C", 2))
                .addAtom(Atom.of("C", 2))
                .addAtom(Atom.of("C", 2))
                .addBond(0, 1, BondOrder.SINGLE)
                .addBond(1, 2, BondOrder.SINGLE)
                .addBond(2, 3, BondOrder.SINGLE)
                .addBond(3, 4, BondOrder.SINGLE)
                .addBond(4, 0, BondOrder.SINGLE)
                .build();
    }
}
