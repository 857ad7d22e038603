package com.nomen.iupac.rules;

import com.nomen.iupac.api.model.Atom;
import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.ring.RingAnalysis;
import com.nomen.iupac.ring.RingClassifier;
import com.nomen.iupac.rules.chain.ChainFinder;
import com.nomen.iupac.rules.group.FunctionalGroupDetector;

import java.util.Arrays;
import java.util.Map;

/**
 * Hand-built molecules for rule tests.
 *
 * <p>Bonds are {@code {a, b}} or {@code {a, b, order}} with order 1, 2, 3 or 4 (aromatic).
 * Hydrogens fill each atom up to its default valence.
 */
public final class TestStructures {

    private static final Map<String, Integer> VALENCE = Map.of(
        "C", 4, "N", 3, "O", 2, "S", 2, "Si", 4, "P", 3, "Cl", 1, "Br", 1, "F", 1);

    private TestStructures() {
    }

    public static Molecule molecule(String[] symbols, int[][] bonds) {
        boolean[] aromatic = new boolean[symbols.length];
        double[] used = new double[symbols.length];
        for (int[] bond : bonds) {
            BondOrder order = order(bond);
            used[bond[0]] += order.valence();
            used[bond[1]] += order.valence();
            if (order == BondOrder.AROMATIC) {
                aromatic[bond[0]] = true;
                aromatic[bond[1]] = true;
            }
        }
        Molecule.Builder builder = Molecule.builder();
        for (int i = 0; i < symbols.length; i++) {
            int hydrogens = Math.max(0, VALENCE.getOrDefault(symbols[i], 0) - (int) Math.floor(used[i]));
            builder.addAtom(aromatic[i] ? Atom.aromatic(symbols[i], hydrogens) : Atom.of(symbols[i], hydrogens));
        }
        for (int[] bond : bonds) {
            builder.addBond(bond[0], bond[1], order(bond));
        }
        return builder.build();
    }

    /**
     * Unbranched saturated carbon chain.
     */
    public static Molecule alkane(int carbons) {
        String[] symbols = new String[carbons];
        int[][] bonds = new int[Math.max(0, carbons - 1)][];
        for (int i = 0; i < carbons; i++) {
            symbols[i] = "C";
            if (i > 0) {
                bonds[i - 1] = new int[]{i - 1, i};
            }
        }
        return molecule(symbols, bonds);
    }

    /**
     * Benzene ring on atoms 0..5 with an unbranched chain of {@code chainLength} carbons on atom 0.
     */
    public static Molecule alkylbenzene(int chainLength) {
        String[] symbols = new String[6 + chainLength];
        int[][] bonds = new int[6 + chainLength][];
        for (int i = 0; i < symbols.length; i++) {
            symbols[i] = "C";
        }
        for (int i = 0; i < 6; i++) {
            bonds[i] = new int[]{i, (i + 1) % 6, 4};
        }
        for (int i = 0; i < chainLength; i++) {
            bonds[6 + i] = new int[]{i == 0 ? 0 : 5 + i, 6 + i};
        }
        return molecule(symbols, bonds);
    }

    public static Molecule biphenyl() {
        String[] symbols = new String[12];
        Arrays.fill(symbols, "C");
        return molecule(symbols, new int[][]{
            {0, 1, 4}, {1, 2, 4}, {2, 3, 4}, {3, 4, 4}, {4, 5, 4}, {5, 0, 4},
            {6, 7, 4}, {7, 8, 4}, {8, 9, 4}, {9, 10, 4}, {10, 11, 4}, {11, 6, 4},
            {0, 6}});
    }

    /**
     * Initial naming state with rings, chains and groups detected the standard way.
     */
    public static NamingState initialState(Molecule molecule) {
        RingAnalysis rings = new RingClassifier().analyze(molecule);
        return NamingState.initial(molecule, rings,
            new ChainFinder().find(molecule, rings),
            new FunctionalGroupDetector().detect(molecule, rings));
    }

    private static BondOrder order(int[] bond) {
        if (bond.length < 3) {
            return BondOrder.SINGLE;
        }
        return switch (bond[2]) {
            case 2 -> BondOrder.DOUBLE;
            case 3 -> BondOrder.TRIPLE;
            case 4 -> BondOrder.AROMATIC;
            default -> BondOrder.SINGLE;
        };
    }
}
