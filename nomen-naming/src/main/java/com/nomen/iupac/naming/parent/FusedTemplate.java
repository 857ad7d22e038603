package com.nomen.iupac.naming.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.ring.FusedSystem;
import com.nomen.iupac.rules.parent.Locant;
import com.nomen.iupac.rules.parent.Numbering;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;

/**
 * Retained fused ring skeleton described by its perimeter.
 *
 * <p>The perimeter is written in locant order as {@code <symbol><locant>}
 * tokens, with {@code *} marking fusion atoms: {@code "N1 C2 C3 C3a* C4 C5 C6 C7 C7a*"}.
 * Fusion bonds are given as locant pairs ({@code "3a-7a"}).
 *
 * @param indicatedHydrogen number of indicated hydrogen atoms of the mancude skeleton
 */
record FusedTemplate(String name, List<String> symbols, List<Locant> labels, List<Boolean> fusion,
                     List<Locant[]> fusionBonds, int indicatedHydrogen) {

    FusedTemplate {
        symbols = List.copyOf(symbols);
        labels = List.copyOf(labels);
        fusion = List.copyOf(fusion);
        fusionBonds = List.copyOf(fusionBonds);
    }

    static FusedTemplate of(String name, int indicatedHydrogen, String perimeter, String... fusionBonds) {
        List<String> symbols = new ArrayList<>();
        List<Locant> labels = new ArrayList<>();
        List<Boolean> fusion = new ArrayList<>();
        for (String token : perimeter.trim().split("\\s+")) {
            int digit = 0;
            while (!Character.isDigit(token.charAt(digit))) {
                digit++;
            }
            boolean fused = token.endsWith("*");
            symbols.add(token.substring(0, digit));
            labels.add(Locant.parse(token.substring(digit, fused ? token.length() - 1 : token.length())));
            fusion.add(fused);
        }
        List<Locant[]> bonds = new ArrayList<>();
        for (String bond : fusionBonds) {
            String[] ends = bond.split("-");
            bonds.add(new Locant[]{Locant.parse(ends[0]), Locant.parse(ends[1])});
        }
        return new FusedTemplate(name, symbols, labels, fusion, bonds, indicatedHydrogen);
    }

    int size() {
        return symbols.size();
    }

    /**
     * Every rotation and reflection of the perimeter that matches this
     * template, as numberings. Empty when the skeleton is different.
     */
    List<Numbering> align(Molecule molecule, FusedSystem fused) {
        IntList perimeter = fused.perimeter();
        int n = perimeter.size();
        List<Numbering> numberings = new ArrayList<>();
        if (n != size() || fused.system().size() != n) {
            return numberings;
        }
        for (int start = 0; start < n; start++) {
            for (int direction : new int[]{1, -1}) {
                IntList order = RingNumberings.walk(perimeter, start, direction);
                if (matches(molecule, fused, order)) {
                    numberings.add(Numbering.of(order, labels));
                }
            }
        }
        return numberings;
    }

    private boolean matches(Molecule molecule, FusedSystem fused, IntList order) {
        for (int i = 0; i < order.size(); i++) {
            int atom = order.getInt(i);
            if (!molecule.atom(atom).symbol().equals(symbols.get(i))
                    || (fused.system().ringMembership(atom) >= 2) != fusion.get(i)) {
                return false;
            }
        }
        for (Locant[] bond : fusionBonds) {
            int a = order.getInt(labels.indexOf(bond[0]));
            int b = order.getInt(labels.indexOf(bond[1]));
            if (!molecule.bonded(a, b)) {
                return false;
            }
        }
        return true;
    }
}
