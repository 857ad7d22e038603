package com.nomen.iupac.naming.parent;

import com.nomen.iupac.api.model.Bond;
import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.naming.stem.AlkaneStems;
import com.nomen.iupac.rules.parent.Locant;
import com.nomen.iupac.rules.parent.Numbering;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Double and triple bonds of a parent and their ene/yne endings.
 *
 * <p>A bond is cited by its lower locant. When its atoms are not numbered
 * consecutively the higher locant follows in parentheses, as in
 * {@code bicyclo[4.4.0]dec-1(6)-ene}.
 */
final class Unsaturation {

    record MultipleBond(int a, int b, BondOrder order) {
    }

    private Unsaturation() {
    }

    /**
     * Localized double and triple bonds with both atoms in {@code atoms}.
     */
    static List<MultipleBond> find(Molecule molecule, IntList atoms) {
        IntSet members = new IntOpenHashSet(atoms);
        List<MultipleBond> bonds = new ArrayList<>();
        for (Bond bond : molecule.bonds()) {
            if ((bond.order() == BondOrder.DOUBLE || bond.order() == BondOrder.TRIPLE)
                    && members.contains(bond.atom1()) && members.contains(bond.atom2())) {
                bonds.add(new MultipleBond(bond.atom1(), bond.atom2(), bond.order()));
            }
        }
        return List.copyOf(bonds);
    }

    static Locant locant(MultipleBond bond, Numbering numbering) {
        Locant a = numbering.locantOf(bond.a());
        Locant b = numbering.locantOf(bond.b());
        Locant low = a.compareTo(b) <= 0 ? a : b;
        Locant high = low == a ? b : a;
        boolean consecutive = !low.hasLetter() && !high.hasLetter() && high.number() == low.number() + 1;
        return consecutive ? low : new Locant(low.number(), low.letter() + "(" + high + ")");
    }

    static List<Locant> locants(List<MultipleBond> bonds, Numbering numbering) {
        return bonds.stream().map(b -> locant(b, numbering)).sorted().toList();
    }

    /**
     * {@code stem} plus its saturation ending: {@code hexane}, {@code hex-1-ene},
     * {@code buta-1,3-diene}, {@code hexa-1,3-dien-5-yne}.
     */
    static String ending(String stem, List<MultipleBond> bonds, Numbering numbering, boolean omitLocants) {
        List<Locant> doubles = bonds.stream().filter(b -> b.order() == BondOrder.DOUBLE)
            .map(b -> locant(b, numbering)).sorted(Comparator.naturalOrder()).toList();
        List<Locant> triples = bonds.stream().filter(b -> b.order() == BondOrder.TRIPLE)
            .map(b -> locant(b, numbering)).sorted(Comparator.naturalOrder()).toList();
        if (doubles.isEmpty() && triples.isEmpty()) {
            return stem + "ane";
        }
        StringBuilder name = new StringBuilder(stem);
        int firstCount = doubles.isEmpty() ? triples.size() : doubles.size();
        if (firstCount > 1) {
            name.append('a');
        }
        if (!doubles.isEmpty()) {
            appendLocants(name, doubles, omitLocants);
            name.append(AlkaneStems.multiplier(doubles.size())).append("en");
            if (triples.isEmpty()) {
                name.append('e');
            }
        }
        if (!triples.isEmpty()) {
            appendLocants(name, triples, omitLocants);
            name.append(AlkaneStems.multiplier(triples.size())).append("yne");
        }
        return name.toString();
    }

    private static void appendLocants(StringBuilder name, List<Locant> locants, boolean omit) {
        if (omit) {
            return;
        }
        name.append('-');
        for (int i = 0; i < locants.size(); i++) {
            if (i > 0) {
                name.append(',');
            }
            name.append(locants.get(i));
        }
        name.append('-');
    }
}
