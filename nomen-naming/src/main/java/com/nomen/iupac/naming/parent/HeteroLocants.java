package com.nomen.iupac.naming.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.naming.stem.ReplacementPrefix;
import com.nomen.iupac.rules.parent.Locant;
import com.nomen.iupac.rules.parent.Numbering;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Heteroatom locant rule shared by every ring nomenclature: lowest locants to
 * the heteroatoms considered together, then to each element in the order
 * O, S, Se, Te, N, P, As, Sb, Bi, Si, Ge, Sn, Pb, B.
 */
public final class HeteroLocants {

    private HeteroLocants() {
    }

    /**
     * Orders numberings so that the preferred one for {@code heteroatoms} comes first.
     */
    public static Comparator<Numbering> comparator(Molecule molecule, IntList heteroatoms) {
        Map<String, IntList> byElement = new TreeMap<>(ReplacementPrefix.SENIORITY);
        for (int atom : heteroatoms) {
            byElement.computeIfAbsent(molecule.atom(atom).symbol(), k -> new IntArrayList()).add(atom);
        }
        List<IntList> groups = new ArrayList<>(byElement.values());
        return (a, b) -> {
            int cmp = Locants.compare(a.locantsOf(heteroatoms), b.locantsOf(heteroatoms));
            for (int i = 0; cmp == 0 && i < groups.size(); i++) {
                cmp = Locants.compare(a.locantsOf(groups.get(i)), b.locantsOf(groups.get(i)));
            }
            return cmp;
        };
    }

    /**
     * The numberings that rank first under {@link #comparator}.
     */
    public static List<Numbering> lowest(Molecule molecule, List<Numbering> numberings, IntList heteroatoms) {
        if (heteroatoms.isEmpty() || numberings.size() < 2) {
            return numberings;
        }
        Comparator<Numbering> order = comparator(molecule, heteroatoms);
        Numbering best = numberings.stream().min(order).orElseThrow();
        return numberings.stream().filter(n -> order.compare(n, best) == 0).toList();
    }

    /**
     * Element-and-locant signature under {@code numbering}, e.g. {@code O1,N3}.
     */
    static String signature(Molecule molecule, Numbering numbering, IntList heteroatoms) {
        List<String> parts = new ArrayList<>();
        IntArrayList ordered = new IntArrayList(heteroatoms);
        ordered.sort((x, y) -> numbering.locantOf(x).compareTo(numbering.locantOf(y)));
        for (int atom : ordered) {
            Locant locant = numbering.locantOf(atom);
            parts.add(molecule.atom(atom).symbol() + locant);
        }
        return String.join(",", parts);
    }
}
