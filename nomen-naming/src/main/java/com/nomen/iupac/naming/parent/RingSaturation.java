package com.nomen.iupac.naming.parent;

import com.nomen.iupac.api.model.Atom;
import com.nomen.iupac.api.model.BondOrder;
import com.nomen.iupac.api.model.Molecule;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.Set;

/**
 * Hydrogenation state of ring atoms relative to the mancude ring.
 *
 * @param saturated  ring atoms with no ring double bond, divalent chalcogens excluded
 * @param divalent   ring O, S, Se, Te atoms
 * @param unsaturated true when some ring atom is aromatic or carries a ring double bond
 * @param triple     true when the ring contains a triple bond
 */
record RingSaturation(IntList saturated, IntList divalent, boolean unsaturated, boolean triple) {

    private static final Set<String> CHALCOGENS = Set.of("O", "S", "Se", "Te");

    static RingSaturation of(Molecule molecule, IntList ringAtoms) {
        IntSet members = new IntOpenHashSet(ringAtoms);
        IntList saturated = new IntArrayList();
        IntList divalent = new IntArrayList();
        boolean unsaturated = false;
        boolean triple = false;
        for (int atom : ringAtoms) {
            Atom a = molecule.atom(atom);
            boolean ringDouble = false;
            for (int neighbor : molecule.neighbors(atom)) {
                if (!members.contains(neighbor)) {
                    continue;
                }
                BondOrder order = molecule.orderBetween(atom, neighbor);
                ringDouble |= order == BondOrder.DOUBLE;
                triple |= order == BondOrder.TRIPLE;
            }
            unsaturated |= ringDouble || a.aromatic();
            if (isDivalentChalcogen(a)) {
                divalent.add(atom);
            } else if (a.aromatic() ? isPyrroleType(molecule, atom) : !ringDouble) {
                saturated.add(atom);
            }
        }
        return new RingSaturation(saturated, divalent, unsaturated, triple);
    }

    static boolean isDivalentChalcogen(Atom atom) {
        return CHALCOGENS.contains(atom.symbol()) && atom.charge() == 0;
    }

    /**
     * Aromatic trivalent N or P contributing a lone pair: bearing hydrogen or a third neighbor.
     */
    static boolean isPyrroleType(Molecule molecule, int atom) {
        Atom a = molecule.atom(atom);
        boolean pnictogen = a.symbol().equals("N") || a.symbol().equals("P");
        return pnictogen && a.charge() == 0 && (molecule.hydrogenCount(atom) > 0 || molecule.heavyDegree(atom) >= 3);
    }
}
