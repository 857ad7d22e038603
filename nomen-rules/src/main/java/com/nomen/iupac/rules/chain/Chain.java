package com.nomen.iupac.rules.chain;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Collections;

/**
 * An unbranched path of acyclic carbon atoms, in path order.
 */
public record Chain(IntList atoms) {

    public Chain {
        if (atoms.isEmpty()) {
            throw new IllegalArgumentException("Chain must contain at least one atom");
        }
        atoms = IntLists.unmodifiable(new IntArrayList(atoms));
    }

    public static Chain of(int... atoms) {
        return new Chain(IntArrayList.wrap(atoms));
    }

    public int length() {
        return atoms.size();
    }

    public boolean contains(int atom) {
        return atoms.contains(atom);
    }

    public int first() {
        return atoms.getInt(0);
    }

    public int last() {
        return atoms.getInt(atoms.size() - 1);
    }

    public Chain reversed() {
        IntArrayList copy = new IntArrayList(atoms);
        Collections.reverse(copy);
        return new Chain(copy);
    }

    @Override
    public String toString() {
        return "Chain" + atoms;
    }
}
