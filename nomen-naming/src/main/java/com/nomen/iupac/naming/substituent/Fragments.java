package com.nomen.iupac.naming.substituent;

import com.nomen.iupac.api.model.Molecule;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.function.IntPredicate;

/**
 * Flood fill over heavy atoms.
 */
public final class Fragments {

    private Fragments() {
    }

    /**
     * Heavy atoms reachable from {@code start} without entering a {@code blocked}
     * atom, ascending. {@code start} itself must not be blocked.
     */
    public static IntList collect(Molecule molecule, int start, IntPredicate blocked) {
        IntSet seen = new IntOpenHashSet();
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        seen.add(start);
        queue.enqueue(start);
        while (!queue.isEmpty()) {
            int atom = queue.dequeueInt();
            for (int neighbor : molecule.neighbors(atom)) {
                if (seen.contains(neighbor) || blocked.test(neighbor) || molecule.atom(neighbor).isHydrogen()) {
                    continue;
                }
                seen.add(neighbor);
                queue.enqueue(neighbor);
            }
        }
        IntArrayList atoms = new IntArrayList(seen);
        atoms.sort(null);
        return atoms;
    }
}
