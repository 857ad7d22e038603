package com.nomen.iupac.naming.parent;

import com.nomen.iupac.rules.parent.Numbering;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;

/**
 * Numberings that walk a cycle.
 */
final class RingNumberings {

    private RingNumberings() {
    }

    /**
     * The 2n sequential numberings of a cycle: every start atom, both directions.
     */
    static List<Numbering> around(IntList cycle) {
        int n = cycle.size();
        List<Numbering> numberings = new ArrayList<>(2 * n);
        for (int start = 0; start < n; start++) {
            numberings.add(Numbering.sequential(walk(cycle, start, 1)));
            numberings.add(Numbering.sequential(walk(cycle, start, -1)));
        }
        return numberings;
    }

    static IntList walk(IntList cycle, int start, int direction) {
        int n = cycle.size();
        IntList order = new IntArrayList(n);
        for (int i = 0; i < n; i++) {
            order.add(cycle.getInt(Math.floorMod(start + direction * i, n)));
        }
        return order;
    }
}
