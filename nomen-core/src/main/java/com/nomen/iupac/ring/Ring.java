package com.nomen.iupac.ring;

import com.nomen.iupac.graph.Edge;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered cycle of atom indices. Consecutive atoms, including the last and
 * the first, are bonded.
 */
public record Ring(IntList atoms) {

    public Ring {
        if (atoms.size() < 3) {
            throw new IllegalArgumentException("A ring needs at least 3 atoms, got " + atoms);
        }
        atoms = IntLists.unmodifiable(new IntArrayList(atoms));
    }

    public static Ring of(int... atoms) {
        return new Ring(IntArrayList.wrap(atoms));
    }

    public int size() {
        return atoms.size();
    }

    public int atomAt(int position) {
        return atoms.getInt(Math.floorMod(position, atoms.size()));
    }

    public boolean contains(int atom) {
        return atoms.contains(atom);
    }

    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>(atoms.size());
        for (int i = 0; i < atoms.size(); i++) {
            edges.add(Edge.of(atoms.getInt(i), atomAt(i + 1)));
        }
        return edges;
    }

    public boolean containsEdge(Edge edge) {
        int i = atoms.indexOf(edge.u());
        if (i < 0) {
            return false;
        }
        return atomAt(i + 1) == edge.v() || atomAt(i - 1) == edge.v();
    }

    public IntSet sharedAtoms(Ring other) {
        IntSet shared = new IntOpenHashSet();
        for (int atom : atoms) {
            if (other.contains(atom)) {
                shared.add(atom);
            }
        }
        return shared;
    }

    public List<Edge> sharedEdges(Ring other) {
        List<Edge> shared = new ArrayList<>();
        for (Edge edge : edges()) {
            if (other.containsEdge(edge)) {
                shared.add(edge);
            }
        }
        return shared;
    }
}
