/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.graph;

import com.nomen.iupac.api.model.Bond;
import com.nomen.iupac.api.model.Molecule;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Undirected simple graph over integer node ids.
 *
 * <p>Nodes and neighbor sets are kept sorted, so every traversal built on top
 * of this class visits nodes in a deterministic order. {@link #addNode} and
 * {@link #addEdge} are idempotent. The algorithms in {@link Traversal},
 * {@link CycleFinder} and {@link Biconnectivity} only read the graph.
 */
public final class Graph {

    private final Int2ObjectMap<IntSortedSet> adjacency = new Int2ObjectRBTreeMap<>();
    private int edgeCount;

    /**
     * Builds the heavy-atom graph of a molecule: one node per atom, one edge per bond.
     */
    public static Graph fromMolecule(Molecule molecule) {
        Graph graph = new Graph();
        for (int i = 0; i < molecule.atomCount(); i++) {
            graph.addNode(i);
        }
        for (Bond bond : molecule.bonds()) {
            graph.addEdge(bond.atom1(), bond.atom2());
        }
        return graph;
    }

    /**
     * Adds a node.
     *
     * @return true if the node was not present before
     */
    public boolean addNode(int node) {
        if (adjacency.containsKey(node)) {
            return false;
        }
        adjacency.put(node, new IntRBTreeSet());
        return true;
    }

    /**
     * Adds an undirected edge, creating missing endpoints.
     *
     * @return true if the edge was not present before
     * @throws IllegalArgumentException for a self-loop
     */
    public boolean addEdge(int u, int v) {
        if (u == v) {
            throw new IllegalArgumentException("Self-loop on node " + u);
        }
        addNode(u);
        addNode(v);
        boolean added = adjacency.get(u).add(v);
        if (added) {
            adjacency.get(v).add(u);
            edgeCount++;
        }
        return added;
    }

    public boolean hasNode(int node) {
        return adjacency.containsKey(node);
    }

    public boolean hasEdge(int u, int v) {
        IntSortedSet neighbors = adjacency.get(u);
        return neighbors != null && neighbors.contains(v);
    }

    /**
     * Sorted neighbors of {@code node}; empty for an unknown node.
     */
    public IntList neighbors(int node) {
        IntSortedSet neighbors = adjacency.get(node);
        if (neighbors == null) {
            return IntLists.EMPTY_LIST;
        }
        return IntLists.unmodifiable(new IntArrayList(neighbors));
    }

    public int degree(int node) {
        IntSortedSet neighbors = adjacency.get(node);
        return neighbors == null ? 0 : neighbors.size();
    }

    /**
     * Node ids in ascending order.
     */
    public IntList nodes() {
        return IntLists.unmodifiable(new IntArrayList(adjacency.keySet()));
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    /**
     * All edges in ascending order.
     */
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>(edgeCount);
        for (Int2ObjectMap.Entry<IntSortedSet> entry : adjacency.int2ObjectEntrySet()) {
            int u = entry.getIntKey();
            for (int v : entry.getValue()) {
                if (u < v) {
                    edges.add(new Edge(u, v));
                }
            }
        }
        return edges;
    }

    /**
     * Returns the subgraph induced by {@code keep}: those nodes and every edge
     * between two of them. Unknown ids are ignored.
     */
    public Graph inducedSubgraph(IntCollection keep) {
        Graph sub = new Graph();
        for (int node : keep) {
            if (hasNode(node)) {
                sub.addNode(node);
            }
        }
        for (int node : sub.nodes()) {
            for (int neighbor : adjacency.get(node)) {
                if (node < neighbor && sub.hasNode(neighbor)) {
                    sub.addEdge(node, neighbor);
                }
            }
        }
        return sub;
    }

    /**
     * Returns a copy of this graph without {@code node} and its edges.
     */
    public Graph without(int node) {
        IntArrayList keep = new IntArrayList(adjacency.keySet());
        keep.rem(node);
        return inducedSubgraph(keep);
    }

    @Override
    public String toString() {
        return "Graph{nodes=" + nodeCount() + ", edges=" + edgeCount + "}";
    }
}
