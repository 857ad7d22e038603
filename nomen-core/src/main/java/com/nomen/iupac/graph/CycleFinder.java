/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simple-cycle enumeration and minimum cycle basis (SSSR) selection.
 *
 * <h2>Canonical form</h2>
 * <p>A cycle is canonical when it starts at its smallest node and, of the two
 * traversal directions from there, is the lexicographically smaller one. All
 * rotations and reflections of one physical ring share a canonical form, so
 * the canonical string doubles as a deduplication key.
 *
 * <h2>Basis selection</h2>
 * <p>Cycles are sorted by length and accepted greedily while each one brings
 * at least one edge not yet covered, until {@code |E| - |V| + |C|} cycles are
 * accepted. Any shortfall is topped up with the shortest remaining cycles that
 * are independent over GF(2) of those already chosen.
 */
public final class CycleFinder {

    private static final Logger logger = LoggerFactory.getLogger(CycleFinder.class);

    /**
     * Default bound on enumerated cycle length.
     */
    public static final int DEFAULT_MAX_LENGTH = 40;

    private static final Comparator<IntList> BY_LENGTH_THEN_NODES = Comparator
            .<IntList>comparingInt(cycle -> cycle.size())
            .thenComparing(CycleFinder::compareLexicographically);

    private CycleFinder() {
        throw new AssertionError("No instances");
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // CANONICALIZATION
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Rotates {@code cycle} to its smallest node and picks the smaller direction.
     * Idempotent.
     */
    public static IntList canonicalize(IntList cycle) {
        int n = cycle.size();
        if (n == 0) {
            return new IntArrayList();
        }
        int minPos = 0;
        for (int i = 1; i < n; i++) {
            if (cycle.getInt(i) < cycle.getInt(minPos)) {
                minPos = i;
            }
        }
        IntArrayList forward = new IntArrayList(n);
        IntArrayList backward = new IntArrayList(n);
        for (int i = 0; i < n; i++) {
            forward.add(cycle.getInt((minPos + i) % n));
            backward.add(cycle.getInt(((minPos - i) % n + n) % n));
        }
        return compareLexicographically(forward, backward) <= 0 ? forward : backward;
    }

    public static String canonicalKey(IntList cycle) {
        IntList canonical = canonicalize(cycle);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < canonical.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(canonical.getInt(i));
        }
        return sb.toString();
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // ENUMERATION
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Shrinks the requested cycle-length bound for dense graphs, where the number
     * of simple cycles grows fastest.
     */
    public static int adaptiveMaxLength(int nodes, int edges, int requested) {
        if (nodes == 0) {
            return requested;
        }
        double density = (double) edges / nodes;
        int limit = requested;
        if (density >= 1.15) {
            if (nodes > 150) {
                limit = Math.min(limit, 15);
            } else if (nodes > 100) {
                limit = Math.min(limit, 16);
            } else if (nodes > 60) {
                limit = Math.min(limit, 17);
            } else {
                limit = Math.min(limit, 18);
            }
        } else if (density >= 1.05) {
            if (nodes > 150) {
                limit = Math.min(limit, 20);
            } else if (nodes > 100) {
                limit = Math.min(limit, 22);
            } else if (nodes > 60) {
                limit = Math.min(limit, 25);
            }
        }
        return limit;
    }

    /**
     * Every simple cycle of length 3..{@code maxLength}, canonicalized, sorted by
     * length then node sequence.
     */
    public static List<IntList> allSimpleCycles(Graph graph, int maxLength) {
        Graph core = twoCore(graph);
        Map<String, IntList> unique = new LinkedHashMap<>();
        for (int start : core.nodes()) {
            IntArrayList path = new IntArrayList();
            path.add(start);
            IntSet onPath = new IntOpenHashSet();
            onPath.add(start);
            search(core, start, maxLength, path, onPath, unique);
        }
        List<IntList> cycles = new ArrayList<>(unique.values());
        cycles.sort(BY_LENGTH_THEN_NODES);
        logger.debug("Enumerated {} simple cycles (max length {})", cycles.size(), maxLength);
        return cycles;
    }

    public static List<IntList> allSimpleCycles(Graph graph) {
        return allSimpleCycles(graph, adaptiveMaxLength(graph.nodeCount(), graph.edgeCount(), DEFAULT_MAX_LENGTH));
    }

    private static void search(Graph graph, int start, int maxLength, IntArrayList path, IntSet onPath,
                               Map<String, IntList> out) {
        int last = path.getInt(path.size() - 1);
        for (int next : graph.neighbors(last)) {
            if (next == start && path.size() >= 3) {
                IntList canonical = canonicalize(path);
                out.putIfAbsent(canonicalKey(canonical), canonical);
                continue;
            }
            // only nodes above the start, so each cycle is rooted at its minimum
            if (next <= start || onPath.contains(next) || path.size() >= maxLength) {
                continue;
            }
            path.add(next);
            onPath.add(next);
            search(graph, start, maxLength, path, onPath, out);
            onPath.remove(next);
            path.removeInt(path.size() - 1);
        }
    }

    /**
     * Repeatedly strips nodes of degree below 2; only the remainder can lie on a cycle.
     */
    static Graph twoCore(Graph graph) {
        IntSet removed = new IntOpenHashSet();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int node : graph.nodes()) {
                if (removed.contains(node)) {
                    continue;
                }
                int live = 0;
                for (int neighbor : graph.neighbors(node)) {
                    if (!removed.contains(neighbor)) {
                        live++;
                    }
                }
                if (live < 2) {
                    removed.add(node);
                    changed = true;
                }
            }
        }
        IntArrayList keep = new IntArrayList();
        for (int node : graph.nodes()) {
            if (!removed.contains(node)) {
                keep.add(node);
            }
        }
        return graph.inducedSubgraph(keep);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // MINIMUM CYCLE BASIS
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Cyclomatic number {@code |E| - |V| + |C|}.
     */
    public static int cycleRank(Graph graph) {
        return graph.edgeCount() - graph.nodeCount() + Traversal.connectedComponents(graph).size();
    }

    public static List<IntList> minimumCycleBasis(Graph graph) {
        return minimumCycleBasis(graph, allSimpleCycles(graph));
    }

    /**
     * Selects the smallest set of smallest rings from pre-enumerated {@code cycles}.
     */
    public static List<IntList> minimumCycleBasis(Graph graph, List<IntList> cycles) {
        int target = cycleRank(graph);
        List<IntList> basis = new ArrayList<>(target);
        if (target <= 0) {
            return basis;
        }
        Object2IntMap<Edge> edgeIndex = new Object2IntOpenHashMap<>();
        for (Edge edge : graph.edges()) {
            edgeIndex.put(edge, edgeIndex.size());
        }
        List<IntList> sorted = new ArrayList<>(cycles);
        sorted.sort(BY_LENGTH_THEN_NODES);

        BitSet covered = new BitSet();
        List<BitSet> reduced = new ArrayList<>();
        List<Integer> pivots = new ArrayList<>();
        List<IntList> leftovers = new ArrayList<>();

        for (IntList cycle : sorted) {
            if (basis.size() >= target) {
                break;
            }
            BitSet vector = edgeVector(cycle, edgeIndex);
            BitSet fresh = (BitSet) vector.clone();
            fresh.andNot(covered);
            if (!fresh.isEmpty()) {
                basis.add(cycle);
                covered.or(vector);
                addToEliminationBasis(vector, reduced, pivots);
            } else {
                leftovers.add(cycle);
            }
        }

        for (IntList cycle : leftovers) {
            if (basis.size() >= target) {
                break;
            }
            if (addToEliminationBasis(edgeVector(cycle, edgeIndex), reduced, pivots)) {
                basis.add(cycle);
            }
        }

        if (basis.size() < target) {
            logger.debug("Cycle basis incomplete: {} of {} (cycle length bound too small?)", basis.size(), target);
        }
        basis.sort(BY_LENGTH_THEN_NODES);
        return basis;
    }

    private static BitSet edgeVector(IntList cycle, Object2IntMap<Edge> edgeIndex) {
        BitSet vector = new BitSet(edgeIndex.size());
        int n = cycle.size();
        for (int i = 0; i < n; i++) {
            Edge edge = Edge.of(cycle.getInt(i), cycle.getInt((i + 1) % n));
            if (edgeIndex.containsKey(edge)) {
                vector.set(edgeIndex.getInt(edge));
            }
        }
        return vector;
    }

    /**
     * Gaussian elimination over GF(2).
     *
     * @return true if {@code vector} was independent and has been added
     */
    private static boolean addToEliminationBasis(BitSet vector, List<BitSet> reduced, List<Integer> pivots) {
        BitSet work = (BitSet) vector.clone();
        for (int i = 0; i < reduced.size(); i++) {
            if (work.get(pivots.get(i))) {
                work.xor(reduced.get(i));
            }
        }
        if (work.isEmpty()) {
            return false;
        }
        reduced.add(work);
        pivots.add(work.nextSetBit(0));
        return true;
    }

    static int compareLexicographically(IntList a, IntList b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int cmp = Integer.compare(a.getInt(i), b.getInt(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
