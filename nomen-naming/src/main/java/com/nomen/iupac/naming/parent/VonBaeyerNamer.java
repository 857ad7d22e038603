/*
 * Copyright (c) 2025 Nomen IUPAC Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.nomen.iupac.naming.parent;

import com.nomen.iupac.api.model.Molecule;
import com.nomen.iupac.graph.Edge;
import com.nomen.iupac.graph.Graph;
import com.nomen.iupac.graph.Traversal;
import com.nomen.iupac.naming.stem.AlkaneStems;
import com.nomen.iupac.ring.RingSystem;
import com.nomen.iupac.rules.parent.NamedParent;
import com.nomen.iupac.rules.parent.Numbering;
import com.nomen.iupac.rules.parent.ParentKind;
import com.nomen.iupac.rules.parent.RingParentNamer;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Von Baeyer names of bridged polycyclic systems (P-23.2).
 *
 * <p>Every pair of main bridgeheads and every choice of three internally
 * disjoint paths between them is scored by, in order: largest main ring,
 * largest main bridge, most symmetric division of the main ring, lowest
 * superscript locants of the secondary bridges. Numbering starts at a main
 * bridgehead, runs around the larger branch of the main ring to the other
 * bridgehead, back along the smaller branch, then along the main bridge from
 * the end nearer atom 1. Secondary bridges follow, larger first, each
 * numbered from the end nearer the higher-numbered bridgehead. In the
 * descriptor, secondary bridges are cited larger first and, at equal size,
 * by ascending superscript locants.
 *
 * <p>Secondary bridges that depend on other secondary bridges are not
 * supported; such systems are declined.
 */
public final class VonBaeyerNamer implements RingParentNamer {

    private static final Logger logger = LoggerFactory.getLogger(VonBaeyerNamer.class);

    private static final int MAX_PATHS = 200;
    private static final String ADAMANTANE = "[3.3.1.1^{3,7}]";

    private record Bridge(IntList atoms, int from, int to) {
    }

    private record Layout(int[] key, String descriptor, Numbering numbering) {
    }

    @Override
    public Optional<NamedParent> name(Molecule molecule, RingSystem system) {
        Graph graph = Graph.fromMolecule(molecule).inducedSubgraph(system.atoms());
        int rings = graph.edgeCount() - graph.nodeCount() + 1;
        if (rings < 2) {
            return Optional.empty();
        }
        IntList bridgeheads = new IntArrayList();
        for (int node : graph.nodes()) {
            if (graph.degree(node) >= 3) {
                bridgeheads.add(node);
            }
        }
        bridgeheads.sort(null);
        if (bridgeheads.size() < 2) {
            logger.debug("Fewer than two bridgeheads in {}", system.describe());
            return Optional.empty();
        }

        List<Layout> best = new ArrayList<>();
        for (int i = 0; i < bridgeheads.size(); i++) {
            for (int j = i + 1; j < bridgeheads.size(); j++) {
                List<IntList> paths = Traversal.allSimplePaths(graph, bridgeheads.getInt(i), bridgeheads.getInt(j), 0);
                if (paths.size() > MAX_PATHS) {
                    logger.debug("Too many bridgehead paths ({}) in {}", paths.size(), system.describe());
                    return Optional.empty();
                }
                collectLayouts(graph, paths, best);
            }
        }
        if (best.isEmpty()) {
            logger.debug("No von Baeyer main ring and bridge in {}", system.describe());
            return Optional.empty();
        }

        String descriptor = best.stream().map(Layout::descriptor).min(Comparator.naturalOrder()).orElseThrow();
        Set<Numbering> numberings = new LinkedHashSet<>();
        for (Layout layout : best) {
            if (layout.descriptor().equals(descriptor)) {
                numberings.add(layout.numbering());
            }
        }
        Int2ObjectOpenHashMap<String> heteroatoms = new Int2ObjectOpenHashMap<>();
        for (int atom : system.heteroatoms()) {
            heteroatoms.put(atom, molecule.atom(atom).symbol());
        }
        List<Unsaturation.MultipleBond> bonds = Unsaturation.find(molecule, graph.nodes());
        String retained = rings == 3 && ADAMANTANE.equals(descriptor) && heteroatoms.isEmpty() && bonds.isEmpty()
            ? "adamantane" : null;
        return Optional.of(new AlicyclicParentName(ParentKind.VON_BAEYER, graph.nodes(), List.copyOf(numberings),
            AlkaneStems.cyclicPrefix(rings) + descriptor, bonds, heteroatoms, retained));
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // MAIN RING AND MAIN BRIDGE
    // ════════════════════════════════════════════════════════════════════════════════

    private static void collectLayouts(Graph graph, List<IntList> paths, List<Layout> best) {
        List<IntSet> interiors = new ArrayList<>(paths.size());
        for (IntList path : paths) {
            interiors.add(new IntOpenHashSet(path.subList(1, path.size() - 1)));
        }
        for (int p1 = 0; p1 < paths.size(); p1++) {
            for (int p2 = 0; p2 < paths.size(); p2++) {
                if (p1 == p2 || paths.get(p1).size() < paths.get(p2).size() || !disjoint(interiors.get(p1), interiors.get(p2))) {
                    continue;
                }
                for (int p3 = 0; p3 < paths.size(); p3++) {
                    if (p3 == p1 || p3 == p2 || paths.get(p3).size() > paths.get(p2).size()
                            || !disjoint(interiors.get(p3), interiors.get(p1))
                            || !disjoint(interiors.get(p3), interiors.get(p2))) {
                        continue;
                    }
                    for (boolean reverse : new boolean[]{false, true}) {
                        Layout layout = layout(graph, orient(paths.get(p1), reverse), orient(paths.get(p2), reverse),
                            orient(paths.get(p3), reverse));
                        if (layout != null) {
                            offer(best, layout);
                        }
                    }
                }
            }
        }
    }

    private static void offer(List<Layout> best, Layout layout) {
        if (!best.isEmpty()) {
            int cmp = Arrays.compare(layout.key(), best.get(0).key());
            if (cmp > 0) {
                return;
            }
            if (cmp < 0) {
                best.clear();
            }
        }
        best.add(layout);
    }

    private static IntList orient(IntList path, boolean reverse) {
        if (!reverse) {
            return path;
        }
        IntArrayList copy = new IntArrayList(path);
        Collections.reverse(copy);
        return copy;
    }

    private static boolean disjoint(IntSet a, IntSet b) {
        for (int x : a) {
            if (b.contains(x)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Numbers the system for main branches {@code first} and {@code second} and
     * main bridge {@code bridge}, all running from bridgehead 1 to the other
     * main bridgehead. Returns null when the remaining atoms do not form
     * independent secondary bridges.
     */
    private static Layout layout(Graph graph, IntList first, IntList second, IntList bridge) {
        int head = first.getInt(0);
        int tail = first.getInt(first.size() - 1);
        IntArrayList order = new IntArrayList();
        order.add(head);
        order.addAll(first.subList(1, first.size() - 1));
        order.add(tail);
        for (int k = second.size() - 2; k >= 1; k--) {
            order.add(second.getInt(k));
        }
        order.addAll(bridge.subList(1, bridge.size() - 1));

        Set<Edge> mainEdges = new HashSet<>();
        for (IntList path : List.of(first, second, bridge)) {
            for (int k = 0; k + 1 < path.size(); k++) {
                mainEdges.add(Edge.of(path.getInt(k), path.getInt(k + 1)));
            }
        }
        Int2IntOpenHashMap locant = new Int2IntOpenHashMap();
        for (int k = 0; k < order.size(); k++) {
            locant.put(order.getInt(k), k + 1);
        }
        List<Bridge> secondary = secondaryBridges(graph, locant.keySet(), mainEdges);
        if (secondary == null) {
            return null;
        }
        // bridge atoms are numbered larger bridge first, then from the higher-numbered bridgehead
        secondary.sort(Comparator.comparingInt((Bridge b) -> b.atoms().size()).reversed()
            .thenComparing(Comparator.comparingInt((Bridge b) -> highLocant(locant, b)).reversed()));
        for (Bridge b : secondary) {
            IntList atoms = b.atoms();
            if (locant.get(b.from()) < locant.get(b.to())) {
                atoms = orient(atoms, true);
            }
            for (int atom : atoms) {
                order.add(atom);
                locant.put(atom, order.size());
            }
        }

        // bridges are cited larger first, then by ascending superscript locants
        List<Bridge> cited = new ArrayList<>(secondary);
        cited.sort(Comparator.comparingInt((Bridge b) -> b.atoms().size()).reversed()
            .thenComparingInt(b -> lowLocant(locant, b))
            .thenComparingInt(b -> highLocant(locant, b)));
        StringBuilder descriptor = new StringBuilder("[")
            .append(first.size() - 2).append('.')
            .append(second.size() - 2).append('.')
            .append(bridge.size() - 2);
        IntList superscripts = new IntArrayList();
        for (Bridge b : cited) {
            int lo = lowLocant(locant, b);
            int hi = highLocant(locant, b);
            superscripts.add(lo);
            superscripts.add(hi);
            descriptor.append('.').append(b.atoms().size()).append("^{").append(lo).append(',').append(hi).append('}');
        }
        descriptor.append(']');
        if (order.size() != graph.nodeCount()) {
            return null;
        }

        int mainRing = first.size() + second.size() - 2;
        int[] key = new int[3 + superscripts.size()];
        key[0] = -mainRing;
        key[1] = -(bridge.size() - 2);
        key[2] = first.size() - second.size();
        int[] sorted = superscripts.toIntArray();
        Arrays.sort(sorted);
        System.arraycopy(sorted, 0, key, 3, sorted.length);
        return new Layout(key, descriptor.toString(), Numbering.sequential(order));
    }

    private static int lowLocant(Int2IntOpenHashMap locant, Bridge bridge) {
        return Math.min(locant.get(bridge.from()), locant.get(bridge.to()));
    }

    private static int highLocant(Int2IntOpenHashMap locant, Bridge bridge) {
        return Math.max(locant.get(bridge.from()), locant.get(bridge.to()));
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // SECONDARY BRIDGES
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Bridges left after the main ring and main bridge: bonds between numbered
     * atoms (zero-atom bridges) and unbranched paths of unnumbered atoms whose
     * two ends attach to numbered atoms. Atoms of each bridge are listed from
     * its {@code from} end.
     */
    private static List<Bridge> secondaryBridges(Graph graph, IntSet numbered, Set<Edge> mainEdges) {
        List<Bridge> bridges = new ArrayList<>();
        for (Edge edge : graph.edges()) {
            if (numbered.contains(edge.u()) && numbered.contains(edge.v()) && !mainEdges.contains(edge)) {
                bridges.add(new Bridge(new IntArrayList(), edge.u(), edge.v()));
            }
        }
        IntList rest = new IntArrayList();
        for (int node : graph.nodes()) {
            if (!numbered.contains(node)) {
                rest.add(node);
            }
        }
        if (rest.isEmpty()) {
            return bridges;
        }
        Graph remainder = graph.inducedSubgraph(rest);
        for (IntList component : Traversal.connectedComponents(remainder)) {
            Bridge bridge = asBridge(graph, remainder, component, numbered);
            if (bridge == null) {
                return null;
            }
            bridges.add(bridge);
        }
        return bridges;
    }

    private static Bridge asBridge(Graph graph, Graph remainder, IntList component, IntSet numbered) {
        int start = -1;
        for (int node : component) {
            if (remainder.degree(node) > 2) {
                return null;
            }
            if (remainder.degree(node) <= 1 && start < 0) {
                start = node;
            }
        }
        if (start < 0) {
            return null;
        }
        IntArrayList atoms = new IntArrayList();
        int previous = -1;
        int current = start;
        while (current >= 0) {
            atoms.add(current);
            int next = -1;
            for (int neighbor : remainder.neighbors(current)) {
                if (neighbor != previous) {
                    next = neighbor;
                }
            }
            previous = current;
            current = next;
        }
        IntList fromEnd = attachments(graph, atoms.getInt(0), numbered);
        IntList toEnd = attachments(graph, atoms.getInt(atoms.size() - 1), numbered);
        if (atoms.size() == 1) {
            return fromEnd.size() == 2 ? new Bridge(atoms, fromEnd.getInt(0), fromEnd.getInt(1)) : null;
        }
        for (int k = 1; k < atoms.size() - 1; k++) {
            if (!attachments(graph, atoms.getInt(k), numbered).isEmpty()) {
                return null;
            }
        }
        if (fromEnd.size() != 1 || toEnd.size() != 1) {
            return null;
        }
        return new Bridge(atoms, fromEnd.getInt(0), toEnd.getInt(0));
    }

    private static IntList attachments(Graph graph, int node, IntSet numbered) {
        IntList result = new IntArrayList();
        for (int neighbor : graph.neighbors(node)) {
            if (numbered.contains(neighbor)) {
                result.add(neighbor);
            }
        }
        return result;
    }
}
