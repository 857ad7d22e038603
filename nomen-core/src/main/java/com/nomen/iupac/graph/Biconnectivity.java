package com.nomen.iupac.graph;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Articulation points, biconnected components and bridges by Tarjan's
 * low-link depth-first search.
 *
 * <p>One search computes all three; each public method runs a fresh search
 * over the given graph and returns independent collections.
 */
public final class Biconnectivity {

    private final Graph graph;
    private final Int2IntMap disc = new Int2IntOpenHashMap();
    private final Int2IntMap low = new Int2IntOpenHashMap();
    private final IntSortedSet articulationPoints = new IntRBTreeSet();
    private final List<Set<Edge>> components = new ArrayList<>();
    private final List<Edge> bridges = new ArrayList<>();
    private final Deque<Edge> edgeStack = new ArrayDeque<>();
    private int time;

    private Biconnectivity(Graph graph) {
        this.graph = graph;
        for (int node : graph.nodes()) {
            if (!disc.containsKey(node)) {
                visit(node, -1);
                if (!edgeStack.isEmpty()) {
                    popComponent(null);
                }
            }
        }
        bridges.sort(null);
    }

    public static IntSortedSet articulationPoints(Graph graph) {
        return new Biconnectivity(graph).articulationPoints;
    }

    /**
     * Edge sets of the biconnected components, in discovery order.
     */
    public static List<Set<Edge>> biconnectedComponents(Graph graph) {
        return new Biconnectivity(graph).components;
    }

    /**
     * Edges whose removal disconnects the graph, sorted.
     */
    public static List<Edge> bridges(Graph graph) {
        return new Biconnectivity(graph).bridges;
    }

    private void visit(int node, int parent) {
        disc.put(node, time);
        low.put(node, time);
        time++;
        int children = 0;
        for (int next : graph.neighbors(node)) {
            if (!disc.containsKey(next)) {
                children++;
                Edge edge = Edge.of(node, next);
                edgeStack.push(edge);
                visit(next, node);
                low.put(node, Math.min(low.get(node), low.get(next)));

                if (low.get(next) > disc.get(node)) {
                    bridges.add(edge);
                }
                boolean isRoot = parent == -1;
                if ((isRoot && children > 1) || (!isRoot && low.get(next) >= disc.get(node))) {
                    articulationPoints.add(node);
                }
                if (low.get(next) >= disc.get(node)) {
                    popComponent(edge);
                }
            } else if (next != parent && disc.get(next) < disc.get(node)) {
                edgeStack.push(Edge.of(node, next));
                low.put(node, Math.min(low.get(node), disc.get(next)));
            }
        }
    }

    private void popComponent(Edge until) {
        Set<Edge> component = new TreeSet<>();
        while (!edgeStack.isEmpty()) {
            Edge edge = edgeStack.pop();
            component.add(edge);
            if (edge.equals(until)) {
                break;
            }
        }
        if (!component.isEmpty()) {
            components.add(component);
        }
    }
}
