package com.nomen.iupac.graph;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Read-only traversals: DFS, BFS, components, shortest and simple paths.
 */
public final class Traversal {

    private Traversal() {
        throw new AssertionError("No instances");
    }

    /**
     * Result of a breadth-first search.
     *
     * @param order     nodes in visit order
     * @param distances hop distance from the start node
     * @param parents   BFS-tree parent of each visited node (start maps to -1)
     */
    public record BfsResult(IntList order, Int2IntMap distances, Int2IntMap parents) {

        public boolean reached(int node) {
            return distances.containsKey(node);
        }
    }

    /**
     * Iterative depth-first visit order from {@code start}.
     */
    public static IntList dfs(Graph graph, int start) {
        IntList order = new IntArrayList();
        if (!graph.hasNode(start)) {
            return order;
        }
        IntSet visited = new IntOpenHashSet();
        IntArrayList stack = new IntArrayList();
        stack.push(start);
        while (!stack.isEmpty()) {
            int node = stack.popInt();
            if (!visited.add(node)) {
                continue;
            }
            order.add(node);
            IntList neighbors = graph.neighbors(node);
            // push in reverse so the smallest neighbor is visited first
            for (int i = neighbors.size() - 1; i >= 0; i--) {
                int next = neighbors.getInt(i);
                if (!visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
        return order;
    }

    public static BfsResult bfs(Graph graph, int start) {
        IntList order = new IntArrayList();
        Int2IntMap distances = new Int2IntOpenHashMap();
        Int2IntMap parents = new Int2IntOpenHashMap();
        if (!graph.hasNode(start)) {
            return new BfsResult(order, distances, parents);
        }
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(start);
        distances.put(start, 0);
        parents.put(start, -1);
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            order.add(node);
            for (int next : graph.neighbors(node)) {
                if (!distances.containsKey(next)) {
                    distances.put(next, distances.get(node) + 1);
                    parents.put(next, node);
                    queue.enqueue(next);
                }
            }
        }
        return new BfsResult(order, distances, parents);
    }

    /**
     * Connected components, each sorted ascending, ordered by smallest member.
     */
    public static List<IntList> connectedComponents(Graph graph) {
        List<IntList> components = new ArrayList<>();
        IntSet seen = new IntOpenHashSet();
        for (int node : graph.nodes()) {
            if (seen.contains(node)) {
                continue;
            }
            int[] members = dfs(graph, node).toIntArray();
            Arrays.sort(members);
            IntList component = new IntArrayList(members);
            seen.addAll(component);
            components.add(component);
        }
        return components;
    }

    /**
     * Shortest path from {@code from} to {@code to}, inclusive; empty when unreachable.
     */
    public static IntList shortestPath(Graph graph, int from, int to) {
        return shortestPath(graph, from, to, IntSets.EMPTY_SET, null);
    }

    /**
     * Shortest path avoiding the {@code forbidden} nodes (endpoints excepted) and,
     * when non-null, the direct edge {@code forbiddenEdge}.
     */
    public static IntList shortestPath(Graph graph, int from, int to, IntSet forbidden, Edge forbiddenEdge) {
        if (!graph.hasNode(from) || !graph.hasNode(to)) {
            return new IntArrayList();
        }
        Int2IntMap parents = new Int2IntOpenHashMap();
        parents.put(from, -1);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(from);
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            if (node == to) {
                break;
            }
            for (int next : graph.neighbors(node)) {
                if (parents.containsKey(next)) {
                    continue;
                }
                if (forbiddenEdge != null && forbiddenEdge.equals(Edge.of(node, next))) {
                    continue;
                }
                if (next != to && forbidden.contains(next)) {
                    continue;
                }
                parents.put(next, node);
                queue.enqueue(next);
            }
        }
        IntArrayList path = new IntArrayList();
        if (!parents.containsKey(to)) {
            return path;
        }
        for (int node = to; node != -1; node = parents.get(node)) {
            path.add(node);
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Every simple path from {@code from} to {@code to}, inclusive of both ends.
     *
     * @param maxNodes upper bound on path node count; {@code <= 0} for unbounded
     */
    public static List<IntList> allSimplePaths(Graph graph, int from, int to, int maxNodes) {
        List<IntList> paths = new ArrayList<>();
        if (!graph.hasNode(from) || !graph.hasNode(to) || from == to) {
            return paths;
        }
        IntArrayList path = new IntArrayList();
        path.add(from);
        IntSet onPath = new IntOpenHashSet();
        onPath.add(from);
        extendPaths(graph, to, maxNodes, path, onPath, paths);
        return paths;
    }

    private static void extendPaths(Graph graph, int to, int maxNodes, IntArrayList path, IntSet onPath,
                                    List<IntList> out) {
        int last = path.getInt(path.size() - 1);
        if (last == to) {
            out.add(new IntArrayList(path));
            return;
        }
        if (maxNodes > 0 && path.size() >= maxNodes) {
            return;
        }
        for (int next : graph.neighbors(last)) {
            if (onPath.add(next)) {
                path.add(next);
                extendPaths(graph, to, maxNodes, path, onPath, out);
                path.removeInt(path.size() - 1);
                onPath.remove(next);
            }
        }
    }
}
