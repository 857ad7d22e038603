package com.nomen.iupac.ring;

import com.nomen.iupac.graph.Edge;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A fused ring system together with its perimeter: the cycle formed by the
 * bonds that belong to exactly one constituent ring.
 *
 * <p>The perimeter starts at its smallest atom and proceeds towards the smaller
 * of that atom's two perimeter neighbors. Systems whose single-ring bonds do
 * not form one simple cycle have no perimeter.
 */
public record FusedSystem(RingSystem system, IntList perimeter) {

    public FusedSystem {
        perimeter = IntLists.unmodifiable(new IntArrayList(perimeter));
    }

    public static Optional<FusedSystem> of(RingSystem system) {
        Map<Edge, Integer> counts = new HashMap<>();
        for (Ring ring : system.rings()) {
            for (Edge edge : ring.edges()) {
                counts.merge(edge, 1, Integer::sum);
            }
        }
        Int2ObjectOpenHashMap<IntArrayList> adjacency = new Int2ObjectOpenHashMap<>();
        for (Map.Entry<Edge, Integer> entry : counts.entrySet()) {
            if (entry.getValue() == 1) {
                Edge edge = entry.getKey();
                adjacency.computeIfAbsent(edge.u(), k -> new IntArrayList()).add(edge.v());
                adjacency.computeIfAbsent(edge.v(), k -> new IntArrayList()).add(edge.u());
            }
        }
        if (adjacency.isEmpty()) {
            return Optional.empty();
        }
        for (IntArrayList neighbors : adjacency.values()) {
            if (neighbors.size() != 2) {
                return Optional.empty();
            }
        }
        int start = adjacency.keySet().intStream().min().getAsInt();
        IntArrayList startNeighbors = adjacency.get(start);
        int previous = start;
        int current = Math.min(startNeighbors.getInt(0), startNeighbors.getInt(1));
        IntArrayList perimeter = new IntArrayList();
        perimeter.add(start);
        while (current != start) {
            perimeter.add(current);
            IntArrayList neighbors = adjacency.get(current);
            int next = neighbors.getInt(0) == previous ? neighbors.getInt(1) : neighbors.getInt(0);
            previous = current;
            current = next;
            if (perimeter.size() > adjacency.size()) {
                return Optional.empty();
            }
        }
        if (perimeter.size() != adjacency.size()) {
            return Optional.empty();
        }
        return Optional.of(new FusedSystem(system, perimeter));
    }

    /**
     * Ring atoms not on the perimeter.
     */
    public IntList interiorAtoms() {
        IntList interior = new IntArrayList();
        for (int atom : system.atoms()) {
            if (!perimeter.contains(atom)) {
                interior.add(atom);
            }
        }
        return interior;
    }

    /**
     * Perimeter atoms shared by two or more rings.
     */
    public IntList fusionAtoms() {
        IntList fusion = new IntArrayList();
        for (int atom : perimeter) {
            if (system.ringMembership(atom) >= 2) {
                fusion.add(atom);
            }
        }
        return fusion;
    }
}
