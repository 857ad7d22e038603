package com.nomen.iupac.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CycleFinderTest {

    private static Graph ring(int size) {
        Graph graph = new Graph();
        for (int i = 0; i < size; i++) {
            graph.addEdge(i, (i + 1) % size);
        }
        return graph;
    }

    @Test
    @DisplayName("Canonical form is shared by every rotation and reflection")
    void canonicalizeInvariant() {
        IntList expected = IntArrayList.wrap(new int[]{1, 4, 7, 9, 12});
        int[] cycle = {7, 9, 12, 1, 4};

        for (int shift = 0; shift < cycle.length; shift++) {
            IntArrayList rotated = new IntArrayList();
            IntArrayList reflected = new IntArrayList();
            for (int i = 0; i < cycle.length; i++) {
                rotated.add(cycle[(shift + i) % cycle.length]);
                reflected.add(cycle[((shift - i) % cycle.length + cycle.length) % cycle.length]);
            }
            assertThat(CycleFinder.canonicalize(rotated).toIntArray()).containsExactly(expected.toIntArray());
            assertThat(CycleFinder.canonicalize(reflected).toIntArray()).containsExactly(expected.toIntArray());
        }
    }

    @Test
    @DisplayName("Canonicalization is idempotent")
    void canonicalizeIdempotent() {
        IntList once = CycleFinder.canonicalize(IntArrayList.wrap(new int[]{5, 3, 8, 2}));

        assertThat(CycleFinder.canonicalize(once).toIntArray()).containsExactly(once.toIntArray());
        assertThat(CycleFinder.canonicalKey(once)).isEqualTo("2,5,3,8");
    }

    @Test
    @DisplayName("Two triangles sharing an edge have three simple cycles and a basis of two")
    void sharedEdgeTriangles() {
        Graph graph = new Graph();
        graph.addEdge(0, 1);
        graph.addEdge(1, 2);
        graph.addEdge(2, 0);
        graph.addEdge(1, 3);
        graph.addEdge(3, 2);

        List<IntList> cycles = CycleFinder.allSimpleCycles(graph, 10);
        List<IntList> basis = CycleFinder.minimumCycleBasis(graph, cycles);

        assertThat(cycles).hasSize(3);
        assertThat(basis).hasSize(2);
        assertThat(basis).allSatisfy(cycle -> assertThat(cycle.size()).isEqualTo(3));
    }

    @Test
    @DisplayName("Basis size equals |E| - |V| + |C| across components")
    void basisSizeEqualsCycleRank() {
        Graph graph = ring(6);
        for (int i = 10; i < 15; i++) {
            graph.addEdge(i, i == 14 ? 10 : i + 1);
        }
        graph.addEdge(10, 12);
        graph.addEdge(20, 21);

        List<IntList> basis = CycleFinder.minimumCycleBasis(graph);

        assertThat(CycleFinder.cycleRank(graph)).isEqualTo(3);
        assertThat(basis).hasSize(3);
    }

    @Test
    @DisplayName("Cube graph basis is five four-membered rings")
    void cubeBasis() {
        Graph cube = new Graph();
        int[][] edges = {{0, 1}, {1, 2}, {2, 3}, {3, 0}, {4, 5}, {5, 6}, {6, 7}, {7, 4},
                {0, 4}, {1, 5}, {2, 6}, {3, 7}};
        for (int[] edge : edges) {
            cube.addEdge(edge[0], edge[1]);
        }

        List<IntList> basis = CycleFinder.minimumCycleBasis(cube);

        assertThat(basis).hasSize(5);
        assertThat(basis).allSatisfy(cycle -> assertThat(cycle.size()).isEqualTo(4));
    }

    @Test
    @DisplayName("Length bound excludes longer cycles")
    void lengthBound() {
        assertThat(CycleFinder.allSimpleCycles(ring(8), 6)).isEmpty();
        assertThat(CycleFinder.allSimpleCycles(ring(8), 8)).hasSize(1);
    }

    @Test
    @DisplayName("Dense graphs get a tighter cycle-length bound")
    void adaptiveBound() {
        assertThat(CycleFinder.adaptiveMaxLength(50, 40, 40)).isEqualTo(40);
        assertThat(CycleFinder.adaptiveMaxLength(50, 60, 40)).isEqualTo(18);
        assertThat(CycleFinder.adaptiveMaxLength(200, 215, 40)).isEqualTo(20);
    }
}
