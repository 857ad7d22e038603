package com.nomen.iupac.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BiconnectivityTest {

    /**
     * Two triangles joined by the bridge 2-3.
     */
    private static Graph bowTieWithBridge() {
        Graph graph = new Graph();
        graph.addEdge(0, 1);
        graph.addEdge(1, 2);
        graph.addEdge(2, 0);
        graph.addEdge(2, 3);
        graph.addEdge(3, 4);
        graph.addEdge(4, 5);
        graph.addEdge(5, 3);
        return graph;
    }

    @Test
    @DisplayName("Bridge endpoints are articulation points")
    void articulationPoints() {
        assertThat(Biconnectivity.articulationPoints(bowTieWithBridge())).containsExactly(2, 3);
    }

    @Test
    @DisplayName("Only the connecting edge is a bridge")
    void bridges() {
        assertThat(Biconnectivity.bridges(bowTieWithBridge())).containsExactly(Edge.of(2, 3));
    }

    @Test
    @DisplayName("Two triangles and the bridge are three biconnected components")
    void components() {
        assertThat(Biconnectivity.biconnectedComponents(bowTieWithBridge()))
                .extracting(java.util.Set::size)
                .containsExactlyInAnyOrder(3, 1, 3);
    }

    @Test
    @DisplayName("A cycle has no bridges or articulation points")
    void cycle() {
        Graph ring = new Graph();
        for (int i = 0; i < 5; i++) {
            ring.addEdge(i, (i + 1) % 5);
        }

        assertThat(Biconnectivity.bridges(ring)).isEmpty();
        assertThat(Biconnectivity.articulationPoints(ring)).isEmpty();
        assertThat(Biconnectivity.biconnectedComponents(ring)).hasSize(1);
    }
}
