package com.nomen.iupac.graph;

/**
 * Undirected edge with endpoints stored in ascending order.
 */
public record Edge(int u, int v) implements Comparable<Edge> {

    public Edge {
        if (u > v) {
            int tmp = u;
            u = v;
            v = tmp;
        }
    }

    public static Edge of(int a, int b) {
        return new Edge(a, b);
    }

    public boolean touches(int node) {
        return u == node || v == node;
    }

    @Override
    public int compareTo(Edge other) {
        int cmp = Integer.compare(u, other.u);
        return cmp != 0 ? cmp : Integer.compare(v, other.v);
    }
}
