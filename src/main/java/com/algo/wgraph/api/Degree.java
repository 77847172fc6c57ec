package com.algo.wgraph.api;

/**
 * Degree of a single vertex.
 *
 * <p>
 * The shape depends on the graph's directedness at query time:
 * <ul>
 * <li>Undirected: a single count, the length of the vertex's neighbor list.
 * Read it with {@link #value()}.</li>
 * <li>Directed: an in/out pair. Out-degree is the neighbor-list length;
 * in-degree is the number of vertices whose neighbor list contains the
 * vertex.</li>
 * </ul>
 *
 * For undirected degrees {@code inDegree == outDegree == value()}.
 */
public record Degree(boolean directed, int inDegree, int outDegree) {

    public static Degree undirected(int degree) {
        return new Degree(false, degree, degree);
    }

    public static Degree directed(int inDegree, int outDegree) {
        return new Degree(true, inDegree, outDegree);
    }

    /**
     * Returns the undirected degree.
     *
     * @throws IllegalStateException if this is a directed in/out pair.
     */
    public int value() {
        if (directed)
            throw new IllegalStateException("Directed degree has no single value: " + this);
        return outDegree;
    }

    @Override
    public String toString() {
        return directed ? "In: " + inDegree + ", Out: " + outDegree : String.valueOf(outDegree);
    }
}
