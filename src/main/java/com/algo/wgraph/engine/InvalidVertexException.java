package com.algo.wgraph.engine;

/**
 * Thrown when an operation that requires a known vertex is given an identifier
 * the graph has never seen, e.g. the start of a shortest-path query.
 */
public class InvalidVertexException extends IllegalArgumentException {
    private final String vertex;

    public InvalidVertexException(String vertex) {
        super("Unknown vertex: " + vertex);
        this.vertex = vertex;
    }

    public String vertex() {
        return vertex;
    }
}
