package com.algo.wgraph.engine;

import com.algo.wgraph.api.PathResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of one Dijkstra run: best distance and predecessor for every vertex.
 *
 * Unreachable vertices have distance {@link Double#POSITIVE_INFINITY} and no
 * predecessor. The start vertex has distance 0 and no predecessor.
 * Immutable; reuse it to answer several path queries from the same source.
 */
public final class ShortestPathTree {
    private final String start;
    private final Map<String, Double> distances;
    private final Map<String, String> predecessors;

    ShortestPathTree(String start, Map<String, Double> distances, Map<String, String> predecessors) {
        this.start = start;
        this.distances = Collections.unmodifiableMap(distances);
        this.predecessors = Collections.unmodifiableMap(predecessors);
    }

    public String start() {
        return start;
    }

    /** Distances keyed by vertex, in the graph's vertex order. */
    public Map<String, Double> distances() {
        return distances;
    }

    /**
     * @throws InvalidVertexException if the vertex was not in the graph when the
     *                                tree was computed.
     */
    public double distanceTo(String vertex) {
        Double d = distances.get(vertex);
        if (d == null)
            throw new InvalidVertexException(vertex);
        return d;
    }

    public boolean isReachable(String vertex) {
        return distanceTo(vertex) != Double.POSITIVE_INFINITY;
    }

    public Optional<String> predecessor(String vertex) {
        return Optional.ofNullable(predecessors.get(vertex));
    }

    /**
     * Rebuilds the path to {@code end} by walking predecessors back to the
     * start.
     *
     * @return the path with its cost; a no-path result if {@code end} is
     *         unreachable; {@code [start]} at cost 0 if {@code end} is the start.
     * @throws InvalidVertexException if {@code end} is unknown.
     */
    public PathResult pathTo(String end) {
        double cost = distanceTo(end);
        if (cost == Double.POSITIVE_INFINITY)
            return PathResult.noPath(start, end);

        List<String> reversed = new ArrayList<>();
        String current = end;
        reversed.add(current);
        while (!current.equals(start)) {
            current = predecessors.get(current);
            reversed.add(current);
        }
        Collections.reverse(reversed);
        return PathResult.of(start, end, cost, reversed);
    }
}
