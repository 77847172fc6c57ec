package com.algo.wgraph.api;

import java.util.List;

/**
 * Outcome of a single shortest-path query.
 *
 * When no path exists {@code found} is false, the path is empty and the cost
 * is {@link Double#POSITIVE_INFINITY}.
 */
public record PathResult(String start, String end, boolean found, double cost, List<String> path) {

    public PathResult {
        path = List.copyOf(path);
    }

    public static PathResult of(String start, String end, double cost, List<String> path) {
        return new PathResult(start, end, true, cost, path);
    }

    public static PathResult noPath(String start, String end) {
        return new PathResult(start, end, false, Double.POSITIVE_INFINITY, List.of());
    }

    /** Number of edges along the path, 0 for a single-vertex path or no path. */
    public int hops() {
        return path.isEmpty() ? 0 : path.size() - 1;
    }

    @Override
    public String toString() {
        if (!found)
            return "No path exists between " + start + " and " + end;
        return "Shortest path from " + start + " to " + end + " is " + path + " with cost " + cost;
    }
}
