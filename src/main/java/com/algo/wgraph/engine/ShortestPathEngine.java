package com.algo.wgraph.engine;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.PriorityQueue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Dijkstra's single-source shortest-path algorithm over a {@link Graph}.
 *
 * Algorithm Details:
 *
 * 1. Initialize: distance[start] = 0, every other vertex +infinity, no
 * predecessors.
 *
 * 2. Queue: a binary-heap PriorityQueue of (distance, vertex) entries, seeded
 * with (0, start). Ties on distance are broken by vertex id so results do not
 * depend on heap internals.
 *
 * 3. Relax: pop the cheapest entry; for each neighbor compute
 * candidate = distance + edgeWeight(current, neighbor). A strictly better
 * candidate updates the distance and predecessor and pushes a new entry.
 *
 * 4. Stale entries: a vertex may sit in the queue several times. An entry whose
 * distance is worse than the vertex's current best is skipped; with
 * non-negative weights this never changes the result.
 *
 * Cost: O((V + E) log V). Weights are assumed non-negative and are not
 * checked.
 */
public final class ShortestPathEngine {
    private static final Logger log = LogManager.getLogger(ShortestPathEngine.class);

    private static final Comparator<Entry> BY_DISTANCE = Comparator.comparingDouble(Entry::distance)
            .thenComparing(Entry::vertex);

    private final Graph graph;

    public ShortestPathEngine(Graph graph) {
        this.graph = graph;
    }

    /**
     * Runs Dijkstra from {@code start}.
     *
     * @param start The source vertex.
     * @return distances and predecessors for every vertex of the graph.
     * @throws InvalidVertexException if {@code start} is not in the graph.
     */
    public ShortestPathTree run(String start) {
        graph.requireVertex(start);

        Map<String, Double> distances = new LinkedHashMap<>(graph.order() * 2);
        for (String v : graph.vertices())
            distances.put(v, Double.POSITIVE_INFINITY);
        distances.put(start, 0.0);
        Map<String, String> predecessors = new HashMap<>();

        PriorityQueue<Entry> queue = new PriorityQueue<>(BY_DISTANCE);
        queue.add(new Entry(0.0, start));

        int pops = 0, relaxations = 0;
        while (!queue.isEmpty()) {
            Entry entry = queue.poll();
            pops++;
            String current = entry.vertex();
            if (entry.distance() > distances.get(current))
                continue; // stale

            for (String neighbor : graph.adjacentVertices(current)) {
                double candidate = entry.distance() + graph.edgeWeight(current, neighbor);
                if (candidate < distances.get(neighbor)) {
                    distances.put(neighbor, candidate);
                    predecessors.put(neighbor, current);
                    queue.add(new Entry(candidate, neighbor));
                    relaxations++;
                }
            }
        }
        log.debug("Dijkstra from {}: {} queue pops, {} relaxations over {} vertices", start, pops, relaxations,
                distances.size());
        return new ShortestPathTree(start, distances, predecessors);
    }

    private record Entry(double distance, String vertex) {
    }
}
