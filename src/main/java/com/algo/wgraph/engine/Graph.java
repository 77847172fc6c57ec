package com.algo.wgraph.engine;

import com.algo.wgraph.api.Degree;
import com.algo.wgraph.api.EulerianStatus;
import com.algo.wgraph.api.GraphListener;
import com.algo.wgraph.api.PathResult;
import com.algo.wgraph.io.EdgeListLoader;
import com.algo.wgraph.io.LoadReport;
import com.algo.wgraph.util.CompositeGraphListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Mutable weighted graph -- the data model every query and algorithm runs on.
 *
 * Data layout:
 * - adjacency: insertion-ordered map from vertex id to its neighbor list.
 * Neighbor order is the order edges were added; it matters for display only.
 * - weights: map from an ordered (source, target) {@link EdgeKey} to the
 * weight of that pair.
 *
 * Invariants:
 * 1. Every neighbor id and every weight-key endpoint is also an adjacency key.
 * Vertices are created on first reference.
 * 2. Undirected insertion writes (u,v) and (v,u) together, in both maps.
 * Directed insertion writes only (u,v).
 * 3. Repeated (u,v) insertions append duplicate neighbor entries but share one
 * weight entry; the last weight written wins.
 *
 * Directedness:
 * The flag may be flipped with {@link #setDirected(boolean)}. Existing entries
 * are left as they are, so a graph built undirected and flipped to directed
 * keeps both directions of every edge, and the reverse flip does not add the
 * missing mirrors.
 *
 * Thread Safety:
 * None. The graph assumes exclusive, sequential access. Callers sharing an
 * instance across threads must guard every call with one external lock.
 */
@Log4j2
public final class Graph {
    /** Weight assumed for a pair with no entry in the weight table. */
    public static final double DEFAULT_WEIGHT = 1.0;

    private final Map<String, List<String>> adjacency = new LinkedHashMap<>();
    private final Map<EdgeKey, Double> weights = new HashMap<>();
    private final CompositeGraphListener listeners = new CompositeGraphListener();
    private boolean directed;

    public Graph() {
        this(false);
    }

    public Graph(boolean directed) {
        this.directed = directed;
    }

    public boolean isDirected() {
        return directed;
    }

    /**
     * Changes the directedness flag.
     * <p>
     * Edges already present are not rewritten; see the class notes.
     */
    public void setDirected(boolean directed) {
        if (this.directed == directed)
            return;
        int entries = adjacencyEntryCount();
        if (entries > 0)
            log.warn("Switching graph to {} with {} existing adjacency entries; existing edges are kept as-is",
                    directed ? "directed" : "undirected", entries);
        this.directed = directed;
        listeners.onDirectednessChanged(directed, entries);
    }

    /**
     * Registers a listener for mutation events. Listeners are called in
     * registration order.
     */
    public void addListener(GraphListener listener) {
        listeners.addForComposite(Objects.requireNonNull(listener, "listener"));
    }

    // ── Mutation ─────────────────────────────────────────────────

    /**
     * Adds a vertex with no neighbors. Adding a known vertex is a no-op.
     *
     * @param vertex The vertex identifier.
     */
    public void addVertex(String vertex) {
        Objects.requireNonNull(vertex, "vertex");
        if (adjacency.containsKey(vertex))
            return;
        adjacency.put(vertex, new ArrayList<>());
        listeners.onVertexAdded(vertex);
    }

    /** Adds an edge of weight {@value #DEFAULT_WEIGHT}. */
    public void addEdge(String source, String target) {
        addEdge(source, target, DEFAULT_WEIGHT);
    }

    /**
     * Adds an edge, creating either endpoint if needed.
     * <p>
     * The weight is not validated. Repeated pairs are not de-duplicated. Both
     * endpoints are null-checked before the graph is touched.
     *
     * @param source The source vertex.
     * @param target The target vertex.
     * @param weight The weight to record for the pair (and its mirror when
     *               undirected).
     */
    public void addEdge(String source, String target, double weight) {
        EdgeKey key = new EdgeKey(source, target);
        addVertex(source);
        addVertex(target);

        adjacency.get(source).add(target);
        weights.put(key, weight);

        if (!directed) {
            adjacency.get(target).add(source);
            weights.put(key.reversed(), weight);
        }
        log.debug("Added edge {} -> {} (weight {}, directed={})", source, target, weight, directed);
        listeners.onEdgeAdded(source, target, weight, directed);
    }

    /**
     * Imports an edge-list file, aborting on the first malformed line.
     *
     * @see EdgeListLoader
     */
    public LoadReport loadFromFile(Path path) throws IOException {
        return new EdgeListLoader().load(this, path);
    }

    // ── Queries ──────────────────────────────────────────────────

    /** Number of vertices. */
    public int order() {
        return adjacency.size();
    }

    /**
     * Number of edges.
     * <p>
     * Directed: the raw count of adjacency entries. Undirected: half of it,
     * since every edge is stored in both directions.
     */
    public int size() {
        int entries = adjacencyEntryCount();
        if (directed)
            return entries;
        if (entries % 2 != 0)
            log.warn("Undirected graph has odd total degree {}; adjacency lists are out of sync", entries);
        return entries / 2;
    }

    public boolean containsVertex(String vertex) {
        return adjacency.containsKey(vertex);
    }

    /** Vertex ids in insertion order. */
    public Set<String> vertices() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    /**
     * Neighbors of a vertex in insertion order, duplicates included.
     *
     * @return an unmodifiable view, empty if the vertex is unknown.
     */
    public List<String> adjacentVertices(String vertex) {
        List<String> neighbors = adjacency.get(vertex);
        return neighbors == null ? List.of() : Collections.unmodifiableList(neighbors);
    }

    /**
     * Degree of a vertex. Unknown vertices have degree 0 (or {0, 0}).
     * <p>
     * For directed graphs the in-degree is found by scanning every neighbor
     * list, O(order x average degree). It counts the vertices that list
     * {@code vertex} at least once, not the number of entries.
     */
    public Degree degree(String vertex) {
        int out = adjacentVertices(vertex).size();
        if (!directed)
            return Degree.undirected(out);
        int in = 0;
        for (List<String> neighbors : adjacency.values())
            if (neighbors.contains(vertex))
                in++;
        return Degree.directed(in, out);
    }

    /**
     * True iff {@code v2} appears in the neighbor list of {@code v1}.
     * The check is directional; it is symmetric only because undirected
     * insertion writes both directions.
     */
    public boolean areAdjacent(String v1, String v2) {
        return adjacentVertices(v1).contains(v2);
    }

    /**
     * Raw weight lookup.
     *
     * @return the recorded weight, or empty if the pair has no entry.
     */
    public OptionalDouble weight(String source, String target) {
        Double w = weights.get(new EdgeKey(source, target));
        return w == null ? OptionalDouble.empty() : OptionalDouble.of(w);
    }

    /**
     * Weight lookup used by the algorithms: the recorded weight, or
     * {@value #DEFAULT_WEIGHT} when the pair has no entry.
     */
    public double edgeWeight(String source, String target) {
        return weight(source, target).orElse(DEFAULT_WEIGHT);
    }

    /**
     * Classifies the graph by its number of odd-degree vertices.
     *
     * @see EulerianClassifier
     */
    public EulerianStatus isEulerian() {
        return EulerianClassifier.classify(this);
    }

    /**
     * Single-source shortest distances from {@code start}.
     *
     * @throws InvalidVertexException if {@code start} is unknown.
     */
    public ShortestPathTree dijkstra(String start) {
        return new ShortestPathEngine(this).run(start);
    }

    /**
     * Cheapest path from {@code start} to {@code end}.
     *
     * @return the path and its cost, or a result with {@code found == false}
     *         when {@code end} is unreachable.
     * @throws InvalidVertexException if either endpoint is unknown.
     */
    public PathResult shortestPath(String start, String end) {
        requireVertex(start);
        requireVertex(end);
        return dijkstra(start).pathTo(end);
    }

    void requireVertex(String vertex) {
        if (vertex == null || !adjacency.containsKey(vertex))
            throw new InvalidVertexException(vertex);
    }

    private int adjacencyEntryCount() {
        int total = 0;
        for (List<String> neighbors : adjacency.values())
            total += neighbors.size();
        return total;
    }
}
