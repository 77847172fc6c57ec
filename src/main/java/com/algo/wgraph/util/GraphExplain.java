package com.algo.wgraph.util;

import com.algo.wgraph.engine.EdgeKey;
import com.algo.wgraph.engine.Graph;
import com.algo.wgraph.engine.InvalidVertexException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Diagnostic utility for inspecting graph structure.
 *
 * <p>
 * This class generates human-readable string representations of the adjacency
 * and weight tables.
 *
 * <p>
 * <b>Usage:</b> Intended for display panes, debugging sessions and logging.
 * Every call walks the whole structure and allocates strings.
 */
public final class GraphExplain {
    private final Graph graph;

    public GraphExplain(Graph graph) {
        this.graph = graph;
    }

    /**
     * Dumps the adjacency, one vertex per line:
     * {@code A: B (Weight: 1), C (Weight: 5)}.
     * Pairs without a weight entry print {@code N/A}.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder(1024);
        for (String v : graph.vertices()) {
            sb.append(v).append(": ");
            appendNeighbors(sb, v);
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps the state of a single vertex.
     *
     * @throws InvalidVertexException if the vertex is unknown.
     */
    public String explainVertex(String vertex) {
        if (!graph.containsVertex(vertex))
            throw new InvalidVertexException(vertex);
        List<String> neighbors = graph.adjacentVertices(vertex);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Vertex: ").append(vertex).append('\n')
                .append("  Directed graph: ").append(graph.isDirected()).append('\n')
                .append("  Degree: ").append(graph.degree(vertex)).append('\n')
                .append("  Neighbors (").append(neighbors.size()).append("): ");
        appendNeighbors(sb, vertex);
        return sb.append('\n').toString();
    }

    /**
     * One-line order/size summary.
     */
    public String summary() {
        return "Order (Vertices): " + graph.order() + ", Size (Edges): " + graph.size();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Each vertex gets a positional node id ({@code v0}, {@code v1}, ...) so
     * distinct names never collide; the name itself only appears in the
     * quoted label. Undirected edges are drawn once with {@code ---}; directed
     * edges use {@code -->}. Edges carry their weight as a label.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        // 1. Declare vertices in insertion order
        Map<String, String> ids = new HashMap<>();
        for (String v : graph.vertices()) {
            String id = "v" + ids.size();
            ids.put(v, id);
            sb.append("  ").append(id).append("[\"").append(escapeLabel(v)).append("\"];\n");
        }

        // 2. Edges. Undirected graphs store each edge twice; the mirror entry is
        // matched against a pending count so multi-edges still draw once each.
        String arrow = graph.isDirected() ? " --> " : " --- ";
        Map<EdgeKey, Integer> pendingMirrors = new HashMap<>();
        for (String v : graph.vertices()) {
            for (String n : graph.adjacentVertices(v)) {
                if (!graph.isDirected()) {
                    EdgeKey key = new EdgeKey(v, n);
                    EdgeKey mirror = key.reversed();
                    Integer pending = pendingMirrors.get(mirror);
                    if (pending != null && pending > 0) {
                        pendingMirrors.put(mirror, pending - 1);
                        continue;
                    }
                    pendingMirrors.merge(key, 1, Integer::sum);
                }
                sb.append("  ").append(ids.get(v))
                        .append(" -- \"").append(formatWeight(graph.weight(v, n))).append('"')
                        .append(arrow).append(ids.get(n)).append(";\n");
            }
        }
        return sb.toString();
    }

    private void appendNeighbors(StringBuilder sb, String vertex) {
        List<String> neighbors = graph.adjacentVertices(vertex);
        for (int i = 0; i < neighbors.size(); i++) {
            String n = neighbors.get(i);
            sb.append(n).append(" (Weight: ").append(formatWeight(graph.weight(vertex, n))).append(')');
            if (i < neighbors.size() - 1)
                sb.append(", ");
        }
    }

    /** Whole weights print without a fractional part; absent weights as N/A. */
    static String formatWeight(OptionalDouble weight) {
        if (weight.isEmpty())
            return "N/A";
        double w = weight.getAsDouble();
        if (w == Math.rint(w) && !Double.isInfinite(w) && Math.abs(w) < 1e15)
            return Long.toString((long) w);
        return Double.toString(w);
    }

    /** Mermaid labels are double-quoted; a quote inside uses the #quot; entity. */
    static String escapeLabel(String name) {
        return name.replace("\"", "#quot;");
    }
}
