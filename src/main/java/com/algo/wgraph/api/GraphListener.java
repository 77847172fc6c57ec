package com.algo.wgraph.api;

/**
 * Observability interface for monitoring graph mutations.
 *
 * Implementations can be registered with a Graph to receive callbacks each
 * time the structure changes. This is the primary mechanism for:
 *
 * - Display refresh: an outer shell re-renders its view of the adjacency
 * after every change.
 * - Debugging: tracing which vertices and edges an import created.
 * - Auditing: counting mutations applied by a session.
 *
 * Callbacks run synchronously on the caller's thread, after the mutation has
 * been applied. Implementations must not mutate the graph from inside a
 * callback.
 */
public interface GraphListener {

    /**
     * Called when a vertex is created, either explicitly or because an edge
     * referenced it. Not called for a repeated addVertex of a known id.
     *
     * @param vertex The new vertex identifier.
     */
    void onVertexAdded(String vertex);

    /**
     * Called once per addEdge call. For undirected graphs the mirrored entry is
     * part of the same notification.
     *
     * @param source   The source vertex.
     * @param target   The target vertex.
     * @param weight   The weight recorded for the pair.
     * @param directed Whether the graph was directed when the edge was added.
     */
    void onEdgeAdded(String source, String target, double weight, boolean directed);

    /**
     * Called when the directedness flag changes value.
     *
     * @param directed The new flag value.
     * @param edgeEntries Number of adjacency entries already present, which are
     *                    not rewritten.
     */
    void onDirectednessChanged(boolean directed, int edgeEntries);
}
