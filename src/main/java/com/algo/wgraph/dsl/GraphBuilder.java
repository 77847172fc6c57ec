package com.algo.wgraph.dsl;

import com.algo.wgraph.api.GraphListener;
import com.algo.wgraph.engine.Graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Graph Builder -- fluent API for declaring a graph in code.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = WGraph.builder("roads");
 * 2. Choose directedness: g.directed(true);
 * 3. Declare vertices and edges: g.vertex("A").edge("A", "B", 4);
 * 4. Build: Graph graph = g.build();
 *
 * Vertices and edges are replayed onto the graph in declaration order, so the
 * resulting adjacency order matches the order of the builder calls.
 */
public final class GraphBuilder {
    private final String graphName;

    private final List<Step> steps = new ArrayList<>();
    private final List<GraphListener> listeners = new ArrayList<>();
    private boolean directed;

    // Flag to prevent modification after building
    private boolean built;

    private GraphBuilder(String graphName) {
        this.graphName = graphName;
    }

    /**
     * Creates a new GraphBuilder instance.
     *
     * @param graphName A descriptive name, used in logs.
     */
    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName);
    }

    public String name() {
        return graphName;
    }

    public GraphBuilder directed(boolean directed) {
        checkNotBuilt();
        this.directed = directed;
        return this;
    }

    /** Declares an isolated vertex (or re-declares a known one, which is a no-op). */
    public GraphBuilder vertex(String id) {
        checkNotBuilt();
        steps.add(new Step(id, null, 0));
        return this;
    }

    /** Declares an edge of default weight. */
    public GraphBuilder edge(String source, String target) {
        return edge(source, target, Graph.DEFAULT_WEIGHT);
    }

    public GraphBuilder edge(String source, String target, double weight) {
        checkNotBuilt();
        steps.add(new Step(source, target, weight));
        return this;
    }

    /** Registers a listener before any step is replayed, so it sees every mutation. */
    public GraphBuilder listener(GraphListener listener) {
        checkNotBuilt();
        listeners.add(listener);
        return this;
    }

    /**
     * Creates the graph and replays every declared step onto it.
     *
     * @throws IllegalStateException if called twice.
     */
    public Graph build() {
        checkNotBuilt();
        built = true;
        Graph graph = new Graph(directed);
        for (GraphListener l : listeners)
            graph.addListener(l);
        for (Step s : steps) {
            if (s.target() == null)
                graph.addVertex(s.source());
            else
                graph.addEdge(s.source(), s.target(), s.weight());
        }
        return graph;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph '" + graphName + "' already built");
    }

    // A vertex declaration has a null target.
    private record Step(String source, String target, double weight) {
    }
}
