package com.algo.wgraph;

import com.algo.wgraph.dsl.GraphBuilder;
import com.algo.wgraph.engine.Graph;
import com.algo.wgraph.io.EdgeListLoader;
import com.algo.wgraph.io.GraphSettings;
import com.algo.wgraph.io.LoadPolicy;

import java.io.IOException;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * WGraph -- in-memory weighted graph engine.
 *
 * <h2>Model</h2>
 * <p>
 * A {@link Graph} is an insertion-ordered adjacency map plus a weight table
 * keyed by ordered vertex pairs. Vertices are plain string identifiers and are
 * created on first reference. Graphs only grow: there is no removal.
 *
 * <h3>Queries</h3>
 * <ul>
 * <li><b>Structure:</b> order, size, degree (in/out for directed graphs),
 * adjacency.</li>
 * <li><b>Eulerian:</b> odd-degree classification into Eulerian,
 * semi-Eulerian or neither.</li>
 * <li><b>Shortest paths:</b> Dijkstra from one source, with path
 * reconstruction. Weights are assumed non-negative.</li>
 * </ul>
 *
 * <p>
 * Every operation runs synchronously on the caller's thread. Instances are not
 * thread-safe; a caller serving several threads owns the locking.
 */
@Log4j2
public final class WGraph {

    private WGraph() {
        // Prevent instantiation of utility class
    }

    /** Creates an empty undirected graph. */
    public static Graph undirected() {
        return new Graph(false);
    }

    /** Creates an empty directed graph. */
    public static Graph directed() {
        return new Graph(true);
    }

    /**
     * Entry point: create a new graph builder.
     *
     * @param graphName A descriptive name for the graph instance.
     * @return A new {@link GraphBuilder} instance.
     */
    public static GraphBuilder builder(String graphName) {
        return GraphBuilder.create(graphName);
    }

    /**
     * Creates a graph from settings and, when an edge file is configured,
     * imports it with the configured load policy. A missing policy means
     * {@link LoadPolicy#ABORT}.
     *
     * @throws IOException if the edge file cannot be read.
     */
    public static Graph fromSettings(GraphSettings settings) throws IOException {
        GraphSettings.GraphInfo info = settings.getGraph();
        Graph graph = new Graph(info.isDirected());
        if (info.getEdgeFile() != null && !info.getEdgeFile().isBlank()) {
            Path edgeFile = Path.of(info.getEdgeFile());
            LoadPolicy policy = info.getLoadPolicy() == null ? LoadPolicy.ABORT : info.getLoadPolicy();
            log.info("Loading graph '{}' from {} (policy {})", info.getName(), edgeFile, policy);
            new EdgeListLoader(policy).load(graph, edgeFile);
        }
        return graph;
    }
}
