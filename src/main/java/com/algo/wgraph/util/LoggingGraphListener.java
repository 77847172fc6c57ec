package com.algo.wgraph.util;

import com.algo.wgraph.api.GraphListener;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Logs every mutation at debug level and keeps running counts.
 *
 * <p>
 * Intended for import tracing and demo sessions; the counts let a caller report
 * how much an import or a batch of edits changed.
 */
@Log4j2
@Getter
public final class LoggingGraphListener implements GraphListener {
    private long verticesAdded;
    private long edgesAdded;
    private long directednessChanges;

    @Override
    public void onVertexAdded(String vertex) {
        verticesAdded++;
        log.debug("Vertex added: {}", vertex);
    }

    @Override
    public void onEdgeAdded(String source, String target, double weight, boolean directed) {
        edgesAdded++;
        log.debug("Edge added: {} {} {} (weight {})", source, directed ? "->" : "--", target, weight);
    }

    @Override
    public void onDirectednessChanged(boolean directed, int edgeEntries) {
        directednessChanges++;
        log.info("Graph is now {} ({} adjacency entries kept unchanged)", directed ? "directed" : "undirected",
                edgeEntries);
    }
}
