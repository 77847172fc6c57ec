package com.algo.wgraph;

import com.algo.wgraph.api.PathResult;
import com.algo.wgraph.engine.Graph;
import com.algo.wgraph.engine.ShortestPathTree;
import com.algo.wgraph.io.GraphSettings;
import com.algo.wgraph.io.SettingsLoader;
import com.algo.wgraph.util.GraphExplain;
import com.algo.wgraph.util.LoggingGraphListener;

import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Demonstrates a typical session: configure, import, query.
 *
 * <p>
 * Usage: {@code WGraphDemo [settings.json]}. Without an argument the bundled
 * {@code /wgraph.json} is used.
 */
@Log4j2
public class WGraphDemo {

    public static void main(String[] args) throws Exception {
        log.info("Starting WGraph Demo...");

        // 1. Settings
        GraphSettings settings = args.length > 0
                ? SettingsLoader.parseFile(Path.of(args[0]))
                : SettingsLoader.fromClasspath("/wgraph.json");

        // 2. Import
        Graph graph = WGraph.fromSettings(settings);
        var tracer = new LoggingGraphListener();
        graph.addListener(tracer);

        // 3. Queries
        var explain = new GraphExplain(graph);
        log.info("Graph '{}':\n{}", settings.getGraph().getName(), explain.dump());
        log.info(explain.summary());
        log.info("Graph is {}.", graph.isEulerian().describe());

        for (String v : graph.vertices())
            log.info("Degree of {}: {}", v, graph.degree(v));

        if (graph.order() > 0) {
            String start = graph.vertices().iterator().next();
            ShortestPathTree tree = graph.dijkstra(start);
            for (String end : graph.vertices()) {
                PathResult path = tree.pathTo(end);
                log.info(path);
            }
        }

        // 4. Toggle directedness and add one edge to show the listener
        graph.setDirected(!graph.isDirected());
        graph.addEdge("X", "Y", 3);
        log.info("Listener saw {} vertices, {} edges, {} toggles", tracer.getVerticesAdded(),
                tracer.getEdgesAdded(), tracer.getDirectednessChanges());
        log.info("Mermaid:\n{}", explain.toMermaid());
    }
}
