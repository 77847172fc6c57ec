package com.algo.wgraph.io;

import com.algo.wgraph.engine.Graph;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Imports a flat edge-list text file into a {@link Graph}.
 *
 * <p>
 * Format: one edge per line, three whitespace-separated fields:
 *
 * <pre>
 * A B 1
 * B C 2
 * A C 5
 * </pre>
 *
 * No header, no comments, no quoting; identifiers cannot contain whitespace.
 * The weight must parse as an integer.
 *
 * <p>
 * Each line is applied with {@link Graph#addEdge(String, String, double)} as
 * soon as it is read, so a failed import leaves the edges of earlier lines in
 * place. What happens at a malformed line is decided by the {@link LoadPolicy}.
 */
public final class EdgeListLoader {
    private static final Logger log = LogManager.getLogger(EdgeListLoader.class);

    private final LoadPolicy policy;

    public EdgeListLoader() {
        this(LoadPolicy.ABORT);
    }

    public EdgeListLoader(LoadPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Reads {@code path} and adds one edge per line to {@code graph}.
     *
     * @return counts of lines read, edges applied and lines skipped.
     * @throws IOException         if the file cannot be read.
     * @throws GraphParseException on a malformed line under
     *                             {@link LoadPolicy#ABORT}.
     */
    public LoadReport load(Graph graph, Path path) throws IOException {
        int lineNumber = 0, applied = 0, skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                EdgeLine edge;
                try {
                    edge = parseLine(line, lineNumber);
                } catch (GraphParseException e) {
                    if (policy == LoadPolicy.ABORT) {
                        log.error("Import of {} aborted after {} edges: {}", path, applied, e.getMessage());
                        throw e;
                    }
                    log.warn("Skipping malformed line in {}: {}", path, e.getMessage());
                    skipped++;
                    continue;
                }
                graph.addEdge(edge.source(), edge.target(), edge.weight());
                applied++;
            }
        }
        log.info("Imported {} edges from {} ({} lines, {} skipped)", applied, path, lineNumber, skipped);
        return new LoadReport(path, lineNumber, applied, skipped);
    }

    /**
     * Parses one line of the edge-list format.
     *
     * @param line       The raw line, without terminator.
     * @param lineNumber 1-based position, used in error messages.
     * @throws GraphParseException if the line does not have exactly three fields
     *                             or the weight is not an integer.
     */
    public static EdgeLine parseLine(String line, int lineNumber) {
        String stripped = line.strip();
        String[] parts = stripped.isEmpty() ? new String[0] : stripped.split("\\s+");
        if (parts.length != 3)
            throw new GraphParseException(lineNumber, line, "expected 3 fields, found " + parts.length);
        int weight;
        try {
            weight = Integer.parseInt(parts[2]);
        } catch (NumberFormatException e) {
            throw new GraphParseException(lineNumber, line, "weight is not an integer: " + parts[2], e);
        }
        return new EdgeLine(parts[0], parts[1], weight);
    }

    /** One parsed edge-list line. */
    public record EdgeLine(String source, String target, int weight) {
    }
}
