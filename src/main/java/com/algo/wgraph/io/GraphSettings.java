package com.algo.wgraph.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a graph session configuration.
 *
 * <pre>
 * { "graph": { "name": "demo", "directed": false, "loadPolicy": "ABORT", "edgeFile": "graphs/triangle.txt" } }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphSettings {
    private GraphInfo graph;

    /** Settings for a single graph instance. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private String name;
        private boolean directed;
        private LoadPolicy loadPolicy = LoadPolicy.ABORT;
        // Optional; relative paths resolve against the working directory
        private String edgeFile;
    }
}
