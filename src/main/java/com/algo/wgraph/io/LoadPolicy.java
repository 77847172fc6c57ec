package com.algo.wgraph.io;

/**
 * What an edge-list import does when it meets a malformed line.
 */
public enum LoadPolicy {
    /** Stop at the first malformed line and propagate the error. Edges from earlier lines stay in the graph. */
    ABORT,
    /** Log a warning for the malformed line and continue with the next one. */
    SKIP
}
