package com.algo.wgraph.engine;

import java.util.Objects;

/**
 * Ordered (source, target) pair used to key the weight table.
 *
 * An undirected edge is stored as two keys, one per direction.
 */
public record EdgeKey(String source, String target) {

    public EdgeKey {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    public EdgeKey reversed() {
        return new EdgeKey(target, source);
    }

    @Override
    public String toString() {
        return source + "->" + target;
    }
}
