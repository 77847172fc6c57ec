package com.algo.wgraph.io;

import java.nio.file.Path;

/**
 * Summary of one edge-list import.
 *
 * @param source       The file that was read.
 * @param linesRead    Lines consumed, including skipped ones.
 * @param edgesApplied addEdge calls made.
 * @param linesSkipped Malformed lines ignored under {@link LoadPolicy#SKIP}.
 */
public record LoadReport(Path source, int linesRead, int edgesApplied, int linesSkipped) {
}
