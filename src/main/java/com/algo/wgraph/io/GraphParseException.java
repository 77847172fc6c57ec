package com.algo.wgraph.io;

/**
 * A line of an edge-list file does not match {@code <source> <target> <integer weight>}.
 */
public class GraphParseException extends IllegalArgumentException {
    private final int lineNumber;
    private final String line;

    public GraphParseException(int lineNumber, String line, String reason) {
        this(lineNumber, line, reason, null);
    }

    public GraphParseException(int lineNumber, String line, String reason, Throwable cause) {
        super("Line " + lineNumber + ": " + reason + " [" + line + "]", cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /** 1-based line number in the source file. */
    public int lineNumber() {
        return lineNumber;
    }

    public String line() {
        return line;
    }
}
