package com.algo.wgraph.api;

/**
 * Result of the odd-degree Eulerian classification.
 *
 * At most one of {@code eulerian} and {@code semiEulerian} is true.
 *
 * @param eulerian       No vertex has odd degree: an Eulerian circuit exists.
 * @param semiEulerian   Exactly two vertices have odd degree: an Eulerian path
 *                       exists but no circuit.
 * @param oddVertexCount Number of vertices whose neighbor-list length is odd.
 */
public record EulerianStatus(boolean eulerian, boolean semiEulerian, int oddVertexCount) {

    public static EulerianStatus fromOddCount(int oddVertexCount) {
        return new EulerianStatus(oddVertexCount == 0, oddVertexCount == 2, oddVertexCount);
    }

    public String describe() {
        if (eulerian)
            return "Eulerian";
        if (semiEulerian)
            return "Semi-Eulerian";
        return "neither Eulerian nor Semi-Eulerian";
    }
}
