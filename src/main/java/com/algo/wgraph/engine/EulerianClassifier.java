package com.algo.wgraph.engine;

import com.algo.wgraph.api.EulerianStatus;

/**
 * Odd-degree Eulerian classification.
 *
 * <p>
 * Counts the vertices whose neighbor-list length is odd (multi-edges counted
 * with multiplicity):
 * <ul>
 * <li>0 odd vertices: Eulerian (a circuit exists).</li>
 * <li>exactly 2: semi-Eulerian (an open path exists).</li>
 * <li>anything else: neither.</li>
 * </ul>
 *
 * <p>
 * This is the undirected criterion applied to every graph. Directedness is
 * ignored (the in-degree = out-degree rule is not used) and connectivity is not
 * checked, so two disjoint cycles report Eulerian.
 */
public final class EulerianClassifier {
    private EulerianClassifier() {
        // Utility class
    }

    public static EulerianStatus classify(Graph graph) {
        int odd = 0;
        for (String v : graph.vertices())
            if (graph.adjacentVertices(v).size() % 2 != 0)
                odd++;
        return EulerianStatus.fromOddCount(odd);
    }
}
