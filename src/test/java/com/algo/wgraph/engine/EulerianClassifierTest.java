package com.algo.wgraph.engine;

import com.algo.wgraph.WGraph;
import com.algo.wgraph.api.EulerianStatus;
import org.junit.Test;

import static org.junit.Assert.*;

public class EulerianClassifierTest {

    @Test
    public void testTriangleIsEulerian() {
        Graph g = WGraph.builder("triangle").edge("A", "B").edge("B", "C").edge("C", "A").build();
        EulerianStatus s = g.isEulerian();

        assertTrue(s.eulerian());
        assertFalse(s.semiEulerian());
        assertEquals(0, s.oddVertexCount());
        assertEquals("Eulerian", s.describe());
    }

    @Test
    public void testPathIsSemiEulerian() {
        // Degrees 1, 2, 1
        Graph g = WGraph.builder("path").edge("A", "B").edge("B", "C").build();
        EulerianStatus s = g.isEulerian();

        assertFalse(s.eulerian());
        assertTrue(s.semiEulerian());
        assertEquals(2, s.oddVertexCount());
        assertEquals("Semi-Eulerian", s.describe());
    }

    @Test
    public void testStarIsNeither() {
        // Center degree 3, three leaves of degree 1
        Graph g = WGraph.builder("star").edge("C", "X").edge("C", "Y").edge("C", "Z").build();
        EulerianStatus s = g.isEulerian();

        assertFalse(s.eulerian());
        assertFalse(s.semiEulerian());
        assertEquals(4, s.oddVertexCount());
        assertEquals("neither Eulerian nor Semi-Eulerian", s.describe());
    }

    @Test
    public void testEmptyGraphIsEulerian() {
        assertTrue(new Graph().isEulerian().eulerian());
    }

    @Test
    public void testConnectivityIsNotChecked() {
        Graph g = WGraph.builder("two-triangles")
                .edge("A", "B").edge("B", "C").edge("C", "A")
                .edge("X", "Y").edge("Y", "Z").edge("Z", "X")
                .vertex("lonely")
                .build();
        assertTrue(g.isEulerian().eulerian());
    }

    @Test
    public void testMultiEdgesCountWithMultiplicity() {
        // A-B twice: both vertices have degree 2
        Graph g = WGraph.builder("double").edge("A", "B").edge("A", "B").build();
        assertTrue(g.isEulerian().eulerian());
    }

    @Test
    public void testUndirectedSelfLoopAddsTwo() {
        Graph g = WGraph.builder("loop").edge("A", "A").build();
        assertEquals(2, g.degree("A").value());
        assertTrue(g.isEulerian().eulerian());
    }

    @Test
    public void testDirectedGraphUsesOutListLengths() {
        // A->B: A has one entry (odd), B has none.
        Graph g = WGraph.builder("arc").directed(true).edge("A", "B").build();
        EulerianStatus s = EulerianClassifier.classify(g);
        assertEquals(1, s.oddVertexCount());
        assertFalse(s.eulerian());
        assertFalse(s.semiEulerian());
    }

    @Test
    public void testDirectedCycleIsEulerianOnlyByParity() {
        // Each vertex has out-list length 1, so all three are odd.
        Graph g = WGraph.builder("cycle").directed(true).edge("A", "B").edge("B", "C").edge("C", "A").build();
        assertEquals(3, g.isEulerian().oddVertexCount());
    }
}
