package com.algo.wgraph.util;

import com.algo.wgraph.WGraph;
import com.algo.wgraph.engine.Graph;
import com.algo.wgraph.engine.InvalidVertexException;
import org.junit.Test;

import java.util.OptionalDouble;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private static int count(String haystack, String needle) {
        int n = 0, i = 0;
        while ((i = haystack.indexOf(needle, i)) >= 0) {
            n++;
            i += needle.length();
        }
        return n;
    }

    private Graph triangle() {
        return WGraph.builder("triangle").edge("A", "B", 1).edge("B", "C", 2).edge("A", "C", 5).build();
    }

    @Test
    public void testDump() {
        String expected = "A: B (Weight: 1), C (Weight: 5)\n"
                + "B: A (Weight: 1), C (Weight: 2)\n"
                + "C: B (Weight: 2), A (Weight: 5)\n";
        assertEquals(expected, new GraphExplain(triangle()).dump());
    }

    @Test
    public void testDumpIsolatedVertex() {
        Graph g = new Graph();
        g.addVertex("Z");
        assertEquals("Z: \n", new GraphExplain(g).dump());
    }

    @Test
    public void testSummary() {
        assertEquals("Order (Vertices): 3, Size (Edges): 3", new GraphExplain(triangle()).summary());
    }

    @Test
    public void testExplainVertex() {
        String text = new GraphExplain(triangle()).explainVertex("C");
        assertTrue(text.startsWith("Vertex: C\n"));
        assertTrue(text.contains("Degree: 2"));
        assertTrue(text.contains("Neighbors (2): B (Weight: 2), A (Weight: 5)"));
    }

    @Test
    public void testExplainDirectedVertex() {
        Graph g = WGraph.builder("d").directed(true).edge("A", "B").edge("C", "B").build();
        String text = new GraphExplain(g).explainVertex("B");
        assertTrue(text.contains("Degree: In: 2, Out: 0"));
    }

    @Test(expected = InvalidVertexException.class)
    public void testExplainUnknownVertex() {
        new GraphExplain(triangle()).explainVertex("Q");
    }

    @Test
    public void testMermaidDrawsUndirectedEdgesOnce() {
        String m = new GraphExplain(triangle()).toMermaid();
        assertTrue(m.startsWith("graph LR;\n"));
        assertEquals(3, count(m, " --- "));
        assertEquals(0, count(m, " --> "));
        assertTrue(m.contains("  v0 -- \"5\" --- v2;\n"));
    }

    @Test
    public void testMermaidKeepsMultiEdgesAndSelfLoops() {
        Graph g = WGraph.builder("multi").edge("A", "B").edge("A", "B").edge("A", "A").build();
        assertEquals(3, count(new GraphExplain(g).toMermaid(), " --- "));
    }

    @Test
    public void testMermaidDirected() {
        Graph g = WGraph.builder("d").directed(true).edge("A", "B", 4).edge("B", "A", 2).build();
        String m = new GraphExplain(g).toMermaid();
        assertEquals(2, count(m, " --> "));
        assertTrue(m.contains("  v1 -- \"2\" --> v0;\n"));
    }

    @Test
    public void testMermaidUsesPositionalIds() {
        Graph g = new Graph();
        g.addEdge("New York", "L.A.", 9);
        String m = new GraphExplain(g).toMermaid();
        assertTrue(m.contains("  v0[\"New York\"];\n"));
        assertTrue(m.contains("  v1[\"L.A.\"];\n"));
        assertTrue(m.contains("  v0 -- \"9\" --- v1;\n"));
    }

    @Test
    public void testMermaidKeepsLookalikeNamesApart() {
        Graph g = WGraph.builder("d").directed(true).edge("A.B", "C").edge("A_B", "D").build();
        String m = new GraphExplain(g).toMermaid();
        assertTrue(m.contains("  v0[\"A.B\"];\n"));
        assertTrue(m.contains("  v2[\"A_B\"];\n"));
        assertTrue(m.contains("  v0 -- \"1\" --> v1;\n"));
        assertTrue(m.contains("  v2 -- \"1\" --> v3;\n"));
        assertEquals(4, count(m, "[\""));
    }

    @Test
    public void testMermaidEscapesQuotesInLabels() {
        Graph g = new Graph();
        g.addVertex("say \"hi\"");
        assertEquals("graph LR;\n  v0[\"say #quot;hi#quot;\"];\n", new GraphExplain(g).toMermaid());
    }

    @Test
    public void testFormatWeight() {
        assertEquals("N/A", GraphExplain.formatWeight(OptionalDouble.empty()));
        assertEquals("3", GraphExplain.formatWeight(OptionalDouble.of(3.0)));
        assertEquals("2.5", GraphExplain.formatWeight(OptionalDouble.of(2.5)));
        assertEquals("-1", GraphExplain.formatWeight(OptionalDouble.of(-1.0)));
    }
}
