package com.algo.wgraph.io;

import com.algo.wgraph.api.PathResult;
import com.algo.wgraph.engine.Graph;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class EdgeListLoaderTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path write(String content) throws IOException {
        Path p = tmp.newFile().toPath();
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    private Path fixture(String name) throws Exception {
        return Path.of(getClass().getResource("/graphs/" + name).toURI());
    }

    @Test
    public void testImportThenShortestPath() throws Exception {
        Graph g = new Graph();
        LoadReport report = g.loadFromFile(write("A B 1\nB C 2\nA C 5"));

        assertEquals(3, report.edgesApplied());
        assertEquals(3, report.linesRead());
        assertEquals(0, report.linesSkipped());

        PathResult r = g.shortestPath("A", "C");
        assertEquals(3.0, r.cost(), 0.0);
        assertEquals(List.of("A", "B", "C"), r.path());
    }

    @Test
    public void testClasspathFixture() throws Exception {
        Graph g = new Graph();
        new EdgeListLoader().load(g, fixture("triangle.txt"));
        assertEquals(3, g.order());
        assertEquals(3, g.size());
        assertEquals(5.0, g.edgeWeight("C", "A"), 0.0);
    }

    @Test
    public void testDirectedImport() throws Exception {
        Graph g = new Graph(true);
        g.loadFromFile(write("A B 1\nB C 2\n"));
        assertTrue(g.areAdjacent("A", "B"));
        assertFalse(g.areAdjacent("B", "A"));
        assertEquals(2, g.size());
    }

    @Test
    public void testMalformedWeightAbortsAndKeepsEarlierEdges() throws Exception {
        Graph g = new Graph();
        try {
            new EdgeListLoader(LoadPolicy.ABORT).load(g, fixture("malformed.txt"));
            fail("Should have thrown GraphParseException");
        } catch (GraphParseException e) {
            assertEquals(2, e.lineNumber());
            assertEquals("B C x", e.line());
            assertTrue(e.getMessage().contains("not an integer"));
            assertTrue(e.getCause() instanceof NumberFormatException);
        }
        // Line 1 was applied before the failure; line 3 never ran.
        assertEquals(2, g.order());
        assertTrue(g.areAdjacent("A", "B"));
        assertFalse(g.containsVertex("D"));
    }

    @Test
    public void testSkipPolicyContinuesPastMalformedLines() throws Exception {
        Graph g = new Graph();
        LoadReport report = new EdgeListLoader(LoadPolicy.SKIP).load(g, fixture("malformed.txt"));

        assertEquals(3, report.linesRead());
        assertEquals(2, report.edgesApplied());
        assertEquals(1, report.linesSkipped());
        assertEquals(List.of("A", "B", "C", "D"), List.copyOf(g.vertices()));
        assertFalse(g.areAdjacent("B", "C"));
    }

    @Test
    public void testBlankLineIsMalformed() throws Exception {
        Graph g = new Graph();
        try {
            g.loadFromFile(write("A B 1\n\nB C 2\n"));
            fail("Should have thrown GraphParseException");
        } catch (GraphParseException e) {
            assertEquals(2, e.lineNumber());
        }
        assertEquals(1, g.size());
    }

    @Test
    public void testTrailingNewlineIsNotALine() throws Exception {
        Graph g = new Graph();
        LoadReport report = g.loadFromFile(write("A B 1\n"));
        assertEquals(1, report.linesRead());
    }

    @Test(expected = NoSuchFileException.class)
    public void testMissingFile() throws Exception {
        new Graph().loadFromFile(tmp.getRoot().toPath().resolve("absent.txt"));
    }

    @Test
    public void testParseLineToleratesExtraWhitespace() {
        EdgeListLoader.EdgeLine e = EdgeListLoader.parseLine("  A\tB   3  ", 1);
        assertEquals("A", e.source());
        assertEquals("B", e.target());
        assertEquals(3, e.weight());
    }

    @Test
    public void testParseLineAcceptsSignedWeight() {
        assertEquals(-2, EdgeListLoader.parseLine("A B -2", 1).weight());
    }

    @Test
    public void testParseLineRejectsTooFewFields() {
        try {
            EdgeListLoader.parseLine("A B", 7);
            fail("Should have thrown GraphParseException");
        } catch (GraphParseException e) {
            assertEquals(7, e.lineNumber());
            assertTrue(e.getMessage().contains("expected 3 fields, found 2"));
        }
    }

    @Test(expected = GraphParseException.class)
    public void testParseLineRejectsTooManyFields() {
        EdgeListLoader.parseLine("A B 1 extra", 1);
    }

    @Test(expected = GraphParseException.class)
    public void testParseLineRejectsRealWeight() {
        EdgeListLoader.parseLine("A B 1.5", 1);
    }

    @Test(expected = NullPointerException.class)
    public void testNullPolicyRejected() {
        new EdgeListLoader(null);
    }
}
