package com.proofaudit.pdg.util;

import com.proofaudit.pdg.ProjectAnalyzerTest;
import com.proofaudit.pdg.ProjectGraph;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private final ProjectGraph graph = ProjectAnalyzerTest.heuristicGraph();
    private final GraphExplain explain = new GraphExplain(graph);

    @Test
    public void testExplainSymbol() {
        String text = explain.explainSymbol("bar");
        assertTrue(text, text.startsWith("Symbol: bar\n"));
        assertTrue(text, text.contains("  Kind: axiom (ASSUMPTION)\n"));
        assertTrue(text, text.contains("  Status: ASSUMED\n"));
        assertTrue(text, text.contains("  Location: A.v:2\n"));
        assertTrue(text, text.contains("  Statement: Axiom bar : False.\n"));
        assertTrue(text, text.contains("  Dependencies (0): \n"));
        assertTrue(text, text.contains("  Dependents (1): baz\n"));
        assertTrue(text, text.contains("  Tainted: true by bar\n"));
        assertTrue(text, text.contains("  Blast radius: 1\n"));
        assertFalse(text, text.contains("External"));
    }

    @Test
    public void testExplainMetadataSymbol() {
        String text = new GraphExplain(ProjectAnalyzerTest.metadataGraph()).explainSymbol("Lib.A.foo");
        assertTrue(text, text.contains("  External (1): Coq.Init.Logic.True\n"));
        assertTrue(text, text.contains("  Tainted: false\n"));
        assertTrue(text, text.contains("  Location: A.v:2 ["));
    }

    @Test
    public void testSummary() {
        String text = explain.summary();
        assertTrue(text, text.startsWith("Project: 4 symbols in 1 files\n"));
        assertTrue(text, text.contains(" proved=2 "));
        assertTrue(text, text.contains(" assumed=1 "));
        assertTrue(text, text.contains("  Keywords: axiom=1 definition=1 lemma=2\n"));
        assertTrue(text, text.contains("  Tainted: 2, unused: 3\n"));
        assertFalse(text, text.contains("Admitted by blast radius"));
    }

    @Test
    public void testDump() {
        String text = explain.dump();
        assertTrue(text, text.startsWith("Graph (4 symbols):\n"));
        assertTrue(text, text.contains("  [0] foo (proved)\n"));
        assertTrue(text, text.contains("  [1] bar (assumed) TAINTED -> baz\n"));
        assertTrue(text, text.contains("  [2] baz (proved) TAINTED\n"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownSymbol() {
        explain.explainSymbol("nope");
    }
}
