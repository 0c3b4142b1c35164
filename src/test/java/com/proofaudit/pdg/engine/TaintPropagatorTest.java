package com.proofaudit.pdg.engine;

import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class TaintPropagatorTest {

    /**
     * <pre>
     *   s1   s2
     *    \  / \
     *     m    x
     *     |
     *     top      free
     * </pre>
     * Arrows point from dependency to dependent.
     */
    private static DependencyGraph diamond() {
        return DependencyGraph.builder()
                .addNode("s1").addNode("s2").addNode("m").addNode("x").addNode("top").addNode("free")
                .addEdge("m", "s1")
                .addEdge("m", "s2")
                .addEdge("x", "s2")
                .addEdge("top", "m")
                .build();
    }

    @Test
    public void testChain() {
        DependencyGraph g = DependencyGraph.builder()
                .addNode("a").addNode("b").addNode("c")
                .addEdge("b", "a")
                .addEdge("c", "b")
                .build();
        TaintResult r = new TaintPropagator(g).propagate(List.of("a"));
        assertEquals(Set.of("a", "b", "c"), r.tainted());
        assertEquals(Set.of("a"), r.sources("c"));
        assertEquals(Map.of("a", 2), r.seedRadius());
    }

    @Test
    public void testEverySeedIsRecordedAsSource() {
        TaintResult r = new TaintPropagator(diamond()).propagate(List.of("s1", "s2"));
        assertEquals(Set.of("s1", "s2"), r.sources("m"));
        assertEquals(Set.of("s1", "s2"), r.sources("top"));
        assertEquals(Set.of("s2"), r.sources("x"));
        assertEquals(Set.of("s1"), r.sources("s1"));
        assertFalse(r.isTainted("free"));
        assertTrue(r.sources("free").isEmpty());
        assertEquals(5, r.taintedCount());
        assertEquals(Map.of("s1", 2, "s2", 3), r.seedRadius());
    }

    @Test
    public void testPropagationIsIdempotent() {
        TaintPropagator p = new TaintPropagator(diamond());
        TaintResult first = p.propagate(List.of("s1", "s2"));
        TaintResult again = p.propagate(List.of("s1", "s2", "s1"));
        assertEquals(first.tainted(), again.tainted());
        assertEquals(first.sources("top"), again.sources("top"));
    }

    @Test
    public void testMoreSeedsNeverTaintLess() {
        TaintPropagator p = new TaintPropagator(diamond());
        Set<String> one = p.propagate(List.of("s1")).tainted();
        Set<String> two = p.propagate(List.of("s1", "s2")).tainted();
        assertTrue(two.containsAll(one));
        assertEquals(Set.of("s1", "m", "top"), one);
    }

    @Test
    public void testEdgeIntoTaintedSymbolNeverTaintsLess() {
        Set<String> before = new TaintPropagator(diamond()).propagate(List.of("s1")).tainted();
        DependencyGraph wider = DependencyGraph.builder()
                .addNode("s1").addNode("s2").addNode("m").addNode("x").addNode("top").addNode("free")
                .addEdge("m", "s1")
                .addEdge("m", "s2")
                .addEdge("x", "s2")
                .addEdge("top", "m")
                .addEdge("free", "m")
                .build();
        TaintResult after = new TaintPropagator(wider).propagate(List.of("s1"));
        assertTrue(after.tainted().containsAll(before));
        assertEquals(Set.of("s1", "m", "top", "free"), after.tainted());
        assertEquals(Set.of("s1"), after.sources("free"));
    }

    @Test
    public void testCycleTerminatesAndExcludesSeedFromRadius() {
        DependencyGraph g = DependencyGraph.builder()
                .addNode("a").addNode("b").addNode("c")
                .addEdge("a", "b")
                .addEdge("b", "a")
                .addEdge("c", "a")
                .build();
        TaintPropagator p = new TaintPropagator(g);
        TaintResult r = p.propagate(List.of("a"));
        assertEquals(Set.of("a", "b", "c"), r.tainted());
        assertEquals(Integer.valueOf(2), r.seedRadius().get("a"));
        assertEquals(2, p.blastRadius("a"));
        assertEquals(Set.of("b", "c"), p.affectedBy("a"));
    }

    @Test
    public void testLeafHasZeroRadius() {
        TaintPropagator p = new TaintPropagator(diamond());
        assertEquals(0, p.blastRadius("top"));
        assertTrue(p.affectedBy("free").isEmpty());
        assertEquals(Set.of("m", "x", "top"), p.affectedBy("s2"));
    }

    @Test
    public void testUnknownSeedIsIgnored() {
        TaintResult r = new TaintPropagator(diamond()).propagate(List.of("nope"));
        assertEquals(0, r.taintedCount());
        assertTrue(r.seedRadius().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAffectedByUnknownSymbol() {
        new TaintPropagator(diamond()).affectedBy("nope");
    }
}
