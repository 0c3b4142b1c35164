package com.proofaudit.pdg.lex;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class SentenceSplitterTest {

    @Test
    public void testEmptyInput() {
        assertTrue(SentenceSplitter.split("").isEmpty());
        assertTrue(SentenceSplitter.split("  \n\t ").isEmpty());
    }

    @Test
    public void testSplitsOnPeriodFollowedByBlank() {
        List<Sentence> s = SentenceSplitter.split("Lemma foo : True.\nProof. exact I. Qed.");
        assertEquals(4, s.size());
        assertEquals("Lemma foo : True.", s.get(0).text());
        assertEquals(1, s.get(0).line());
        assertEquals("Proof.", s.get(1).text());
        assertEquals(2, s.get(1).line());
        assertEquals("exact I.", s.get(2).text());
        assertEquals("Qed.", s.get(3).text());
        assertEquals("Qed", s.get(3).body());
    }

    @Test
    public void testDottedIdentifiersAreNotSplit() {
        List<Sentence> s = SentenceSplitter.split("Check Nat.add. Print x.");
        assertEquals(2, s.size());
        assertEquals("Check Nat.add.", s.get(0).text());
        assertEquals("Print x.", s.get(1).text());
    }

    @Test
    public void testPeriodInsideStringDoesNotSplit() {
        List<Sentence> s = SentenceSplitter.split("Definition s := \"a. b\". Next.");
        assertEquals(2, s.size());
        assertEquals("Definition s := \"a. b\".", s.get(0).text());
        assertEquals("Next.", s.get(1).text());
    }

    @Test
    public void testLineIsFirstNonBlankCharacter() {
        List<Sentence> s = SentenceSplitter.split("Lemma a : True.\n\n\n   Lemma b : True.");
        assertEquals(2, s.size());
        assertEquals(4, s.get(1).line());
    }

    @Test
    public void testMultiLineSentenceKeepsStartLine() {
        List<Sentence> s = SentenceSplitter.split("\nLemma a\n  : True.");
        assertEquals(1, s.size());
        assertEquals(2, s.get(0).line());
        assertEquals("Lemma a\n  : True.", s.get(0).text());
    }

    @Test
    public void testTrailingTextWithoutTerminator() {
        List<Sentence> s = SentenceSplitter.split("Lemma a : True. Qed");
        assertEquals(2, s.size());
        assertEquals("Qed", s.get(1).text());
        assertEquals("Qed", s.get(1).body());
    }

    @Test
    public void testEllipsisTerminator() {
        List<Sentence> s = SentenceSplitter.split("auto... Qed.");
        assertEquals(2, s.size());
        assertEquals("auto", s.get(0).body());
    }
}
