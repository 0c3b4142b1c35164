package com.proofaudit.pdg.glob;

import com.proofaudit.pdg.lex.CommentStripper;
import com.proofaudit.pdg.model.ByteRange;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class StatementExtractorTest {

    private final StatementExtractor extractor = new StatementExtractor(300, 2000);

    private static String extract(StatementExtractor extractor, String source, String name) {
        byte[] stripped = CommentStripper.strip(source.getBytes(StandardCharsets.UTF_8));
        int start = source.indexOf(name);
        return extractor.extract(stripped, new ByteRange(start, start + name.length() - 1));
    }

    @Test
    public void testSimpleStatement() {
        assertEquals("Lemma foo : True.", extract(extractor, "Lemma foo : True.\nProof. Qed.", "foo"));
    }

    @Test
    public void testLongestKeywordWinsOnTie() {
        assertEquals("Global Instance inst : C := {}.",
                extract(extractor, "Global Instance inst : C := {}.", "inst"));
    }

    @Test
    public void testNearestKeywordWins() {
        assertEquals("Lemma foo : True.", extract(extractor, "Definition d := 1.\nLemma foo : True.", "foo"));
    }

    @Test
    public void testKeywordMustBeWholeWord() {
        assertEquals("Let x := 1. NotLemma foo : True.",
                extract(extractor, "Let x := 1. NotLemma foo : True.", "foo"));
    }

    @Test
    public void testWhitespaceAndCommentsCollapse() {
        assertEquals("Lemma foo : True.", extract(extractor, "Lemma (* note *)\n   foo :\n True.", "foo"));
    }

    @Test
    public void testFallsBackToNameOutsideWindow() {
        assertEquals("foo : True.", extract(new StatementExtractor(3, 2000), "Lemma foo : True.", "foo"));
    }

    @Test
    public void testTruncation() {
        assertEquals("Lemma foo " + StatementExtractor.TRUNCATION_MARKER,
                extract(new StatementExtractor(300, 10), "Lemma foo : True.", "foo"));
    }

    @Test
    public void testRangeOutsideSource() {
        assertEquals("", extractor.extract("Lemma a.".getBytes(StandardCharsets.UTF_8), new ByteRange(100, 102)));
    }

    @Test
    public void testPeriodInsideStringDoesNotEndStatement() {
        assertEquals("Definition s := \"a. b\".", extract(extractor, "Definition s := \"a. b\".\nDefinition t := 1.", "s"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveLength() {
        new StatementExtractor(10, 0);
    }
}
