package com.proofaudit.pdg;

import com.proofaudit.pdg.scan.UnterminatedProofPolicy;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class AnalysisOptionsTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testDefaults() {
        AnalysisOptions o = AnalysisOptions.defaults();
        assertEquals(FrontEnd.HEURISTIC, o.getFrontEnd());
        assertEquals(UnterminatedProofPolicy.MARK_UNTERMINATED, o.getUnterminatedProofPolicy());
        assertTrue(o.isProofBodyReferences());
        assertEquals(300, o.getStatementWindowBytes());
        assertEquals(2000, o.getMaxStatementLength());
        assertEquals(500_000, o.getProofScanLimitBytes());
        assertTrue(o.getParallelism() >= 1);
    }

    @Test
    public void testParsePartialJson() {
        AnalysisOptions o = AnalysisOptions.parse(
                "{\"frontEnd\": \"metadata\", \"parallelism\": 3, \"unterminatedProofPolicy\": \"assume_complete\","
                        + " \"someFutureKey\": true}");
        assertEquals(FrontEnd.METADATA, o.getFrontEnd());
        assertEquals(3, o.getParallelism());
        assertEquals(UnterminatedProofPolicy.ASSUME_COMPLETE, o.getUnterminatedProofPolicy());
        assertEquals(300, o.getStatementWindowBytes());
    }

    @Test
    public void testLoadFromFile() throws Exception {
        Path file = tmp.newFile("pdg.json").toPath();
        Files.write(file, "{\"proofBodyReferences\": false, \"maxStatementLength\": 80}".getBytes(StandardCharsets.UTF_8));
        AnalysisOptions o = AnalysisOptions.load(file);
        assertFalse(o.isProofBodyReferences());
        assertEquals(80, o.getMaxStatementLength());
    }

    @Test(expected = UncheckedIOException.class)
    public void testLoadMissingFile() {
        AnalysisOptions.load(tmp.getRoot().toPath().resolve("absent.json"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOutOfRangeValueRejected() {
        AnalysisOptions.parse("{\"proofScanLimitBytes\": 0}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownFrontEndRejected() {
        AnalysisOptions.parse("{\"frontEnd\": \"telepathy\"}");
    }

    @Test
    public void testFrontEndFromString() {
        assertEquals(FrontEnd.METADATA, FrontEnd.fromString("Metadata"));
    }

    @Test
    public void testScannerFollowsFrontEnd() {
        AnalysisOptions o = AnalysisOptions.defaults();
        assertTrue(ProjectAnalyzer.scannerFor(o) instanceof com.proofaudit.pdg.scan.HeuristicScanner);
        o.setFrontEnd(FrontEnd.METADATA);
        assertTrue(ProjectAnalyzer.scannerFor(o) instanceof com.proofaudit.pdg.glob.MetadataScanner);
    }
}
