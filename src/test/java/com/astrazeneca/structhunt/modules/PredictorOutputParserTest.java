package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.data.AlternativeStructureMetadata;
import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;
import com.astrazeneca.structhunt.data.PredictorOutputFormat;
import com.astrazeneca.structhunt.data.Sequence;
import com.astrazeneca.structhunt.exception.MalformedLineException;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class PredictorOutputParserTest {
    private Path tempDir;

    @BeforeMethod
    public void setUp() throws IOException {
        tempDir = Files.createTempDirectory("parser");
    }

    @AfterMethod
    public void tearDown() throws IOException {
        try (DirectoryStream<Path> paths = Files.newDirectoryStream(tempDir)) {
            for (Path path : paths) {
                Files.delete(path);
            }
        }
        Files.delete(tempDir);
    }

    private Path output(String... lines) throws IOException {
        Path file = tempDir.resolve("chr1.fa.probability");
        Files.write(file, Arrays.asList(lines), StandardCharsets.US_ASCII);
        return file;
    }

    @Test
    public void testOnlyLinesInBandAreKept() throws IOException {
        Path file = output(
                "1 0.5 0.7 310.5 CGCGCGCGCGCG",
                "20 0.1 0.2 299.9 CGCGCGCGCGCG",
                "40 0.4 0.3 350 CACGCGCGCGCG",
                "60 0.3 0.3 400.1 CGCGCGCGCGCA",
                "80 0.9 0.8 399 TGCGCGCGCGCG");

        List<MotifCandidate> candidates = new PredictorOutputParser().parse(file, "chr1", 300, 400);

        assertEquals(candidates.size(), 3);
        MotifCandidate first = candidates.get(0);
        assertEquals(first.sequenceId, "chr1");
        assertEquals(first.start, 0);
        assertEquals(first.end, 12);
        assertEquals(first.matchedText, "CGCGCGCGCGCG");
        assertEquals(first.motifClass, MotifClass.ALTERNATIVE_STRUCTURE);
        assertEquals(first.score, 310.5);
        assertTrue(Arrays.equals(((AlternativeStructureMetadata) first.metadata).auxScores, new double[]{0.5, 0.7}));
        assertEquals(candidates.get(1).start, 39);
        assertEquals(candidates.get(2).start, 79);
    }

    @Test
    public void testBandBoundsAreInclusive() throws IOException {
        Path file = output("1 0 0 300", "2 0 0 400");

        assertEquals(new PredictorOutputParser().parse(file, "chr1", 300, 400).size(), 2);
    }

    @Test
    public void testMissingFileGivesNoCandidates() {
        assertTrue(new PredictorOutputParser().parse(tempDir.resolve("absent"), "chr1", 300, 400).isEmpty());
    }

    @Test
    public void testMalformedLinesAreSkippedAndWarningsBounded() throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("# position score1 score2 metric sequence");
        lines.add("");
        for (int i = 0; i < 15; i++) {
            lines.add("x 0.1 0.2 350");
        }
        lines.add("5 0.1 0.2");
        lines.add("5 0.1 0.2 350 ACGT extra columns");
        lines.add("5 0.1 0.2 NaN");
        lines.add("7 0.1 0.2 350 CGCG");
        Path file = output(lines.toArray(new String[0]));

        PredictorOutputParser.ParseReport report = new PredictorOutputParser(PredictorOutputFormat.DEFAULT, 10)
                .parseReport(file, "chr1", null, 300, 400);

        assertEquals(report.candidates.size(), 1);
        assertEquals(report.candidates.get(0).start, 6);
        assertEquals(report.skippedLines, 18);
        assertEquals(report.getWarnings().size(), 10);
        assertTrue(report.getWarnings().get(0).contains("Line 3 "), report.getWarnings().get(0));
    }

    @Test
    public void testWindowTextIsCutFromSequence() throws IOException {
        Path file = output("3 0.1 0.2 350", "9 0.1 0.2 350");
        Sequence source = new Sequence("chr1", "aaCGCGCGCGCGCGtt");

        PredictorOutputParser parser = new PredictorOutputParser(
                new PredictorOutputFormat(0, 3, new int[]{1, 2}, -1, 4, 4, true, 12), 10);
        List<MotifCandidate> candidates = parser.parseReport(file, "chr1", source, 300, 400).candidates;

        assertEquals(candidates.size(), 2);
        assertEquals(candidates.get(0).matchedText, "CGCGCGCGCGCG");
        assertEquals(candidates.get(0).end, 14);
        // window is clipped at the sequence end
        assertEquals(candidates.get(1).start, 8);
        assertEquals(candidates.get(1).end, 16);
        assertEquals(candidates.get(1).matchedText, "CGCGCGTT");
    }

    @Test
    public void testWindowWithoutText() throws IOException {
        Path file = output("0 350 0.1", "10 320 0.2");

        PredictorOutputParser parser = new PredictorOutputParser(
                new PredictorOutputFormat(0, 1, new int[]{2}, -1, 3, 3, false, 8), 10);
        List<MotifCandidate> candidates = parser.parse(file, "chr2", 300, 400);

        assertEquals(candidates.size(), 2);
        assertEquals(candidates.get(0).start, 0);
        assertEquals(candidates.get(0).end, 8);
        assertEquals(candidates.get(0).matchedText, "");
        assertEquals(candidates.get(1).score, 320.0);
    }

    @Test
    public void testWindowPastLargestPositionIsSkipped() throws IOException {
        Path file = output("1 0.1 0.2 350", "2147483647 0.1 0.2 350", "20 0.1 0.2 360");

        PredictorOutputParser.ParseReport report = new PredictorOutputParser()
                .parseReport(file, "chr1", null, 300, 400);

        assertEquals(report.candidates.size(), 2);
        assertEquals(report.candidates.get(1).start, 19);
        assertEquals(report.skippedLines, 1);
        assertTrue(report.getWarnings().get(0).contains("Line 2 "), report.getWarnings().get(0));
    }

    @Test(expectedExceptions = MalformedLineException.class)
    public void testParseLineIsStrict() {
        new PredictorOutputParser().parseLine("12 0.1 abc 350", 1, "chr1.fa.probability");
    }

    @Test(expectedExceptions = MalformedLineException.class)
    public void testZeroPositionOfOneBasedLayout() {
        new PredictorOutputParser().parseLine("0 0.1 0.2 350", 1, "chr1.fa.probability");
    }
}
