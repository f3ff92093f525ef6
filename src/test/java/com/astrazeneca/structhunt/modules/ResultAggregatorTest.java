package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;
import com.astrazeneca.structhunt.data.PartitionFailure;
import com.astrazeneca.structhunt.data.RunStatus;
import com.astrazeneca.structhunt.data.Sequence;
import com.astrazeneca.structhunt.data.WorkerResult;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.astrazeneca.structhunt.modules.ColocalizationEngineTest.quadruplex;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class ResultAggregatorTest {
    private Path tempDir;
    private ResultAggregator aggregator;

    @BeforeMethod
    public void setUp() throws IOException {
        tempDir = Files.createTempDirectory("aggregator");
        aggregator = new ResultAggregator(new PredictorOutputParser(), ".probability", 300, 400);
    }

    @AfterMethod
    public void tearDown() throws IOException {
        for (String name : tempDir.toFile().list()) {
            Files.delete(tempDir.resolve(name));
        }
        Files.delete(tempDir);
    }

    private Path artifact(String partitionId, String... lines) throws IOException {
        Path file = tempDir.resolve(partitionId + ".fa.probability");
        Files.write(file, Arrays.asList(lines), StandardCharsets.US_ASCII);
        return file;
    }

    @Test
    public void testScannerCandidatesAreSortedAndDeduplicated() {
        List<MotifCandidate> chr2 = Arrays.asList(quadruplex("chr2", 50), quadruplex("chr2", 10));
        List<MotifCandidate> chr1 = Arrays.asList(quadruplex("chr1", 700), quadruplex("chr1", 700),
                quadruplex("chr1", 3));

        AggregatedResults results = aggregator.aggregate(Arrays.asList(chr2, chr1));

        List<MotifCandidate> candidates = results.candidates(MotifClass.QUADRUPLEX_REPEAT);
        assertEquals(candidates, Arrays.asList(quadruplex("chr1", 3), quadruplex("chr1", 700),
                quadruplex("chr2", 10), quadruplex("chr2", 50)));
        assertTrue(results.candidates(MotifClass.ALTERNATIVE_STRUCTURE).isEmpty());
        assertEquals(results.status, RunStatus.SUCCESS);
        assertTrue(results.failures.isEmpty());
    }

    @Test
    public void testFailedPartitionIsReportedAndNotParsed() throws IOException {
        Path good = artifact("chr1", "5 0.1 0.2 350 CGCGCGCGCGCG", "1 0.1 0.2 330 CGCGCGCGCGCG");
        // left over from an earlier run, must not be read
        artifact("chr2", "5 0.1 0.2 350 CGCGCGCGCGCG");
        List<WorkerResult> workerResults = Arrays.asList(
                WorkerResult.failed("chr2", 120, "exit code 3: segmentation fault"),
                WorkerResult.succeeded("chr1", 300, Collections.singletonList(good)));

        AggregatedResults results = aggregator.aggregate(Collections.<List<MotifCandidate>>emptyList(),
                workerResults, Collections.<String, Sequence>emptyMap());

        List<MotifCandidate> structures = results.candidates(MotifClass.ALTERNATIVE_STRUCTURE);
        assertEquals(structures.size(), 2);
        assertEquals(structures.get(0).start, 0);
        assertEquals(structures.get(1).start, 4);
        for (MotifCandidate structure : structures) {
            assertEquals(structure.sequenceId, "chr1");
        }
        assertEquals(results.failures, Collections.singletonList(
                new PartitionFailure("chr2", "exit code 3: segmentation fault")));
        assertEquals(results.status, RunStatus.PARTIAL_SUCCESS);
    }

    @Test
    public void testAllPartitionsFailed() {
        List<WorkerResult> workerResults = Arrays.asList(WorkerResult.failed("chr1", 1, "killed"),
                WorkerResult.failed("chr2", 1, ""));

        AggregatedResults results = aggregator.aggregate(
                Collections.singletonList(Collections.singletonList(quadruplex("chr1", 3))),
                workerResults, Collections.<String, Sequence>emptyMap());

        assertEquals(results.status, RunStatus.FAILURE);
        assertEquals(results.failures.size(), 2);
        assertEquals(results.failures.get(1).errorText, "no error output captured");
        assertEquals(results.totalCandidates(), 1);
    }

    @Test
    public void testSuccessWithoutFinalArtifact() {
        List<WorkerResult> workerResults = Collections.singletonList(
                WorkerResult.succeeded("chr1", 1, Collections.<Path>emptyList()));

        AggregatedResults results = aggregator.aggregate(Collections.<List<MotifCandidate>>emptyList(),
                workerResults, Collections.<String, Sequence>emptyMap());

        assertEquals(results.status, RunStatus.SUCCESS);
        assertEquals(results.totalCandidates(), 0);
    }

    @Test
    public void testSummary() {
        List<MotifCandidate> candidates = Arrays.asList(quadruplex("chr1", 3), quadruplex("chr1", 40),
                quadruplex("chr2", 10));

        MotifSummary summary = MotifSummary.of(MotifClass.QUADRUPLEX_REPEAT, candidates);

        assertEquals(summary.count, 3);
        assertEquals(summary.meanScore, 90.0, 1e-9);
        assertEquals(summary.perSequence.get("chr1"), Integer.valueOf(2));
        assertEquals(summary.perSequence.get("chr2"), Integer.valueOf(1));
        assertTrue(Double.isNaN(MotifSummary.of(MotifClass.ALTERNATIVE_STRUCTURE,
                Collections.<MotifCandidate>emptyList()).meanScore));
    }
}
