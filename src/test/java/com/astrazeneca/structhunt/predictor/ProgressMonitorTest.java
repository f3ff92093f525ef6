package com.astrazeneca.structhunt.predictor;

import com.astrazeneca.structhunt.data.Partition;
import com.astrazeneca.structhunt.data.PartitionProgress;
import com.astrazeneca.structhunt.data.PartitionStatus;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

public class ProgressMonitorTest {
    private Path tempDir;
    private ExternalProcessPredictor predictor;

    @BeforeMethod
    public void setUp() throws IOException {
        tempDir = Files.createTempDirectory("monitor");
        predictor = new ExternalProcessPredictor("predictor");
    }

    @AfterMethod
    public void tearDown() throws IOException {
        for (String name : tempDir.toFile().list()) {
            Files.delete(tempDir.resolve(name));
        }
        Files.delete(tempDir);
    }

    @Test
    public void testStatusFollowsArtifacts() throws IOException {
        Partition chr1 = new Partition("chr1", tempDir.resolve("chr1.fa"), 100);
        Partition chr2 = new Partition("chr2", tempDir.resolve("chr2.fa"), 100);
        Partition chr3 = new Partition("chr3", tempDir.resolve("chr3.fa"), 100);
        Files.write(predictor.intermediateArtifact(chr2), "1 2 3\n".getBytes(StandardCharsets.US_ASCII));
        Files.write(predictor.intermediateArtifact(chr3), "1 2 3\n".getBytes(StandardCharsets.US_ASCII));
        Files.write(predictor.finalArtifact(chr3), "1 2 3 4\n".getBytes(StandardCharsets.US_ASCII));
        ProgressContext context = new ProgressContext();
        List<Map<String, PartitionProgress>> snapshots = new ArrayList<>();
        ProgressMonitor monitor = new ProgressMonitor(context, predictor, Arrays.asList(chr1, chr2, chr3), 60000,
                snapshots::add);

        monitor.start();
        assertEquals(context.get("chr1").status, PartitionStatus.STARTING);
        monitor.markFinished("chr3");
        monitor.poll();

        assertEquals(context.get("chr1").status, PartitionStatus.STARTING);
        assertEquals(context.get("chr2").status, PartitionStatus.COMPUTING);
        assertEquals(context.get("chr2").intermediateSize, 6);
        assertEquals(context.get("chr3").status, PartitionStatus.COMPLETED);
        assertEquals(context.get("chr3").finalSize, 8);
        assertNull(context.get("chr4"));
        assertEquals(snapshots.size(), 1);
        assertEquals(snapshots.get(0).keySet().iterator().next(), "chr1");

        monitor.markFinished("chr1");
        monitor.stop();
        assertEquals(context.get("chr1").status, PartitionStatus.COMPLETED);
        assertEquals(snapshots.size(), 2);
    }
}
