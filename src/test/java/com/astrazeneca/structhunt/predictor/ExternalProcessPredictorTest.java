package com.astrazeneca.structhunt.predictor;

import com.astrazeneca.structhunt.data.Partition;
import com.astrazeneca.structhunt.data.WorkerResult;
import com.astrazeneca.structhunt.exception.PredictorProcessException;
import org.testng.SkipException;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class ExternalProcessPredictorTest {
    private static final String SHELL = "/bin/sh";

    private Path tempDir;
    private Partition partition;

    @BeforeMethod
    public void setUp() throws IOException {
        if (!new File(SHELL).canExecute()) {
            throw new SkipException("No " + SHELL + " to run predictor scripts");
        }
        tempDir = Files.createTempDirectory("predictor");
        Path fasta = tempDir.resolve("chr1.fa");
        Files.write(fasta, ">chr1\nCGCGCGCGCG\n".getBytes(StandardCharsets.US_ASCII));
        partition = new Partition("chr1", fasta, 10);
    }

    @AfterMethod
    public void tearDown() throws IOException {
        if (tempDir == null) {
            return;
        }
        for (String name : tempDir.toFile().list()) {
            Files.delete(tempDir.resolve(name));
        }
        Files.delete(tempDir);
    }

    private ExternalProcessPredictor scriptPredictor(String body, long timeoutMillis) throws IOException {
        Path script = tempDir.resolve("predict.sh");
        Files.write(script, body.getBytes(StandardCharsets.US_ASCII));
        return new ExternalProcessPredictor(SHELL, Collections.singletonList(script.toString()),
                ".Z-SCORE", ".probability", 200, timeoutMillis);
    }

    @Test
    public void testCommandLine() {
        ExternalProcessPredictor predictor = new ExternalProcessPredictor("zhunt");

        List<String> commandLine = predictor.commandLine(partition);

        assertEquals(commandLine, Arrays.asList("zhunt", "12", "8", "12",
                partition.sequenceFile.toAbsolutePath().toString()));
        assertEquals(predictor.intermediateArtifact(partition), tempDir.resolve("chr1.fa.Z-SCORE"));
        assertEquals(predictor.finalArtifact(partition), tempDir.resolve("chr1.fa.probability"));
    }

    @Test
    public void testSuccessfulRun() throws Exception {
        ExternalProcessPredictor predictor = scriptPredictor(
                "echo \"1 2 3\" > \"$1.Z-SCORE\"\n" +
                "echo \"1 2 3 4\" > \"$1.probability\"\n" +
                "echo done\n", 0);

        PredictorArtifacts artifacts = predictor.run(partition);

        assertEquals(artifacts.existing(), Arrays.asList(tempDir.resolve("chr1.fa.Z-SCORE"),
                tempDir.resolve("chr1.fa.probability")));
        assertEquals(new String(Files.readAllBytes(tempDir.resolve("chr1.fa.out")), StandardCharsets.UTF_8).trim(),
                "done");
    }

    @Test
    public void testNonZeroExitCarriesErrorOutput() throws Exception {
        ExternalProcessPredictor predictor = scriptPredictor(
                "echo \"1 2 3\" > \"$1.Z-SCORE\"\n" +
                "echo \"cannot allocate table\" >&2\n" +
                "exit 3\n", 0);

        try {
            predictor.run(partition);
            fail("Nonzero exit must fail the partition");
        } catch (PredictorProcessException e) {
            assertEquals(e.partitionId, "chr1");
            assertEquals(e.errorText, "exit code 3: cannot allocate table");
        }
    }

    @Test
    public void testTimeoutKillsProcess() throws Exception {
        ExternalProcessPredictor predictor = scriptPredictor("sleep 30\n", 300);

        long start = System.currentTimeMillis();
        try {
            predictor.run(partition);
            fail("Hanging predictor must time out");
        } catch (PredictorProcessException e) {
            assertTrue(e.errorText.startsWith("timed out after 300 ms"), e.errorText);
        }
        assertTrue(System.currentTimeMillis() - start < 20000);
        assertFalse(Files.exists(predictor.finalArtifact(partition)));
    }

    @Test
    public void testMissingCommand() throws Exception {
        ExternalProcessPredictor predictor = new ExternalProcessPredictor(tempDir.resolve("no-such-predictor")
                .toString());

        try {
            predictor.run(partition);
            fail("Missing predictor must fail the partition");
        } catch (PredictorProcessException e) {
            assertTrue(e.errorText.startsWith("can't start"), e.errorText);
            assertTrue(e.getCause() instanceof IOException);
        }
    }

    @Test
    public void testPoolCancelLeavesNoProcesses() throws Exception {
        ExternalProcessPredictor predictor = scriptPredictor(
                "echo $$ > \"$1.pid\"\nsleep 300 &\necho $! > \"$1.child\"\nwait\n", 0);
        Path secondFasta = tempDir.resolve("chr2.fa");
        Files.write(secondFasta, ">chr2\nCGCGCGCGCG\n".getBytes(StandardCharsets.US_ASCII));
        List<Partition> partitions = Arrays.asList(partition, new Partition("chr2", secondFasta, 10));
        PredictorWorkerPool pool = new PredictorWorkerPool(0, 50, 200, null, 4);
        Thread canceller = new Thread(() -> {
            try {
                long deadline = System.currentTimeMillis() + 20000;
                while (!(hasPid(pidFile(partitions.get(0), ".child")) && hasPid(pidFile(partitions.get(1), ".child")))
                        && System.currentTimeMillis() < deadline) {
                    Thread.sleep(20);
                }
                pool.cancel();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        canceller.start();

        List<WorkerResult> results = pool.runAll(partitions, predictor, 2);
        canceller.join();

        assertEquals(results.size(), 2);
        for (WorkerResult result : results) {
            assertFalse(result.success);
            assertEquals(result.errorText, PredictorWorkerPool.CANCELLED);
        }
        long deadline = System.currentTimeMillis() + 200 + 2000;
        for (Partition cancelled : partitions) {
            for (String extension : Arrays.asList(".pid", ".child")) {
                long pid = Long.parseLong(new String(Files.readAllBytes(pidFile(cancelled, extension)),
                        StandardCharsets.US_ASCII).trim());
                while (isRunning(pid) && System.currentTimeMillis() < deadline) {
                    Thread.sleep(20);
                }
                assertFalse(isRunning(pid), "process " + pid + " of " + cancelled.id + " outlived the cancel");
            }
        }
    }

    private static Path pidFile(Partition partition, String extension) {
        return partition.sequenceFile.resolveSibling(partition.sequenceFile.getFileName() + extension);
    }

    private static boolean hasPid(Path file) {
        try {
            return Files.exists(file) && !new String(Files.readAllBytes(file), StandardCharsets.US_ASCII).trim()
                    .isEmpty();
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Alive and not a zombie waiting for a parent that never reaps it.
     */
    private static boolean isRunning(long pid) throws IOException {
        if (!ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false)) {
            return false;
        }
        Path stat = Paths.get("/proc", String.valueOf(pid), "stat");
        if (!Files.exists(stat)) {
            return true;
        }
        String text;
        try {
            text = new String(Files.readAllBytes(stat), StandardCharsets.US_ASCII);
        } catch (NoSuchFileException e) {
            return false;
        }
        int afterName = text.lastIndexOf(')');
        return afterName < 0 || text.length() < afterName + 3 || text.charAt(afterName + 2) != 'Z';
    }
}
