package com.astrazeneca.structhunt.predictor;

import com.astrazeneca.structhunt.data.Partition;
import com.astrazeneca.structhunt.exception.PredictorProcessException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs the predictor program as a child process: {@code <command> <args...> <partition file>}. The program
 * writes its artifacts beside the partition file, its own output streams are redirected to files next to them.
 */
public class ExternalProcessPredictor implements Predictor {
    public static final List<String> DEFAULT_ARGUMENTS = Collections.unmodifiableList(Arrays.asList("12", "8", "12"));
    public static final String DEFAULT_INTERMEDIATE_EXTENSION = ".Z-SCORE";
    public static final String DEFAULT_FINAL_EXTENSION = ".probability";
    public static final long DEFAULT_GRACE_MILLIS = 5000;

    static final String STDOUT_EXTENSION = ".out";
    static final String STDERR_EXTENSION = ".err";

    /**
     * Characters of error output kept in the failure text
     */
    static final int MAX_ERROR_TEXT = 4000;

    private final String command;
    private final List<String> arguments;
    private final String intermediateExtension;
    private final String finalExtension;
    private final long graceMillis;

    /**
     * Process time limit, 0 for no limit
     */
    private final long timeoutMillis;

    public ExternalProcessPredictor(String command) {
        this(command, DEFAULT_ARGUMENTS, DEFAULT_INTERMEDIATE_EXTENSION, DEFAULT_FINAL_EXTENSION,
                DEFAULT_GRACE_MILLIS, 0);
    }

    public ExternalProcessPredictor(String command, List<String> arguments, String intermediateExtension,
                                    String finalExtension, long graceMillis, long timeoutMillis) {
        this.command = command;
        this.arguments = new ArrayList<>(arguments);
        this.intermediateExtension = intermediateExtension;
        this.finalExtension = finalExtension;
        this.graceMillis = graceMillis;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public PredictorArtifacts run(Partition partition) throws PredictorProcessException, InterruptedException {
        Path stdout = sibling(partition, STDOUT_EXTENSION);
        Path stderr = sibling(partition, STDERR_EXTENSION);
        ProcessBuilder builder = new ProcessBuilder(commandLine(partition))
                .redirectOutput(stdout.toFile())
                .redirectError(stderr.toFile());
        Path directory = partition.sequenceFile.toAbsolutePath().getParent();
        if (directory != null) {
            builder.directory(directory.toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new PredictorProcessException(partition.id, "can't start " + command + ": " + e.getMessage(), e);
        }

        int exitCode;
        try {
            if (timeoutMillis > 0) {
                if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                    terminate(process);
                    throw new PredictorProcessException(partition.id, "timed out after " + timeoutMillis + " ms. "
                            + readErrorText(stderr));
                }
                exitCode = process.exitValue();
            } else {
                exitCode = process.waitFor();
            }
        } catch (InterruptedException e) {
            terminate(process);
            throw e;
        }

        if (exitCode != 0) {
            String errorText = readErrorText(stderr);
            throw new PredictorProcessException(partition.id, "exit code " + exitCode
                    + (errorText.isEmpty() ? "" : ": " + errorText));
        }
        return new PredictorArtifacts(intermediateArtifact(partition), finalArtifact(partition));
    }

    @Override
    public Path intermediateArtifact(Partition partition) {
        return sibling(partition, intermediateExtension);
    }

    @Override
    public Path finalArtifact(Partition partition) {
        return sibling(partition, finalExtension);
    }

    List<String> commandLine(Partition partition) {
        List<String> commandLine = new ArrayList<>();
        commandLine.add(command);
        commandLine.addAll(arguments);
        commandLine.add(partition.sequenceFile.toAbsolutePath().toString());
        return commandLine;
    }

    /**
     * Asks the process and its children to stop, kills the survivors after the grace period.
     */
    void terminate(Process process) {
        List<ProcessHandle> children = process.descendants().collect(Collectors.toList());
        children.forEach(ProcessHandle::destroy);
        process.destroy();
        boolean exited = false;
        try {
            exited = process.waitFor(graceMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!exited) {
            System.err.println("Predictor process " + process.pid() + " didn't stop in " + graceMillis
                    + " ms, killing it.");
        }
        children.forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private Path sibling(Partition partition, String extension) {
        return partition.sequenceFile.resolveSibling(partition.sequenceFile.getFileName() + extension);
    }

    private static String readErrorText(Path stderr) {
        try {
            String text = new String(Files.readAllBytes(stderr), StandardCharsets.UTF_8).trim();
            return text.length() > MAX_ERROR_TEXT ? text.substring(text.length() - MAX_ERROR_TEXT) : text;
        } catch (IOException e) {
            return "error output " + stderr + " can't be read: " + e.getMessage();
        }
    }
}
