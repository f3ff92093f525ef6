package com.astrazeneca.structhunt;

import com.astrazeneca.structhunt.data.GeneAnnotation;
import com.astrazeneca.structhunt.data.Partition;
import com.astrazeneca.structhunt.data.PartitionProgress;
import com.astrazeneca.structhunt.data.RunStatus;
import com.astrazeneca.structhunt.data.Sequence;
import com.astrazeneca.structhunt.exception.WrongInputException;
import com.astrazeneca.structhunt.modes.AbstractMode;
import com.astrazeneca.structhunt.modes.IntegratedMode;
import com.astrazeneca.structhunt.modes.ScanMode;
import com.astrazeneca.structhunt.modules.AnnotationReader;
import com.astrazeneca.structhunt.modules.PartitionSplitter;
import com.astrazeneca.structhunt.predictor.ExternalProcessPredictor;
import com.astrazeneca.structhunt.predictor.Predictor;
import com.astrazeneca.structhunt.predictor.PredictorWorkerPool;
import com.astrazeneca.structhunt.printers.ResultWriter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Class starts StructHunt for the current run
 */
public class StructHuntLauncher {
    static final String PARTITIONS_DIR = "partitions";

    /**
     * Checks every input, then starts the scan-only or the integrated mode.
     * @param config starting configuration
     * @return status of the run
     * @throws com.astrazeneca.structhunt.exception.ConfigurationException if a parameter is wrong
     * @throws WrongInputException if an input file can't be used
     */
    public RunStatus start(Configuration config) {
        config.validate();
        if (config.y) {
            System.err.println("TIME: Start: " + LocalDateTime.now());
        }
        PartitionSplitter splitter = new PartitionSplitter(config.lineWidth);
        Map<String, Sequence> sequences = splitter.split(Paths.get(config.input));
        List<GeneAnnotation> annotations = config.annotation == null
                ? Collections.emptyList()
                : new AnnotationReader(AnnotationReader.DEFAULT_FEATURE_TYPE, config.maxWarnings)
                        .read(Paths.get(config.annotation));
        if (config.predictorEnabled()) {
            checkPredictorCommand(config.predictorCommand);
        }
        if (config.y) {
            System.err.println("TIME: Inputs read, " + sequences.size() + " sequences, " + annotations.size()
                    + " transcripts: " + LocalDateTime.now());
        }

        ResultWriter writer = new ResultWriter(config);
        if (!config.predictorEnabled()) {
            return run(new ScanMode(config, sequences, annotations, writer), config);
        }

        List<Partition> partitions = splitter.writePartitions(sequences, workDir(config));
        Predictor predictor = new ExternalProcessPredictor(config.predictorCommand, config.predictorArguments,
                config.intermediateExtension, config.finalExtension, config.graceMillis, config.timeoutMillis);
        PredictorWorkerPool pool = new PredictorWorkerPool(config.minPartitionLength, config.pollIntervalMillis,
                config.graceMillis, config.y ? StructHuntLauncher::printProgress : null);
        Thread cancelOnExit = new Thread(pool::cancel, "predictor-cancel");
        Runtime.getRuntime().addShutdownHook(cancelOnExit);
        try {
            return run(new IntegratedMode(config, sequences, annotations, writer, partitions, predictor, pool), config);
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(cancelOnExit);
            } catch (IllegalStateException e) {
                System.err.println("Shutdown in progress, predictor processes are being stopped.");
            }
        }
    }

    private RunStatus run(AbstractMode mode, Configuration config) {
        RunStatus status = config.threads == 1 ? mode.notParallel() : mode.parallel();
        if (config.y) {
            System.err.println("TIME: Finish: " + LocalDateTime.now());
        }
        return status;
    }

    /**
     * Directory for partition files: -w, then <outputDir>/partitions, then a new temporary directory.
     */
    Path workDir(Configuration config) {
        try {
            if (config.workDir != null) {
                return Files.createDirectories(Paths.get(config.workDir));
            }
            if (config.outputDir != null) {
                return Files.createDirectories(Paths.get(config.outputDir, PARTITIONS_DIR));
            }
            return Files.createTempDirectory("structhunt");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * A command given as a path must be an executable file, a bare name is looked up in PATH at launch.
     */
    void checkPredictorCommand(String command) {
        Path path = Paths.get(command);
        if (path.getParent() == null) {
            return;
        }
        if (!Files.isRegularFile(path) || !Files.isExecutable(path)) {
            throw new WrongInputException("predictor", command, "not an executable file");
        }
    }

    private static void printProgress(Map<String, PartitionProgress> progress) {
        for (Map.Entry<String, PartitionProgress> entry : progress.entrySet()) {
            System.err.println("PROGRESS: " + entry.getKey() + " " + entry.getValue());
        }
    }
}
