package com.astrazeneca.structhunt;

import com.astrazeneca.structhunt.data.PredictorOutputFormat;
import com.astrazeneca.structhunt.exception.ConfigurationException;
import com.astrazeneca.structhunt.modules.PartitionSplitter;
import com.astrazeneca.structhunt.modules.PredictorOutputParser;
import com.astrazeneca.structhunt.modules.PromoterBuilder;
import com.astrazeneca.structhunt.modules.SequenceScanner;
import com.astrazeneca.structhunt.predictor.ExternalProcessPredictor;
import com.astrazeneca.structhunt.predictor.PredictorWorkerPool;
import com.astrazeneca.structhunt.predictor.ProgressMonitor;
import com.astrazeneca.structhunt.printers.PrinterType;

import java.util.ArrayList;
import java.util.List;

public class Configuration {
    public static final int DEFAULT_MIN_RUN_LENGTH = 3;
    public static final int DEFAULT_MAX_RUN_LENGTH = 7;
    public static final int DEFAULT_MAX_LOOP_LENGTH = 7;
    public static final double DEFAULT_MIN_SCORE = 50;
    public static final double DEFAULT_MIN_METRIC = 300;
    public static final double DEFAULT_MAX_METRIC = 400;
    public static final int DEFAULT_WINDOW = 1000;

    /**
     * Multi-sequence FASTA input
     */
    public String input; // -i
    /**
     * Directory for result tables. Tables go to the printer when it isn't set
     */
    public String outputDir; // -o
    /**
     * Directory for partition files and predictor artifacts. Defaults to <outputDir>/partitions or a temporary
     * directory
     */
    public String workDir; // -w
    /**
     * GTF annotation for gene and promoter overlaps
     */
    public String annotation; // -g
    /**
     * Print a header row describing columns
     */
    public boolean printHeader; // -h
    /**
     * Print timing and predictor progress to STDERR
     */
    public boolean y; // -y

    public char repeatBase = SequenceScanner.DEFAULT_REPEAT_BASE; // -b
    /**
     * First run-length class scanned
     */
    public int minRunLength = DEFAULT_MIN_RUN_LENGTH; // -r
    /**
     * First run-length class not scanned
     */
    public int maxRunLength = DEFAULT_MAX_RUN_LENGTH; // -R
    public int maxLoopLength = DEFAULT_MAX_LOOP_LENGTH; // -l
    /**
     * Quadruplex candidates scored below are dropped
     */
    public double minScore = DEFAULT_MIN_SCORE; // -m

    /**
     * Predictor program. Only the scanner runs when it isn't set
     */
    public String predictorCommand; // -p
    public List<String> predictorArguments = new ArrayList<>(ExternalProcessPredictor.DEFAULT_ARGUMENTS); // -a
    public String intermediateExtension = ExternalProcessPredictor.DEFAULT_INTERMEDIATE_EXTENSION; // -zext
    public String finalExtension = ExternalProcessPredictor.DEFAULT_FINAL_EXTENSION; // -pext
    /**
     * Quality metric band of predicted structures, both bounds inclusive
     */
    public double minMetric = DEFAULT_MIN_METRIC; // -z
    public double maxMetric = DEFAULT_MAX_METRIC; // -Z
    public PredictorOutputFormat predictorFormat = PredictorOutputFormat.DEFAULT;

    /**
     * Maximal distance between quadruplexes and predicted structures to pair them
     */
    public int window = DEFAULT_WINDOW; // -W
    public int upstream = PromoterBuilder.DEFAULT_FLANK; // -u
    public int downstream = PromoterBuilder.DEFAULT_FLANK; // -d

    /**
     * Number of scanning threads
     */
    public int threads = 1; // -th
    /**
     * Maximum number of simultaneous predictor runs, never more than the available processors
     */
    public int predictorThreads = Runtime.getRuntime().availableProcessors(); // -pth
    /**
     * Partitions not longer than this don't go to the predictor
     */
    public long minPartitionLength = PredictorWorkerPool.DEFAULT_MIN_PARTITION_LENGTH; // -M
    public long pollIntervalMillis = ProgressMonitor.DEFAULT_POLL_INTERVAL_MILLIS; // -I
    public long graceMillis = ExternalProcessPredictor.DEFAULT_GRACE_MILLIS; // -grace
    /**
     * Predictor time limit per partition, 0 for no limit
     */
    public long timeoutMillis; // -timeout
    /**
     * Malformed lines reported per input file
     */
    public int maxWarnings = PredictorOutputParser.DEFAULT_MAX_WARNINGS; // -warn
    public int lineWidth = PartitionSplitter.DEFAULT_LINE_WIDTH; // -L
    /**
     * Write BED files of the candidates besides the tables
     */
    public boolean writeBed; // -bed

    public PrinterType printerType = PrinterType.OUT; // -DP

    public boolean predictorEnabled() {
        return predictorCommand != null;
    }

    /**
     * Checks the parameters before anything is read or started.
     * @throws ConfigurationException for the first wrong parameter
     */
    public void validate() {
        if (input == null) {
            throw new ConfigurationException("-i", "input FASTA file is required");
        }
        if (minRunLength < 1) {
            throw new ConfigurationException("-r", "minimal run length must be positive, got " + minRunLength);
        }
        if (minRunLength > maxRunLength) {
            throw new ConfigurationException("-R", "run length range " + minRunLength + ".." + maxRunLength
                    + " is reversed");
        }
        if (maxLoopLength < 1) {
            throw new ConfigurationException("-l", "maximal loop length must be positive, got " + maxLoopLength);
        }
        if (minMetric > maxMetric) {
            throw new ConfigurationException("-z", "minimal metric " + minMetric + " is greater than maximal "
                    + maxMetric);
        }
        if (window <= 0) {
            throw new ConfigurationException("-W", "window must be positive, got " + window);
        }
        if (upstream < 0 || downstream < 0) {
            throw new ConfigurationException("-u/-d", "promoter flanks must not be negative");
        }
        if (threads < 1) {
            throw new ConfigurationException("-th", "thread count must be positive, got " + threads);
        }
        if (predictorThreads < 1) {
            throw new ConfigurationException("-pth", "predictor run count must be positive, got " + predictorThreads);
        }
        if (minPartitionLength < 0) {
            throw new ConfigurationException("-M", "must not be negative, got " + minPartitionLength);
        }
        if (pollIntervalMillis <= 0) {
            throw new ConfigurationException("-I", "poll interval must be positive, got " + pollIntervalMillis);
        }
        if (graceMillis < 0) {
            throw new ConfigurationException("-grace", "must not be negative, got " + graceMillis);
        }
        if (timeoutMillis < 0) {
            throw new ConfigurationException("-timeout", "must not be negative, got " + timeoutMillis);
        }
        if (maxWarnings < 0) {
            throw new ConfigurationException("-warn", "must not be negative, got " + maxWarnings);
        }
        if (lineWidth < 0) {
            throw new ConfigurationException("-L", "must not be negative, got " + lineWidth);
        }
        predictorFormat.validate();
    }
}
