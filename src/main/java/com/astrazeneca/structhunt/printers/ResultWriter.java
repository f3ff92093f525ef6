package com.astrazeneca.structhunt.printers;

import com.astrazeneca.structhunt.Configuration;
import com.astrazeneca.structhunt.data.ColocalizationPair;
import com.astrazeneca.structhunt.data.GenomicInterval;
import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;
import com.astrazeneca.structhunt.data.PartitionFailure;
import com.astrazeneca.structhunt.modules.AggregatedResults;
import com.astrazeneca.structhunt.modules.ColocalizationStatistics;
import com.astrazeneca.structhunt.modules.MotifSummary;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static com.astrazeneca.structhunt.Utils.getRoundedValueToPrint;

/**
 * Writes result tables into the output directory, one file per table, or prints them one after another with
 * the configured printer when no directory is set. Summaries always go to STDERR.
 */
public class ResultWriter {
    public static final String TABLE_EXTENSION = ".tsv";
    public static final String BED_EXTENSION = ".bed";
    public static final String GENE_LIST_EXTENSION = ".genes.txt";
    public static final String COLOCALIZATION_TABLE = "colocalization";

    private final Path outputDir;
    private final boolean printHeader;
    private final boolean writeBed;
    private final int auxScores;
    private final RecordPrinter consolePrinter;

    public ResultWriter(Configuration conf) {
        this(conf.outputDir == null ? null : Paths.get(conf.outputDir), conf.printHeader, conf.writeBed,
                conf.predictorFormat.auxColumns.length, RecordPrinter.createPrinter(conf.printerType));
    }

    public ResultWriter(Path outputDir, boolean printHeader, boolean writeBed, int auxScores,
                        RecordPrinter consolePrinter) {
        this.outputDir = outputDir;
        this.printHeader = printHeader;
        this.writeBed = writeBed;
        this.auxScores = auxScores;
        this.consolePrinter = consolePrinter;
        if (outputDir != null) {
            try {
                Files.createDirectories(outputDir);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    public void writeCandidates(MotifClass motifClass, List<MotifCandidate> candidates) {
        String header = MotifCandidateOutput.header(motifClass, auxScores);
        try (Table table = table(motifClass.label + TABLE_EXTENSION, header)) {
            for (MotifCandidate candidate : candidates) {
                table.printer.print(new MotifCandidateOutput(candidate));
            }
        }
        if (writeBed && outputDir != null) {
            try (Table bed = table(motifClass.label + BED_EXTENSION, null)) {
                for (MotifCandidate candidate : candidates) {
                    bed.printer.print(new BedOutput(candidate));
                }
            }
        }
    }

    public void writePairs(List<ColocalizationPair<MotifCandidate, MotifCandidate>> pairs) {
        try (Table table = table(COLOCALIZATION_TABLE + TABLE_EXTENSION, ColocalizationPairOutput.HEADER)) {
            for (ColocalizationPair<MotifCandidate, MotifCandidate> pair : pairs) {
                table.printer.print(new ColocalizationPairOutput(pair));
            }
        }
    }

    /**
     * Writes overlap rows and, in the output directory, the list of hit genes.
     * @param motifClass class of the overlapping motifs
     * @param regionKind "genes" or "promoters"
     * @param pairs motif and region pairs
     */
    public void writeOverlaps(MotifClass motifClass, String regionKind,
                              List<ColocalizationPair<MotifCandidate, GenomicInterval>> pairs) {
        String name = motifClass.label + "." + regionKind;
        try (Table table = table(name + TABLE_EXTENSION, RegionOverlapOutput.HEADER)) {
            for (ColocalizationPair<MotifCandidate, GenomicInterval> pair : pairs) {
                table.printer.print(new RegionOverlapOutput(pair));
            }
        }
        if (outputDir != null) {
            try {
                GeneListWriter.write(outputDir.resolve(name + GENE_LIST_EXTENSION), pairs);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        System.err.println(motifClass.label + " overlaps " + GeneListWriter.geneIds(pairs).size() + " " + regionKind
                + " (" + pairs.size() + " pairs)");
    }

    public void printSummary(MotifSummary summary) {
        System.err.println(summary.motifClass.label + ": " + summary.count + " candidates, score mean "
                + getRoundedValueToPrint("0.00", summary.meanScore) + ", min "
                + getRoundedValueToPrint("0.00", summary.minScore) + ", max "
                + getRoundedValueToPrint("0.00", summary.maxScore));
        for (Map.Entry<String, Integer> entry : summary.perSequence.entrySet()) {
            System.err.println("    " + entry.getKey() + ": " + entry.getValue());
        }
    }

    public void printStatistics(ColocalizationStatistics statistics) {
        System.err.println("Colocalized pairs: " + statistics.totalPairs + ", quadruplexes with a partner: "
                + statistics.distinctA + ", structures with a partner: " + statistics.distinctB
                + ", mean distance: " + getRoundedValueToPrint("0.00", statistics.meanDistance));
        for (Map.Entry<String, ColocalizationStatistics.SequenceSummary> entry : statistics.perSequence.entrySet()) {
            ColocalizationStatistics.SequenceSummary summary = entry.getValue();
            System.err.println("    " + entry.getKey() + ": " + summary.countA + " / " + summary.countB + ", pairs "
                    + summary.pairs + ", rate " + getRoundedValueToPrint("0.0000", summary.rate));
        }
    }

    /**
     * Enumerates failed partitions and the run status.
     */
    public void printStatus(AggregatedResults results) {
        for (PartitionFailure failure : results.failures) {
            System.err.println("Partition " + failure.partitionId + " failed: " + failure.errorText);
        }
        if (results.skippedLines > 0) {
            System.err.println(results.skippedLines + " malformed predictor output lines were skipped.");
        }
        System.err.println("Run status: " + results.status + (results.failures.isEmpty() ? ""
                : " (" + results.failures.size() + " failed partitions)"));
    }

    private Table table(String fileName, String header) {
        if (outputDir == null) {
            if (printHeader && header != null) {
                consolePrinter.printHeader(header);
            }
            return new Table(consolePrinter, false);
        }
        try {
            FileRecordPrinter printer = new FileRecordPrinter(outputDir.resolve(fileName));
            if (header != null) {
                printer.printHeader(header);
            }
            return new Table(printer, true);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Printer of one table, closed only when it owns a file.
     */
    private static class Table implements AutoCloseable {
        final RecordPrinter printer;
        final boolean ownsFile;

        Table(RecordPrinter printer, boolean ownsFile) {
            this.printer = printer;
            this.ownsFile = ownsFile;
        }

        @Override
        public void close() {
            if (ownsFile) {
                ((FileRecordPrinter) printer).close();
            } else {
                printer.getOut().flush();
            }
        }
    }
}
