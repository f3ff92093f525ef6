package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.data.AlternativeStructureMetadata;
import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;
import com.astrazeneca.structhunt.data.PredictorOutputFormat;
import com.astrazeneca.structhunt.data.Sequence;
import com.astrazeneca.structhunt.exception.MalformedLineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static com.astrazeneca.structhunt.data.Patterns.WHITESPACES;

/**
 * Reads the final output of the structure predictor and keeps the windows whose quality metric falls in a band.
 */
public class PredictorOutputParser {
    public static final int DEFAULT_MAX_WARNINGS = 10;

    private final PredictorOutputFormat format;
    private final int maxWarnings;

    public PredictorOutputParser() {
        this(PredictorOutputFormat.DEFAULT, DEFAULT_MAX_WARNINGS);
    }

    public PredictorOutputParser(PredictorOutputFormat format, int maxWarnings) {
        this.format = format;
        this.maxWarnings = maxWarnings;
    }

    /**
     * Parses the file without a sequence to cut window text from.
     * @see #parseReport(Path, String, Sequence, double, double)
     */
    public List<MotifCandidate> parse(Path file, String sequenceId, double minScore, double maxScore) {
        return parseReport(file, sequenceId, null, minScore, maxScore).candidates;
    }

    /**
     * Each well-formed line gives one candidate if its quality metric is in [minScore, maxScore]. Malformed lines
     * are skipped and only the first warnings are printed, the whole file is always read.
     * @param file predictor final output
     * @param sequenceId sequence the file belongs to
     * @param source sequence to cut window text from when the layout has no sequence column, may be null
     * @param minScore lowest accepted metric, inclusive
     * @param maxScore highest accepted metric, inclusive
     * @return parsed candidates with skip statistics, empty if the file doesn't exist
     */
    public ParseReport parseReport(Path file, String sequenceId, Sequence source, double minScore, double maxScore) {
        ParseReport report = new ParseReport();
        if (!Files.isRegularFile(file)) {
            System.err.println("Predictor output " + file + " wasn't found, no structures are read for " + sequenceId);
            return report;
        }
        String fileName = file.toString();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                try {
                    PredictorRecord record = parseLine(trimmed, lineNumber, fileName);
                    if (record.metric < minScore || record.metric > maxScore) {
                        report.outOfRange++;
                        continue;
                    }
                    report.candidates.add(toCandidate(record, sequenceId, source, lineNumber, fileName));
                } catch (MalformedLineException e) {
                    report.skip(e.getMessage(), maxWarnings);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (report.skippedLines > maxWarnings) {
            System.err.println("WARNING: " + (report.skippedLines - maxWarnings) + " more malformed lines of "
                    + fileName + " were skipped.");
        }
        return report;
    }

    /**
     * Strict parse of one line against the layout.
     * @param line trimmed non-comment line
     * @param lineNumber 1-based line number for diagnostics
     * @param fileName file name for diagnostics
     * @return typed record
     * @throws MalformedLineException if the column count or a numeric field is wrong
     */
    PredictorRecord parseLine(String line, int lineNumber, String fileName) {
        String[] columns = WHITESPACES.split(line);
        if (columns.length < format.minColumns || columns.length > format.maxColumns) {
            throw new MalformedLineException(fileName, lineNumber, "expected " + format.minColumns + "-"
                    + format.maxColumns + " columns, found " + columns.length);
        }
        int position = parseInt(columns[format.positionColumn], "position", lineNumber, fileName);
        if (format.oneBasedPositions) {
            position--;
        }
        if (position < 0) {
            throw new MalformedLineException(fileName, lineNumber, "negative position " + columns[format.positionColumn]);
        }
        double metric = parseDouble(columns[format.metricColumn], "quality metric", lineNumber, fileName);
        double[] aux = new double[format.auxColumns.length];
        for (int i = 0; i < aux.length; i++) {
            aux[i] = parseDouble(columns[format.auxColumns[i]], "score column " + (format.auxColumns[i] + 1),
                    lineNumber, fileName);
        }
        String text = format.hasSequenceColumn() && format.sequenceColumn < columns.length
                ? columns[format.sequenceColumn].toUpperCase(Locale.ROOT)
                : "";
        return new PredictorRecord(position, metric, aux, text);
    }

    private MotifCandidate toCandidate(PredictorRecord record, String sequenceId, Sequence source, int lineNumber,
                                       String fileName) {
        int start = record.position;
        String text = record.sequenceText;
        long end;
        if (!text.isEmpty()) {
            end = (long) start + text.length();
        } else if (source != null) {
            if (start >= source.length()) {
                throw new MalformedLineException(fileName, lineNumber, "position " + start
                        + " is after the end of " + sequenceId);
            }
            end = Math.min((long) start + format.windowLength, source.length());
            text = source.bases.substring(start, (int) end).toUpperCase(Locale.ROOT);
        } else {
            end = (long) start + format.windowLength;
        }
        if (end > Integer.MAX_VALUE) {
            throw new MalformedLineException(fileName, lineNumber, "window at " + start
                    + " ends after the largest supported position");
        }
        return new MotifCandidate(sequenceId, start, (int) end, text, MotifClass.ALTERNATIVE_STRUCTURE, record.metric,
                new AlternativeStructureMetadata(record.metric, record.auxScores));
    }

    private static int parseInt(String value, String field, int lineNumber, String fileName) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new MalformedLineException(fileName, lineNumber, field + " \"" + value + "\" is not an integer");
        }
    }

    private static double parseDouble(String value, String field, int lineNumber, String fileName) {
        try {
            double parsed = Double.parseDouble(value);
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                throw new MalformedLineException(fileName, lineNumber, field + " \"" + value + "\" is not finite");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new MalformedLineException(fileName, lineNumber, field + " \"" + value + "\" is not a number");
        }
    }

    /**
     * One line of predictor output typed against the layout.
     */
    static class PredictorRecord {
        final int position;
        final double metric;
        final double[] auxScores;
        final String sequenceText;

        PredictorRecord(int position, double metric, double[] auxScores, String sequenceText) {
            this.position = position;
            this.metric = metric;
            this.auxScores = auxScores;
            this.sequenceText = sequenceText;
        }
    }

    /**
     * Candidates of one file with the numbers of skipped and filtered lines.
     */
    public static class ParseReport {
        public final List<MotifCandidate> candidates = new ArrayList<>();
        public int skippedLines;
        public int outOfRange;
        private final List<String> warnings = new ArrayList<>();

        void skip(String reason, int maxWarnings) {
            skippedLines++;
            if (warnings.size() < maxWarnings) {
                warnings.add(reason);
                System.err.println("WARNING: " + reason);
            }
        }

        /**
         * @return reasons of the first skipped lines
         */
        public List<String> getWarnings() {
            return Collections.unmodifiableList(warnings);
        }
    }
}
