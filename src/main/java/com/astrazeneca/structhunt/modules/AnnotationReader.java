package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.data.GeneAnnotation;
import com.astrazeneca.structhunt.data.Strand;
import com.astrazeneca.structhunt.exception.MalformedLineException;
import com.astrazeneca.structhunt.exception.WrongInputException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

import static com.astrazeneca.structhunt.data.Patterns.GENE_ID_ATTRIBUTE;
import static com.astrazeneca.structhunt.data.Patterns.GENE_NAME_ATTRIBUTE;
import static com.astrazeneca.structhunt.data.Patterns.INTEGER_ONLY;
import static com.astrazeneca.structhunt.data.Patterns.TAB;

/**
 * Reads transcript records of a GTF annotation into {@link GeneAnnotation}s.
 */
public class AnnotationReader {
    public static final String DEFAULT_FEATURE_TYPE = "transcript";

    private static final int GTF_COLUMNS = 9;
    private static final int SEQUENCE_COLUMN = 0;
    private static final int FEATURE_COLUMN = 2;
    private static final int START_COLUMN = 3;
    private static final int END_COLUMN = 4;
    private static final int STRAND_COLUMN = 6;
    private static final int ATTRIBUTES_COLUMN = 8;

    private final String featureType;
    private final int maxWarnings;

    public AnnotationReader() {
        this(DEFAULT_FEATURE_TYPE, PredictorOutputParser.DEFAULT_MAX_WARNINGS);
    }

    public AnnotationReader(String featureType, int maxWarnings) {
        this.featureType = featureType;
        this.maxWarnings = maxWarnings;
    }

    /**
     * Reads records of the configured feature type. Other feature types are ignored, malformed lines are skipped
     * with a warning for the first of them.
     * @param gtf annotation file
     * @return annotations in file order
     * @throws WrongInputException if the file doesn't exist
     */
    public List<GeneAnnotation> read(Path gtf) {
        if (!Files.isRegularFile(gtf)) {
            throw new WrongInputException("annotation", gtf.toString(), "file not found");
        }
        List<GeneAnnotation> annotations = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(gtf, StandardCharsets.ISO_8859_1)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                try {
                    GeneAnnotation annotation = parseLine(line, lineNumber, gtf.toString());
                    if (annotation != null) {
                        annotations.add(annotation);
                    }
                } catch (MalformedLineException e) {
                    skipped++;
                    if (skipped <= maxWarnings) {
                        System.err.println("WARNING: " + e.getMessage());
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (skipped > maxWarnings) {
            System.err.println("WARNING: " + (skipped - maxWarnings) + " more malformed lines of " + gtf
                    + " were skipped.");
        }
        return annotations;
    }

    /**
     * @return annotation or null when the line describes another feature type
     */
    GeneAnnotation parseLine(String line, int lineNumber, String fileName) {
        String[] columns = TAB.split(line);
        if (columns.length < GTF_COLUMNS) {
            throw new MalformedLineException(fileName, lineNumber, "expected " + GTF_COLUMNS + " tab separated columns, found "
                    + columns.length);
        }
        if (!featureType.equals(columns[FEATURE_COLUMN])) {
            return null;
        }
        int start = toCoordinate(columns[START_COLUMN], "start", lineNumber, fileName);
        int end = toCoordinate(columns[END_COLUMN], "end", lineNumber, fileName);
        if (start < 1) {
            throw new MalformedLineException(fileName, lineNumber, "start " + start + " is before the first base");
        }
        if (start > end) {
            throw new MalformedLineException(fileName, lineNumber, "start " + start + " is after end " + end);
        }
        Strand strand = Strand.fromSymbol(columns[STRAND_COLUMN]);
        if (strand == null) {
            throw new MalformedLineException(fileName, lineNumber, "unknown strand \"" + columns[STRAND_COLUMN] + "\"");
        }
        Matcher geneId = GENE_ID_ATTRIBUTE.matcher(columns[ATTRIBUTES_COLUMN]);
        if (!geneId.find()) {
            throw new MalformedLineException(fileName, lineNumber, "no gene_id attribute");
        }
        Matcher geneName = GENE_NAME_ATTRIBUTE.matcher(columns[ATTRIBUTES_COLUMN]);
        // 1-based closed [start, end] is 0-based half-open [start - 1, end)
        return new GeneAnnotation(columns[SEQUENCE_COLUMN], start - 1, end, strand, geneId.group(1),
                geneName.find() ? geneName.group(1) : null);
    }

    private static int toCoordinate(String value, String field, int lineNumber, String fileName) {
        if (!INTEGER_ONLY.matcher(value).matches()) {
            throw new MalformedLineException(fileName, lineNumber, field + " \"" + value + "\" is not a position");
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new MalformedLineException(fileName, lineNumber, field + " \"" + value + "\" is out of range");
        }
    }
}
