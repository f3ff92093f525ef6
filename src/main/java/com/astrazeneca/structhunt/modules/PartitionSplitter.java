package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.data.Partition;
import com.astrazeneca.structhunt.data.Sequence;
import com.astrazeneca.structhunt.exception.WrongInputException;
import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.FastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.reference.ReferenceSequenceFile;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a multi-sequence FASTA input into single-sequence partitions.
 */
public class PartitionSplitter {
    public static final String PARTITION_EXTENSION = ".fa";
    public static final int DEFAULT_LINE_WIDTH = 60;

    private final int lineWidth;

    public PartitionSplitter() {
        this(DEFAULT_LINE_WIDTH);
    }

    /**
     * @param lineWidth bases per line in written partition files, 0 to write each sequence on one line
     */
    public PartitionSplitter(int lineWidth) {
        this.lineWidth = lineWidth;
    }

    /**
     * Reads all records of the FASTA file. Sequence names are truncated at the first whitespace, bases keep
     * their case and bytes, only line wraps are removed.
     * @param input multi-sequence FASTA file
     * @return map of sequence id to sequence in order of appearance
     * @throws WrongInputException if the file is missing, empty, has no headers or repeats a sequence id
     */
    public Map<String, Sequence> split(Path input) {
        if (!Files.isRegularFile(input)) {
            throw new WrongInputException("sequence file", input.toString(), "file not found");
        }
        Map<String, Sequence> sequences = new LinkedHashMap<>();
        try (ReferenceSequenceFile fasta = new FastaSequenceFile(input, true)) {
            ReferenceSequence record;
            while ((record = fasta.nextSequence()) != null) {
                String id = record.getName();
                if (id.isEmpty()) {
                    throw new WrongInputException("sequence file", input.toString(),
                            "record " + (sequences.size() + 1) + " has an empty header");
                }
                if (sequences.containsKey(id)) {
                    throw new WrongInputException("sequence file", input.toString(),
                            "sequence " + id + " occurs more than once");
                }
                byte[] bases = record.getBases();
                sequences.put(id, new Sequence(id, bases == null ? "" : new String(bases, StandardCharsets.ISO_8859_1)));
            }
        } catch (SAMException e) {
            throw new WrongInputException("sequence file", input.toString(), "no sequence headers found", e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (sequences.isEmpty()) {
            throw new WrongInputException("sequence file", input.toString(), "no sequences found");
        }
        return sequences;
    }

    /**
     * Writes every sequence to its own FASTA file &lt;id&gt;.fa in the work directory. Each file is written by
     * this call only, later stages write beside it with the same id prefix.
     * @param sequences sequences to write
     * @param workDirectory directory for partition files, created if absent
     * @return partitions in the order of the map
     */
    public List<Partition> writePartitions(Map<String, Sequence> sequences, Path workDirectory) {
        List<Partition> partitions = new ArrayList<>();
        try {
            Files.createDirectories(workDirectory);
            for (Sequence sequence : sequences.values()) {
                if (sequence.id.indexOf('/') >= 0 || sequence.id.indexOf('\\') >= 0) {
                    throw new WrongInputException("sequence id", sequence.id, "path separators can't be used in file names");
                }
                Path file = workDirectory.resolve(sequence.id + PARTITION_EXTENSION);
                writeFasta(sequence, file);
                partitions.add(new Partition(sequence.id, file, sequence.length()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return partitions;
    }

    private void writeFasta(Sequence sequence, Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.ISO_8859_1)) {
            writer.write(">");
            writer.write(sequence.id);
            writer.newLine();
            String bases = sequence.bases;
            if (lineWidth <= 0) {
                writer.write(bases);
                writer.newLine();
                return;
            }
            for (int i = 0; i < bases.length(); i += lineWidth) {
                writer.write(bases, i, Math.min(lineWidth, bases.length() - i));
                writer.newLine();
            }
        }
    }
}
