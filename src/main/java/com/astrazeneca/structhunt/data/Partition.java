package com.astrazeneca.structhunt.data;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One independently processed unit of the input: a single sequence written to its own FASTA file.
 */
public class Partition {
    /**
     * Partition id, equal to the sequence id
     */
    public final String id;

    /**
     * Single-sequence FASTA file the predictor runs on
     */
    public final Path sequenceFile;

    /**
     * Number of bases in the partition
     */
    public final long length;

    public Partition(String id, Path sequenceFile, long length) {
        this.id = id;
        this.sequenceFile = sequenceFile;
        this.length = length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Partition partition = (Partition) o;
        return length == partition.length &&
                Objects.equals(id, partition.id) &&
                Objects.equals(sequenceFile, partition.sequenceFile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sequenceFile, length);
    }

    @Override
    public String toString() {
        return "Partition [id=" + id + ", file=" + sequenceFile + ", length=" + length + "]";
    }
}
