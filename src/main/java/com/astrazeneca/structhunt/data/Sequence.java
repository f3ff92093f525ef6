package com.astrazeneca.structhunt.data;

import java.util.Objects;

/**
 * One named nucleotide sequence (chromosome or contig) with the line wraps removed.
 */
public class Sequence {
    /**
     * Sequence name from the FASTA header, truncated at the first whitespace
     */
    public final String id;

    /**
     * Bases as they were read, case preserved
     */
    public final String bases;

    public Sequence(String id, String bases) {
        this.id = id;
        this.bases = bases;
    }

    public int length() {
        return bases.length();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Sequence sequence = (Sequence) o;
        return Objects.equals(id, sequence.id) &&
                Objects.equals(bases, sequence.bases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, bases);
    }

    @Override
    public String toString() {
        return "Sequence [id=" + id + ", length=" + bases.length() + "]";
    }
}
