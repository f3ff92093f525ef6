package com.astrazeneca.structhunt.data;


import htsjdk.samtools.util.Locatable;

import java.util.Objects;

/**
 * Class for holding a generic span on a sequence (gene body, promoter)
 */
public class GenomicInterval implements Locatable {
    /**
     * Sequence (chromosome) name
     */
    public final String sequenceId;

    /**
     * Interval start position
     */
    public final int start;

    /**
     * Interval end position, exclusive in overlap tests
     */
    public final int end;

    /**
     * Gene id the interval was derived from, or sequence name when the interval is anonymous
     */
    public final String name;

    public GenomicInterval(String sequenceId, int start, int end, String name) {
        if (start < 0 || start > end) {
            throw new IllegalArgumentException("Wrong interval bounds " + sequenceId + ":" + start + "-" + end);
        }
        this.sequenceId = sequenceId;
        this.start = start;
        this.end = end;
        this.name = name;
    }

    public GenomicInterval(String sequenceId, int start, int end) {
        this(sequenceId, start, end, sequenceId);
    }

    @Override
    public String getContig() {
        return sequenceId;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenomicInterval interval = (GenomicInterval) o;
        return start == interval.start &&
                end == interval.end &&
                Objects.equals(sequenceId, interval.sequenceId) &&
                Objects.equals(name, interval.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequenceId, start, end, name);
    }

    @Override
    public String toString() {
        return "GenomicInterval [sequenceId=" + sequenceId + ", start=" + start + ", end=" + end + ", name=" + name + "]";
    }

    public String printInterval() {
        return sequenceId + ":" + start + "-" + end;
    }
}
