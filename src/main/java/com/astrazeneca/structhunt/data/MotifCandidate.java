package com.astrazeneca.structhunt.data;

import htsjdk.samtools.util.Locatable;

import java.util.Comparator;
import java.util.Objects;

/**
 * Scored, positioned match of a structural motif. Coordinates are 0-based and half-open.
 */
public class MotifCandidate implements Locatable {
    /**
     * Global output order: sequence name, start, end, then class and score to keep ties deterministic.
     */
    public static final Comparator<MotifCandidate> POSITION_ORDER = Comparator
            .comparing((MotifCandidate c) -> c.sequenceId)
            .thenComparingInt(c -> c.start)
            .thenComparingInt(c -> c.end)
            .thenComparing(c -> c.motifClass)
            .thenComparingDouble(c -> c.score);

    public final String sequenceId;
    public final int start;
    public final int end;

    /**
     * Matched bases. Empty when the predictor output carried no sequence text and no sequence was available
     * to cut it from.
     */
    public final String matchedText;
    public final MotifClass motifClass;

    /**
     * Pattern score for quadruplex repeats, quality metric for predicted structures
     */
    public final double score;
    public final MotifMetadata metadata;

    public MotifCandidate(String sequenceId, int start, int end, String matchedText, MotifClass motifClass,
                          double score, MotifMetadata metadata) {
        if (start < 0 || start >= end) {
            throw new IllegalArgumentException("Wrong motif bounds " + sequenceId + ":" + start + "-" + end);
        }
        if (!matchedText.isEmpty() && matchedText.length() != end - start) {
            throw new IllegalArgumentException("Matched text length " + matchedText.length()
                    + " differs from span " + sequenceId + ":" + start + "-" + end);
        }
        this.sequenceId = sequenceId;
        this.start = start;
        this.end = end;
        this.matchedText = matchedText;
        this.motifClass = motifClass;
        this.score = score;
        this.metadata = metadata;
    }

    public int length() {
        return end - start;
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
        MotifCandidate that = (MotifCandidate) o;
        return start == that.start &&
                end == that.end &&
                Double.compare(that.score, score) == 0 &&
                Objects.equals(sequenceId, that.sequenceId) &&
                Objects.equals(matchedText, that.matchedText) &&
                motifClass == that.motifClass &&
                Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequenceId, start, end, matchedText, motifClass, score, metadata);
    }

    @Override
    public String toString() {
        return "MotifCandidate [" + motifClass.label + " " + sequenceId + ":" + start + "-" + end
                + ", score=" + score + ", text=" + matchedText + "]";
    }
}
