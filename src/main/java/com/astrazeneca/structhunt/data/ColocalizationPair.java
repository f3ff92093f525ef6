package com.astrazeneca.structhunt.data;

import htsjdk.samtools.util.Locatable;

import java.util.Objects;

/**
 * Two features found close to each other (window query) or overlapping (region query).
 * @param <A> type of the query side feature
 * @param <B> type of the indexed side feature
 */
public class ColocalizationPair<A extends Locatable, B extends Locatable> {
    public final String sequenceId;
    public final int positionA;
    public final int positionB;

    /**
     * Absolute distance between positions for window queries, overlap extent for region queries
     */
    public final int distance;
    public final A refA;
    public final B refB;

    public ColocalizationPair(String sequenceId, int positionA, int positionB, int distance, A refA, B refB) {
        if (distance < 0) {
            throw new IllegalArgumentException("Negative distance " + distance + " on " + sequenceId);
        }
        this.sequenceId = sequenceId;
        this.positionA = positionA;
        this.positionB = positionB;
        this.distance = distance;
        this.refA = refA;
        this.refB = refB;
    }

    /**
     * @return the same pair seen from the other side
     */
    public ColocalizationPair<B, A> swap() {
        return new ColocalizationPair<>(sequenceId, positionB, positionA, distance, refB, refA);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColocalizationPair<?, ?> that = (ColocalizationPair<?, ?>) o;
        return positionA == that.positionA &&
                positionB == that.positionB &&
                distance == that.distance &&
                Objects.equals(sequenceId, that.sequenceId) &&
                Objects.equals(refA, that.refA) &&
                Objects.equals(refB, that.refB);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequenceId, positionA, positionB, distance, refA, refB);
    }

    @Override
    public String toString() {
        return "ColocalizationPair [" + sequenceId + " " + positionA + "<->" + positionB + ", distance=" + distance + "]";
    }
}
