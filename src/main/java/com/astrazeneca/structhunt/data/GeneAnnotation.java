package com.astrazeneca.structhunt.data;

import htsjdk.samtools.util.Locatable;

import java.util.Objects;

/**
 * Transcript record of the annotation input. Coordinates are 0-based and half-open, like motif candidates.
 */
public class GeneAnnotation implements Locatable {
    public final String sequenceId;
    public final int start;
    public final int end;
    public final Strand strand;
    public final String geneId;
    public final String geneName;

    public GeneAnnotation(String sequenceId, int start, int end, Strand strand, String geneId, String geneName) {
        if (start < 0 || start > end) {
            throw new IllegalArgumentException("Wrong annotation bounds " + sequenceId + ":" + start + "-" + end);
        }
        this.sequenceId = sequenceId;
        this.start = start;
        this.end = end;
        this.strand = strand;
        this.geneId = geneId;
        this.geneName = geneName == null ? geneId : geneName;
    }

    /**
     * @return 0-based position of the first transcribed base: start for the forward strand, end - 1 for the
     * reverse one
     */
    public int transcriptionStartSite() {
        return strand == Strand.FORWARD ? start : Math.max(start, end - 1);
    }

    public GenomicInterval toInterval() {
        return new GenomicInterval(sequenceId, start, end, geneId);
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
        GeneAnnotation that = (GeneAnnotation) o;
        return start == that.start &&
                end == that.end &&
                strand == that.strand &&
                Objects.equals(sequenceId, that.sequenceId) &&
                Objects.equals(geneId, that.geneId) &&
                Objects.equals(geneName, that.geneName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequenceId, start, end, strand, geneId, geneName);
    }

    @Override
    public String toString() {
        return "GeneAnnotation [" + geneId + " " + sequenceId + ":" + start + "-" + end + " " + strand.symbol + "]";
    }
}
