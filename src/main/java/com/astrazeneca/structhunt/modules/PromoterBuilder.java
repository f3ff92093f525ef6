package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.data.GeneAnnotation;
import com.astrazeneca.structhunt.data.GenomicInterval;
import com.astrazeneca.structhunt.data.Strand;
import com.astrazeneca.structhunt.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Derives promoter regions around transcription start sites.
 */
public class PromoterBuilder {
    public static final int DEFAULT_FLANK = 1000;

    private final int upstream;
    private final int downstream;

    public PromoterBuilder() {
        this(DEFAULT_FLANK, DEFAULT_FLANK);
    }

    public PromoterBuilder(int upstream, int downstream) {
        if (upstream < 0) {
            throw new ConfigurationException("promoter upstream", "must not be negative, got " + upstream);
        }
        if (downstream < 0) {
            throw new ConfigurationException("promoter downstream", "must not be negative, got " + downstream);
        }
        this.upstream = upstream;
        this.downstream = downstream;
    }

    /**
     * Upstream is towards lower positions on the forward strand and towards higher ones on the reverse strand.
     * The promoter holds the start site base and the flanks around it, the start is clamped to 0.
     * @param gene annotation
     * @return 0-based half-open promoter named by the gene id
     */
    public GenomicInterval promoter(GeneAnnotation gene) {
        long tss = gene.transcriptionStartSite();
        long start;
        long end;
        if (gene.strand == Strand.FORWARD) {
            start = tss - upstream;
            end = tss + downstream + 1;
        } else {
            start = tss - downstream;
            end = tss + upstream + 1;
        }
        start = Math.max(0, start);
        end = Math.min(Integer.MAX_VALUE, Math.max(start, end));
        return new GenomicInterval(gene.sequenceId, (int) start, (int) end, gene.geneId);
    }

    public List<GenomicInterval> promoters(Collection<GeneAnnotation> genes) {
        List<GenomicInterval> promoters = new ArrayList<>(genes.size());
        for (GeneAnnotation gene : genes) {
            promoters.add(promoter(gene));
        }
        return promoters;
    }
}
