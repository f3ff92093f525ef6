package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Count and score range of the candidates of one motif class.
 */
public class MotifSummary {
    public final MotifClass motifClass;
    public final long count;

    /**
     * Score statistics, NaN when there are no candidates
     */
    public final double meanScore;
    public final double minScore;
    public final double maxScore;
    public final Map<String, Integer> perSequence;

    private MotifSummary(MotifClass motifClass, SummaryStatistics scores, Map<String, Integer> perSequence) {
        this.motifClass = motifClass;
        this.count = scores.getN();
        this.meanScore = scores.getMean();
        this.minScore = scores.getMin();
        this.maxScore = scores.getMax();
        this.perSequence = Collections.unmodifiableMap(perSequence);
    }

    public static MotifSummary of(MotifClass motifClass, Collection<MotifCandidate> candidates) {
        SummaryStatistics scores = new SummaryStatistics();
        Map<String, Integer> perSequence = new TreeMap<>();
        for (MotifCandidate candidate : candidates) {
            scores.addValue(candidate.score);
            perSequence.merge(candidate.sequenceId, 1, Integer::sum);
        }
        return new MotifSummary(motifClass, scores, perSequence);
    }
}
