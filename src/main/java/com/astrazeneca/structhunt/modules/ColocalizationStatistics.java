package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.data.ColocalizationPair;
import htsjdk.samtools.util.Locatable;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Summary numbers of a colocalization pair list.
 */
public class ColocalizationStatistics {
    public final int totalPairs;

    /**
     * A-side features with at least one partner
     */
    public final int distinctA;

    /**
     * B-side features with at least one partner
     */
    public final int distinctB;

    /**
     * Mean pair distance, NaN when there are no pairs
     */
    public final double meanDistance;

    /**
     * Per sequence counts, sorted by sequence name
     */
    public final Map<String, SequenceSummary> perSequence;

    private ColocalizationStatistics(int totalPairs, int distinctA, int distinctB, double meanDistance,
                                     Map<String, SequenceSummary> perSequence) {
        this.totalPairs = totalPairs;
        this.distinctA = distinctA;
        this.distinctB = distinctB;
        this.meanDistance = meanDistance;
        this.perSequence = Collections.unmodifiableMap(perSequence);
    }

    /**
     * @param pairs pairs found between the sets
     * @param setA all A-side features, used for per sequence counts
     * @param setB all B-side features, used for per sequence counts
     * @return statistics of the pairs
     */
    public static <A extends Locatable, B extends Locatable> ColocalizationStatistics of(
            Collection<ColocalizationPair<A, B>> pairs, Collection<? extends A> setA, Collection<? extends B> setB) {
        Set<A> partneredA = new HashSet<>();
        Set<B> partneredB = new HashSet<>();
        DescriptiveStatistics distances = new DescriptiveStatistics();
        Map<String, int[]> counts = new TreeMap<>();
        for (A a : setA) {
            counts.computeIfAbsent(a.getContig(), k -> new int[3])[0]++;
        }
        for (B b : setB) {
            counts.computeIfAbsent(b.getContig(), k -> new int[3])[1]++;
        }
        for (ColocalizationPair<A, B> pair : pairs) {
            partneredA.add(pair.refA);
            partneredB.add(pair.refB);
            distances.addValue(pair.distance);
            counts.computeIfAbsent(pair.sequenceId, k -> new int[3])[2]++;
        }
        Map<String, SequenceSummary> perSequence = new TreeMap<>();
        for (Map.Entry<String, int[]> entry : counts.entrySet()) {
            int[] c = entry.getValue();
            perSequence.put(entry.getKey(), new SequenceSummary(c[0], c[1], c[2]));
        }
        return new ColocalizationStatistics(pairs.size(), partneredA.size(), partneredB.size(), distances.getMean(),
                perSequence);
    }

    public static class SequenceSummary {
        public final int countA;
        public final int countB;
        public final int pairs;

        /**
         * Pairs per A-side feature, 0 without A-side features
         */
        public final double rate;

        SequenceSummary(int countA, int countB, int pairs) {
            this.countA = countA;
            this.countB = countB;
            this.pairs = pairs;
            this.rate = countA == 0 ? 0 : (double) pairs / countA;
        }
    }
}
