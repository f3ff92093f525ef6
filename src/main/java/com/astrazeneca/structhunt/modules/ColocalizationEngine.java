package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.collection.IntervalIndex;
import com.astrazeneca.structhunt.data.ColocalizationPair;
import com.astrazeneca.structhunt.exception.ConfigurationException;
import htsjdk.samtools.util.Locatable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Relates two feature collections by distance between start positions or by interval overlap.
 * Queries index the second collection once, so the cost is O((|A| + |B|) log |B|) plus the number of pairs.
 */
public class ColocalizationEngine {
    private static final Comparator<Locatable> QUERY_ORDER = Comparator
            .comparing(Locatable::getContig)
            .thenComparingInt(Locatable::getStart)
            .thenComparingInt(Locatable::getEnd);

    /**
     * Pairs every a with every b on the same sequence whose starts are at most window apart, bounds included.
     * Swapping the arguments gives the same pairs with sides swapped.
     * @param setA query features
     * @param setB indexed features
     * @param window maximal distance, not negative
     * @return pairs ordered by a, then by b start
     */
    public <A extends Locatable, B extends Locatable> List<ColocalizationPair<A, B>> findProximal(
            Collection<? extends A> setA, Collection<? extends B> setB, int window) {
        if (window < 0) {
            throw new ConfigurationException("window", "must not be negative, got " + window);
        }
        IntervalIndex<B> index = IntervalIndex.buildIndex(setB);
        List<ColocalizationPair<A, B>> pairs = new ArrayList<>();
        for (A a : sorted(setA)) {
            for (B b : index.queryWindow(a.getContig(), a.getStart(), window)) {
                pairs.add(new ColocalizationPair<>(a.getContig(), a.getStart(), b.getStart(),
                        Math.abs(b.getStart() - a.getStart()), a, b));
            }
        }
        return pairs;
    }

    /**
     * Pairs features with the regions they intersect, both read as half-open intervals: touching ends don't overlap.
     * The pair distance is the length of the shared part.
     * @param features query features
     * @param regions indexed regions (genes, promoters)
     * @return pairs ordered by feature, then by region start
     */
    public <A extends Locatable, B extends Locatable> List<ColocalizationPair<A, B>> findOverlapping(
            Collection<? extends A> features, Collection<? extends B> regions) {
        IntervalIndex<B> index = IntervalIndex.buildIndex(regions);
        List<ColocalizationPair<A, B>> pairs = new ArrayList<>();
        for (A feature : sorted(features)) {
            for (B region : index.queryOverlap(feature)) {
                int extent = Math.min(feature.getEnd(), region.getEnd()) - Math.max(feature.getStart(), region.getStart());
                pairs.add(new ColocalizationPair<>(feature.getContig(), feature.getStart(), region.getStart(), extent,
                        feature, region));
            }
        }
        return pairs;
    }

    private static <T extends Locatable> List<T> sorted(Collection<? extends T> features) {
        List<T> result = new ArrayList<>(features);
        result.sort(QUERY_ORDER);
        return result;
    }
}
