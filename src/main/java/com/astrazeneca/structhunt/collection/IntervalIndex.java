package com.astrazeneca.structhunt.collection;

import htsjdk.samtools.util.Locatable;

import java.util.*;

/**
 * Per-sequence index of features sorted by start position. Window queries compare start positions, overlap
 * queries treat both the query and the features as half-open intervals.
 * @param <T> feature type
 */
public class IntervalIndex<T extends Locatable> {
    private static final Comparator<Locatable> START_ORDER = Comparator
            .comparingInt(Locatable::getStart)
            .thenComparingInt(Locatable::getEnd);

    private final Map<String, Bucket<T>> buckets;
    private final int size;

    private IntervalIndex(Map<String, Bucket<T>> buckets, int size) {
        this.buckets = buckets;
        this.size = size;
    }

    /**
     * Groups features by sequence and sorts each group by start, O(n log n).
     * @param features features to index, any order
     * @param <T> feature type
     * @return index over the features
     */
    public static <T extends Locatable> IntervalIndex<T> buildIndex(Collection<? extends T> features) {
        Map<String, List<T>> grouped = new LinkedHashMap<>();
        for (T feature : features) {
            grouped.computeIfAbsent(feature.getContig(), k -> new ArrayList<>()).add(feature);
        }
        Map<String, Bucket<T>> buckets = new HashMap<>();
        for (Map.Entry<String, List<T>> entry : grouped.entrySet()) {
            List<T> sorted = entry.getValue();
            sorted.sort(START_ORDER);
            buckets.put(entry.getKey(), new Bucket<>(sorted));
        }
        return new IntervalIndex<>(buckets, features.size());
    }

    /**
     * Features of the sequence whose start lies within window of position (both ends inclusive).
     * Binary search finds the bounding range, then the range is copied, O(log n + k).
     * @param sequenceId sequence to query
     * @param position query position
     * @param window maximal absolute distance
     * @return features in ascending start order, empty when the sequence isn't indexed
     */
    public List<T> queryWindow(String sequenceId, int position, int window) {
        Bucket<T> bucket = buckets.get(sequenceId);
        if (bucket == null) {
            return Collections.emptyList();
        }
        int from = bucket.lowerBound((long) position - window);
        int to = bucket.upperBound((long) position + window);
        if (from >= to) {
            return Collections.emptyList();
        }
        return new ArrayList<>(bucket.features.subList(from, to));
    }

    /**
     * Features intersecting the query interval: feature.start &lt; query.end and query.start &lt; feature.end.
     * @param query interval to intersect with
     * @return intersecting features in ascending start order
     */
    public List<T> queryOverlap(Locatable query) {
        Bucket<T> bucket = buckets.get(query.getContig());
        if (bucket == null) {
            return Collections.emptyList();
        }
        // nothing starting before query.start - maxLength can reach query.start
        int from = bucket.lowerBound((long) query.getStart() - bucket.maxLength);
        int to = bucket.lowerBound(query.getEnd());
        List<T> result = new ArrayList<>();
        for (int i = from; i < to; i++) {
            T feature = bucket.features.get(i);
            if (feature.getEnd() > query.getStart() && feature.getStart() < query.getEnd()) {
                result.add(feature);
            }
        }
        return result;
    }

    public Set<String> sequenceIds() {
        return Collections.unmodifiableSet(buckets.keySet());
    }

    /**
     * @param sequenceId sequence name
     * @return sorted features of the sequence
     */
    public List<T> features(String sequenceId) {
        Bucket<T> bucket = buckets.get(sequenceId);
        return bucket == null ? Collections.emptyList() : Collections.unmodifiableList(bucket.features);
    }

    public int size() {
        return size;
    }

    private static class Bucket<T extends Locatable> {
        final List<T> features;
        final int[] starts;
        final int maxLength;

        Bucket(List<T> sorted) {
            this.features = sorted;
            this.starts = new int[sorted.size()];
            int longest = 0;
            for (int i = 0; i < sorted.size(); i++) {
                T feature = sorted.get(i);
                starts[i] = feature.getStart();
                longest = Math.max(longest, feature.getEnd() - feature.getStart());
            }
            this.maxLength = longest;
        }

        /**
         * @return first index with start &gt;= value
         */
        int lowerBound(long value) {
            int low = 0;
            int high = starts.length;
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (starts[mid] < value) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            return low;
        }

        /**
         * @return first index with start &gt; value
         */
        int upperBound(long value) {
            int low = 0;
            int high = starts.length;
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (starts[mid] <= value) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            return low;
        }
    }
}
