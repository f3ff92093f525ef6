package com.astrazeneca.structhunt.collection;

import com.astrazeneca.structhunt.data.GenomicInterval;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class IntervalIndexTest {
    private final IntervalIndex<GenomicInterval> index = IntervalIndex.buildIndex(Arrays.asList(
            new GenomicInterval("chr1", 500, 510),
            new GenomicInterval("chr1", 100, 110),
            new GenomicInterval("chr1", 300, 5000),
            new GenomicInterval("chr1", 200, 210),
            new GenomicInterval("chr2", 100, 110)));

    @Test
    public void testFeaturesAreSortedPerSequence() {
        List<GenomicInterval> features = index.features("chr1");

        assertEquals(features.size(), 4);
        assertEquals(features.get(0).start, 100);
        assertEquals(features.get(3).start, 500);
        assertEquals(index.size(), 5);
        assertEquals(index.sequenceIds().size(), 2);
    }

    @Test
    public void testWindowBoundsAreInclusive() {
        List<GenomicInterval> found = index.queryWindow("chr1", 150, 50);

        assertEquals(found.size(), 2);
        assertEquals(found.get(0).start, 100);
        assertEquals(found.get(1).start, 200);
        assertEquals(index.queryWindow("chr1", 150, 49).size(), 0);
    }

    @Test
    public void testWindowOnUnknownSequence() {
        assertTrue(index.queryWindow("chrX", 100, 1000).isEmpty());
    }

    @Test
    public void testOverlapIsHalfOpen() {
        assertTrue(index.queryOverlap(new GenomicInterval("chr1", 110, 200)).isEmpty());

        List<GenomicInterval> found = index.queryOverlap(new GenomicInterval("chr1", 109, 201));
        assertEquals(found.size(), 2);
    }

    @Test
    public void testOverlapFindsLongFeatureStartingFarBefore() {
        List<GenomicInterval> found = index.queryOverlap(new GenomicInterval("chr1", 4000, 4100));

        assertEquals(found.size(), 1);
        assertEquals(found.get(0).end, 5000);
    }
}
