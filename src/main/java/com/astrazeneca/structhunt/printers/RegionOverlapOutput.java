package com.astrazeneca.structhunt.printers;

import com.astrazeneca.structhunt.data.ColocalizationPair;
import com.astrazeneca.structhunt.data.GenomicInterval;
import com.astrazeneca.structhunt.data.MotifCandidate;

import static com.astrazeneca.structhunt.Utils.join;

/**
 * Gene or promoter overlap row: sequenceId motifStart motifEnd geneId regionStart regionEnd overlap
 */
public class RegionOverlapOutput extends OutputRecord {
    public static final String HEADER = join("\t", "SequenceId", "MotifStart", "MotifEnd", "GeneId",
            "RegionStart", "RegionEnd", "Overlap");

    private final ColocalizationPair<MotifCandidate, GenomicInterval> pair;

    public RegionOverlapOutput(ColocalizationPair<MotifCandidate, GenomicInterval> pair) {
        this.pair = pair;
    }

    @Override
    public String toString() {
        return join(delimiter,
                pair.sequenceId,
                pair.refA.start,
                pair.refA.end,
                pair.refB.name,
                pair.refB.start,
                pair.refB.end,
                pair.distance);
    }
}
