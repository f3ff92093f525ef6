package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;
import com.astrazeneca.structhunt.data.PartitionFailure;
import com.astrazeneca.structhunt.data.RunStatus;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Global sorted candidate collections of one run with the failed partitions.
 */
public class AggregatedResults {
    private final Map<MotifClass, List<MotifCandidate>> candidates;
    public final List<PartitionFailure> failures;
    public final RunStatus status;

    /**
     * Predictor output lines skipped as malformed over all partitions
     */
    public final int skippedLines;

    AggregatedResults(Map<MotifClass, List<MotifCandidate>> candidates, List<PartitionFailure> failures,
                      RunStatus status, int skippedLines) {
        this.candidates = candidates;
        this.failures = Collections.unmodifiableList(failures);
        this.status = status;
        this.skippedLines = skippedLines;
    }

    /**
     * @param motifClass class of motifs
     * @return candidates of the class sorted by sequence and position, empty when there are none
     */
    public List<MotifCandidate> candidates(MotifClass motifClass) {
        List<MotifCandidate> list = candidates.get(motifClass);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public int totalCandidates() {
        int total = 0;
        for (List<MotifCandidate> list : candidates.values()) {
            total += list.size();
        }
        return total;
    }
}
