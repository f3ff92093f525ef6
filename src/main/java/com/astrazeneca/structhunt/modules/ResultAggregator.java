package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;
import com.astrazeneca.structhunt.data.PartitionFailure;
import com.astrazeneca.structhunt.data.RunStatus;
import com.astrazeneca.structhunt.data.Sequence;
import com.astrazeneca.structhunt.data.WorkerResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges per-partition scanner candidates and predictor results into one sorted collection per motif class.
 */
public class ResultAggregator {
    private final PredictorOutputParser parser;
    private final String finalExtension;
    private final double minMetric;
    private final double maxMetric;

    /**
     * @param parser parser of the predictor final output
     * @param finalExtension extension of the artifact to parse, e.g. ".probability"
     * @param minMetric lowest accepted quality metric, inclusive
     * @param maxMetric highest accepted quality metric, inclusive
     */
    public ResultAggregator(PredictorOutputParser parser, String finalExtension, double minMetric, double maxMetric) {
        this.parser = parser;
        this.finalExtension = finalExtension;
        this.minMetric = minMetric;
        this.maxMetric = maxMetric;
    }

    /**
     * Scanner-only aggregation.
     */
    public AggregatedResults aggregate(Collection<? extends Collection<MotifCandidate>> partitionCandidates) {
        return aggregate(partitionCandidates, Collections.emptyList(), Collections.emptyMap());
    }

    /**
     * Artifacts of successful partitions are parsed, failed partitions go to the failure list only. Records equal
     * in every field are kept once; candidates of different run-length classes at the same span are different
     * records and are all kept.
     * @param partitionCandidates scanner candidates, one collection per partition
     * @param workerResults predictor outcomes
     * @param sequences partitions by id, used to cut window text for layouts without a sequence column
     * @return sorted results with failures and run status
     */
    public AggregatedResults aggregate(Collection<? extends Collection<MotifCandidate>> partitionCandidates,
                                       List<WorkerResult> workerResults, Map<String, Sequence> sequences) {
        Map<MotifClass, Set<MotifCandidate>> merged = new EnumMap<>(MotifClass.class);
        for (Collection<MotifCandidate> candidates : partitionCandidates) {
            addAll(merged, candidates);
        }
        List<PartitionFailure> failures = new ArrayList<>();
        int skippedLines = 0;
        for (WorkerResult result : workerResults) {
            if (!result.success) {
                failures.add(new PartitionFailure(result.partitionId, result.errorText));
                continue;
            }
            Path artifact = finalArtifact(result);
            if (artifact == null) {
                System.err.println("WARNING: partition " + result.partitionId + " has no " + finalExtension
                        + " output, no structures are read for it.");
                continue;
            }
            PredictorOutputParser.ParseReport report = parser.parseReport(artifact, result.partitionId,
                    sequences.get(result.partitionId), minMetric, maxMetric);
            skippedLines += report.skippedLines;
            addAll(merged, report.candidates);
        }

        Map<MotifClass, List<MotifCandidate>> sorted = new EnumMap<>(MotifClass.class);
        for (Map.Entry<MotifClass, Set<MotifCandidate>> entry : merged.entrySet()) {
            List<MotifCandidate> list = new ArrayList<>(entry.getValue());
            list.sort(MotifCandidate.POSITION_ORDER);
            sorted.put(entry.getKey(), list);
        }
        failures.sort((f1, f2) -> f1.partitionId.compareTo(f2.partitionId));
        return new AggregatedResults(sorted, failures, RunStatus.of(workerResults), skippedLines);
    }

    private Path finalArtifact(WorkerResult result) {
        for (Path path : result.outputArtifactPaths) {
            if (path.getFileName().toString().endsWith(finalExtension)) {
                return path;
            }
        }
        return null;
    }

    private static void addAll(Map<MotifClass, Set<MotifCandidate>> merged, Collection<MotifCandidate> candidates) {
        for (MotifCandidate candidate : candidates) {
            merged.computeIfAbsent(candidate.motifClass, k -> new LinkedHashSet<>()).add(candidate);
        }
    }
}
