package com.astrazeneca.structhunt.data;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one predictor run, created when its process exits.
 */
public class WorkerResult {
    public final String partitionId;
    public final boolean success;
    public final long elapsedMillis;

    /**
     * Artifacts found after a successful run, empty on failure
     */
    public final List<Path> outputArtifactPaths;

    /**
     * Captured error output or exception message, null on success
     */
    public final String errorText;

    private WorkerResult(String partitionId, boolean success, long elapsedMillis, List<Path> outputArtifactPaths,
                         String errorText) {
        this.partitionId = partitionId;
        this.success = success;
        this.elapsedMillis = elapsedMillis;
        this.outputArtifactPaths = Collections.unmodifiableList(outputArtifactPaths);
        this.errorText = errorText;
    }

    public static WorkerResult succeeded(String partitionId, long elapsedMillis, List<Path> artifacts) {
        return new WorkerResult(partitionId, true, elapsedMillis, artifacts, null);
    }

    public static WorkerResult failed(String partitionId, long elapsedMillis, String errorText) {
        String text = errorText == null || errorText.trim().isEmpty() ? "no error output captured" : errorText;
        return new WorkerResult(partitionId, false, elapsedMillis, Collections.emptyList(), text);
    }

    @Override
    public String toString() {
        return "WorkerResult [partition=" + partitionId + ", success=" + success + ", elapsed=" + elapsedMillis
                + "ms" + (success ? ", artifacts=" + outputArtifactPaths : ", error=" + errorText) + "]";
    }
}
