package com.astrazeneca.structhunt.data;

import java.util.Collection;

/**
 * Outcome of the whole run derived from the predictor worker results.
 */
public enum RunStatus {
    SUCCESS(0),
    PARTIAL_SUCCESS(2),
    FAILURE(1);

    /**
     * Process exit code for the status
     */
    public final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    /**
     * A run without predictor partitions succeeds; with partitions it fails only when none of them succeeded.
     * @param results worker results of the run
     * @return run status
     */
    public static RunStatus of(Collection<WorkerResult> results) {
        int failed = 0;
        for (WorkerResult result : results) {
            if (!result.success) {
                failed++;
            }
        }
        if (failed == 0) {
            return SUCCESS;
        }
        return failed == results.size() ? FAILURE : PARTIAL_SUCCESS;
    }
}
