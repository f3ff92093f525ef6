package com.astrazeneca.structhunt.predictor;

import com.astrazeneca.structhunt.data.Partition;
import com.astrazeneca.structhunt.exception.PredictorProcessException;

import java.nio.file.Path;

/**
 * Structure prediction over one partition. The worker pool depends only on this interface, so an in-process
 * implementation can replace the external program.
 */
public interface Predictor {
    /**
     * Runs the prediction and blocks until it ends.
     * @param partition partition to predict on
     * @return artifacts written for the partition
     * @throws PredictorProcessException if the prediction couldn't be started or didn't finish cleanly
     * @throws InterruptedException if the calling thread was interrupted, the prediction is stopped before return
     */
    PredictorArtifacts run(Partition partition) throws PredictorProcessException, InterruptedException;

    /**
     * @return file the prediction writes scores to while it is running
     */
    Path intermediateArtifact(Partition partition);

    /**
     * @return file with the final scored windows
     */
    Path finalArtifact(Partition partition);
}
