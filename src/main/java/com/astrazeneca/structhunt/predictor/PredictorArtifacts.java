package com.astrazeneca.structhunt.predictor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Files a prediction produced for one partition.
 */
public class PredictorArtifacts {
    public final Path intermediate;
    public final Path finalOutput;

    public PredictorArtifacts(Path intermediate, Path finalOutput) {
        this.intermediate = intermediate;
        this.finalOutput = finalOutput;
    }

    /**
     * @return artifacts present on disk, intermediate first
     */
    public List<Path> existing() {
        List<Path> paths = new ArrayList<>(2);
        if (intermediate != null && Files.exists(intermediate)) {
            paths.add(intermediate);
        }
        if (finalOutput != null && Files.exists(finalOutput)) {
            paths.add(finalOutput);
        }
        return paths;
    }
}
