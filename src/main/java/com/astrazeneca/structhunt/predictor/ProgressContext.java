package com.astrazeneca.structhunt.predictor;

import com.astrazeneca.structhunt.data.PartitionProgress;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Progress of the partitions of one worker pool run. The progress monitor is the only writer, callers read
 * snapshots at any time.
 */
public class ProgressContext {
    private final Map<String, PartitionProgress> progress = new ConcurrentHashMap<>();

    void register(String partitionId) {
        progress.put(partitionId, PartitionProgress.starting());
    }

    void update(String partitionId, PartitionProgress partitionProgress) {
        progress.put(partitionId, partitionProgress);
    }

    void clear() {
        progress.clear();
    }

    /**
     * @return last polled progress of the partition, null if it isn't run by the pool
     */
    public PartitionProgress get(String partitionId) {
        return progress.get(partitionId);
    }

    /**
     * @return copy of the current progress sorted by partition id
     */
    public Map<String, PartitionProgress> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(progress));
    }
}
