package com.astrazeneca.structhunt.data;

/**
 * Snapshot of a partition progress taken by the progress monitor.
 */
public class PartitionProgress {
    public final PartitionStatus status;

    /**
     * Size in bytes of the intermediate scoring file at the time of the poll
     */
    public final long intermediateSize;

    /**
     * Size in bytes of the final probability file at the time of the poll
     */
    public final long finalSize;

    public PartitionProgress(PartitionStatus status, long intermediateSize, long finalSize) {
        this.status = status;
        this.intermediateSize = intermediateSize;
        this.finalSize = finalSize;
    }

    public static PartitionProgress starting() {
        return new PartitionProgress(PartitionStatus.STARTING, 0, 0);
    }

    @Override
    public String toString() {
        return status + " (" + intermediateSize + "/" + finalSize + " bytes)";
    }
}
