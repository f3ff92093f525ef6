package com.astrazeneca.structhunt.predictor;

import com.astrazeneca.structhunt.collection.ConcurrentHashSet;
import com.astrazeneca.structhunt.data.Partition;
import com.astrazeneca.structhunt.data.PartitionProgress;
import com.astrazeneca.structhunt.data.PartitionStatus;

import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Periodic task reading the artifact sizes of running partitions. It only looks at file metadata and never
 * waits for workers, so a size may be taken while the predictor is writing.
 */
public class ProgressMonitor {
    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 2000;

    private final ProgressContext context;
    private final Predictor predictor;
    private final List<Partition> partitions;
    private final long pollIntervalMillis;
    private final Consumer<Map<String, PartitionProgress>> listener;
    private final Set<String> finished = new ConcurrentHashSet<>();

    private ScheduledExecutorService scheduler;

    /**
     * @param listener receives a snapshot after every poll, may be null
     */
    public ProgressMonitor(ProgressContext context, Predictor predictor, Collection<Partition> partitions,
                           long pollIntervalMillis, Consumer<Map<String, PartitionProgress>> listener) {
        this.context = context;
        this.predictor = predictor;
        this.partitions = new ArrayList<>(partitions);
        this.pollIntervalMillis = pollIntervalMillis;
        this.listener = listener;
    }

    public synchronized void start() {
        for (Partition partition : partitions) {
            context.register(partition.id);
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "progress-monitor");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::pollSafely, pollIntervalMillis, pollIntervalMillis,
                TimeUnit.MILLISECONDS);
    }

    /**
     * Called by a worker when its partition ended, the next poll reports it as completed.
     */
    public void markFinished(String partitionId) {
        finished.add(partitionId);
    }

    /**
     * Stops polling and records the final state of every partition.
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(pollIntervalMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        poll();
    }

    void poll() {
        for (Partition partition : partitions) {
            File intermediate = predictor.intermediateArtifact(partition).toFile();
            File finalOutput = predictor.finalArtifact(partition).toFile();
            PartitionStatus status;
            if (finished.contains(partition.id)) {
                status = PartitionStatus.COMPLETED;
            } else if (intermediate.exists()) {
                status = PartitionStatus.COMPUTING;
            } else {
                status = PartitionStatus.STARTING;
            }
            context.update(partition.id, new PartitionProgress(status, intermediate.length(), finalOutput.length()));
        }
        if (listener != null) {
            listener.accept(context.snapshot());
        }
    }

    private void pollSafely() {
        try {
            poll();
        } catch (RuntimeException e) {
            // a failed poll must not cancel the schedule
            System.err.println("Progress poll failed: " + e);
        }
    }
}
