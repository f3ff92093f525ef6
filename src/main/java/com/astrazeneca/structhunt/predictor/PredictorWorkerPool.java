package com.astrazeneca.structhunt.predictor;

import com.astrazeneca.structhunt.data.Partition;
import com.astrazeneca.structhunt.data.PartitionProgress;
import com.astrazeneca.structhunt.data.WorkerResult;
import com.astrazeneca.structhunt.exception.PredictorProcessException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs the predictor over partitions in a fixed size thread pool, one predictor run per thread at a time.
 * A failed partition is recorded in its {@link WorkerResult} and never stops the others. No retries.
 */
public class PredictorWorkerPool {
    public static final long DEFAULT_MIN_PARTITION_LENGTH = 1_048_576L;

    static final String CANCELLED = "cancelled before completion";

    private final long minPartitionLength;
    private final long pollIntervalMillis;
    private final long shutdownWaitMillis;
    private final int availableProcessors;
    private final Consumer<Map<String, PartitionProgress>> progressListener;
    private final ProgressContext progress = new ProgressContext();
    private final List<Future<WorkerResult>> futures = new CopyOnWriteArrayList<>();

    private volatile ExecutorService executor;
    private volatile ProgressMonitor monitor;
    private volatile boolean cancelled;

    public PredictorWorkerPool() {
        this(DEFAULT_MIN_PARTITION_LENGTH, ProgressMonitor.DEFAULT_POLL_INTERVAL_MILLIS,
                ExternalProcessPredictor.DEFAULT_GRACE_MILLIS, null);
    }

    /**
     * @param minPartitionLength partitions not longer than this are skipped
     * @param pollIntervalMillis progress poll interval
     * @param graceMillis time predictors get to stop on cancellation
     * @param progressListener receives progress snapshots, may be null
     */
    public PredictorWorkerPool(long minPartitionLength, long pollIntervalMillis, long graceMillis,
                               Consumer<Map<String, PartitionProgress>> progressListener) {
        this(minPartitionLength, pollIntervalMillis, graceMillis, progressListener,
                Runtime.getRuntime().availableProcessors());
    }

    PredictorWorkerPool(long minPartitionLength, long pollIntervalMillis, long graceMillis,
                        Consumer<Map<String, PartitionProgress>> progressListener, int availableProcessors) {
        this.availableProcessors = availableProcessors;
        this.minPartitionLength = minPartitionLength;
        this.pollIntervalMillis = pollIntervalMillis;
        // workers terminate their processes within the grace period, then kill them
        this.shutdownWaitMillis = 2 * graceMillis + 1000;
        this.progressListener = progressListener;
    }

    /**
     * Runs the predictor over every partition longer than the minimum length with
     * max(1, min(concurrencyLimit, available processors, partition count)) workers and waits for all of them.
     * @param partitions partitions to run
     * @param predictor prediction to run on each partition
     * @param concurrencyLimit maximum number of simultaneous runs
     * @return one result per run partition in input order, empty without starting anything if no partition
     * qualifies
     */
    public List<WorkerResult> runAll(List<Partition> partitions, Predictor predictor, int concurrencyLimit) {
        List<Partition> eligible = new ArrayList<>();
        for (Partition partition : partitions) {
            if (partition.length > minPartitionLength) {
                eligible.add(partition);
            } else {
                System.err.println("Partition " + partition.id + " (" + partition.length + " bases) is not longer than "
                        + minPartitionLength + " bases, the predictor is skipped for it.");
            }
        }
        if (eligible.isEmpty() && !partitions.isEmpty()) {
            System.err.println("WARNING: no partition is longer than " + minPartitionLength
                    + " bases, the predictor didn't run on any partition (see -M).");
        }
        if (eligible.isEmpty() || cancelled) {
            return Collections.emptyList();
        }

        int threads = Math.max(1, Math.min(Math.min(concurrencyLimit, availableProcessors), eligible.size()));
        progress.clear();
        futures.clear();
        monitor = new ProgressMonitor(progress, predictor, eligible, pollIntervalMillis, progressListener);
        monitor.start();
        executor = Executors.newFixedThreadPool(threads);
        try {
            for (Partition partition : eligible) {
                try {
                    futures.add(executor.submit(() -> runPartition(partition, predictor)));
                } catch (RejectedExecutionException e) {
                    // the pool was shut down by a concurrent cancel
                    futures.add(CompletableFuture.completedFuture(WorkerResult.failed(partition.id, 0, CANCELLED)));
                }
            }
            if (cancelled) {
                cancel();
            }
            return collect(eligible);
        } finally {
            executor.shutdown();
            monitor.stop();
        }
    }

    /**
     * Stops the current run: queued partitions don't start, running predictors are interrupted and wait up to
     * their grace period before being killed. Safe to call from a shutdown hook.
     */
    public void cancel() {
        cancelled = true;
        for (Future<WorkerResult> future : futures) {
            future.cancel(true);
        }
        ExecutorService current = executor;
        if (current == null) {
            return;
        }
        current.shutdownNow();
        try {
            if (!current.awaitTermination(shutdownWaitMillis, TimeUnit.MILLISECONDS)) {
                System.err.println("Some predictor workers didn't stop in " + shutdownWaitMillis + " ms.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        ProgressMonitor currentMonitor = monitor;
        if (currentMonitor != null) {
            currentMonitor.stop();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @return progress of the current or last run
     */
    public ProgressContext progress() {
        return progress;
    }

    private WorkerResult runPartition(Partition partition, Predictor predictor) {
        long start = System.currentTimeMillis();
        try {
            PredictorArtifacts artifacts = predictor.run(partition);
            return WorkerResult.succeeded(partition.id, System.currentTimeMillis() - start, artifacts.existing());
        } catch (PredictorProcessException e) {
            System.err.println(e.getMessage());
            return WorkerResult.failed(partition.id, System.currentTimeMillis() - start, e.errorText);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WorkerResult.failed(partition.id, System.currentTimeMillis() - start, CANCELLED);
        } catch (RuntimeException e) {
            System.err.println("Predictor failed on partition " + partition.id + ": " + e);
            return WorkerResult.failed(partition.id, System.currentTimeMillis() - start, e.toString());
        } finally {
            monitor.markFinished(partition.id);
        }
    }

    private List<WorkerResult> collect(List<Partition> eligible) {
        List<WorkerResult> results = new ArrayList<>(eligible.size());
        boolean interrupted = false;
        for (int i = 0; i < eligible.size(); i++) {
            String partitionId = eligible.get(i).id;
            Future<WorkerResult> future = futures.get(i);
            WorkerResult result = null;
            while (result == null) {
                try {
                    result = future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                    cancel();
                } catch (CancellationException e) {
                    result = WorkerResult.failed(partitionId, 0, CANCELLED);
                } catch (ExecutionException e) {
                    result = WorkerResult.failed(partitionId, 0, String.valueOf(e.getCause()));
                }
            }
            results.add(result);
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return results;
    }
}
