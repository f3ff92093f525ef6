package com.astrazeneca.structhunt.modes;

import com.astrazeneca.structhunt.Configuration;
import com.astrazeneca.structhunt.data.ColocalizationPair;
import com.astrazeneca.structhunt.data.GeneAnnotation;
import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;
import com.astrazeneca.structhunt.data.Partition;
import com.astrazeneca.structhunt.data.Sequence;
import com.astrazeneca.structhunt.data.WorkerResult;
import com.astrazeneca.structhunt.modules.AggregatedResults;
import com.astrazeneca.structhunt.modules.ColocalizationStatistics;
import com.astrazeneca.structhunt.predictor.Predictor;
import com.astrazeneca.structhunt.predictor.PredictorWorkerPool;
import com.astrazeneca.structhunt.printers.ResultWriter;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Mode running the predictor over the partitions while the sequences are scanned, then pairing quadruplexes
 * with predicted structures.
 */
public class IntegratedMode extends AbstractMode {
    private final List<Partition> partitions;
    private final Predictor predictor;
    private final PredictorWorkerPool pool;

    public IntegratedMode(Configuration conf, Map<String, Sequence> sequences, List<GeneAnnotation> annotations,
                          ResultWriter writer, List<Partition> partitions, Predictor predictor,
                          PredictorWorkerPool pool) {
        super(conf, sequences, annotations, writer);
        this.partitions = partitions;
        this.predictor = predictor;
        this.pool = pool;
    }

    /**
     * The worker pool runs in its own thread, so predictor processes and scans overlap.
     */
    @Override
    protected AggregatedResults run(Executor executor) {
        CompletableFuture<List<WorkerResult>> predictions = CompletableFuture.supplyAsync(
                () -> pool.runAll(partitions, predictor, conf.predictorThreads));
        List<List<MotifCandidate>> scanned = scanAll(executor).join();
        List<WorkerResult> workerResults = predictions.join();
        if (conf.y) {
            System.err.println("TIME: Finish predictions on " + workerResults.size() + " partitions: "
                    + LocalDateTime.now());
        }
        return aggregator.aggregate(scanned, workerResults, sequences);
    }

    @Override
    protected void report(AggregatedResults results) {
        super.report(results);
        List<MotifCandidate> quadruplexes = results.candidates(MotifClass.QUADRUPLEX_REPEAT);
        List<MotifCandidate> structures = results.candidates(MotifClass.ALTERNATIVE_STRUCTURE);
        writeClass(MotifClass.ALTERNATIVE_STRUCTURE, structures);

        List<ColocalizationPair<MotifCandidate, MotifCandidate>> pairs =
                engine.findProximal(quadruplexes, structures, conf.window);
        writer.writePairs(pairs);
        writer.printStatistics(ColocalizationStatistics.of(pairs, quadruplexes, structures));
    }
}
