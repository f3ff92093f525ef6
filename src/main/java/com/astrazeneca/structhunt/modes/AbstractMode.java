package com.astrazeneca.structhunt.modes;

import com.astrazeneca.structhunt.Configuration;
import com.astrazeneca.structhunt.collection.DirectThreadExecutor;
import com.astrazeneca.structhunt.data.ColocalizationPair;
import com.astrazeneca.structhunt.data.GeneAnnotation;
import com.astrazeneca.structhunt.data.GenomicInterval;
import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;
import com.astrazeneca.structhunt.data.RunStatus;
import com.astrazeneca.structhunt.data.Sequence;
import com.astrazeneca.structhunt.modules.AggregatedResults;
import com.astrazeneca.structhunt.modules.ColocalizationEngine;
import com.astrazeneca.structhunt.modules.MotifSummary;
import com.astrazeneca.structhunt.modules.PredictorOutputParser;
import com.astrazeneca.structhunt.modules.PromoterBuilder;
import com.astrazeneca.structhunt.modules.ResultAggregator;
import com.astrazeneca.structhunt.modules.SequenceScanner;
import com.astrazeneca.structhunt.printers.ResultWriter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Abstract Mode of StructHunt. Scans every sequence for quadruplexes, serially or in a thread pool, lets the
 * concrete mode add its own results and writes everything out.
 */
public abstract class AbstractMode {
    protected final Configuration conf;
    protected final Map<String, Sequence> sequences;
    protected final List<GeneAnnotation> annotations;
    protected final ResultWriter writer;
    protected final SequenceScanner scanner;
    protected final ResultAggregator aggregator;
    protected final ColocalizationEngine engine = new ColocalizationEngine();

    /**
     * @param annotations genes for overlap tables, empty to skip them
     */
    public AbstractMode(Configuration conf, Map<String, Sequence> sequences, List<GeneAnnotation> annotations,
                        ResultWriter writer) {
        this.conf = conf;
        this.sequences = sequences;
        this.annotations = annotations;
        this.writer = writer;
        this.scanner = new SequenceScanner(conf.repeatBase);
        this.aggregator = new ResultAggregator(new PredictorOutputParser(conf.predictorFormat, conf.maxWarnings),
                conf.finalExtension, conf.minMetric, conf.maxMetric);
    }

    /**
     * Sequences are scanned one by one in the calling thread.
     */
    public RunStatus notParallel() {
        return process(new DirectThreadExecutor());
    }

    /**
     * Sequences are scanned in a pool of configured size.
     */
    public RunStatus parallel() {
        ExecutorService executor = Executors.newFixedThreadPool(conf.threads);
        try {
            return process(executor);
        } finally {
            executor.shutdown();
        }
    }

    RunStatus process(Executor executor) {
        AggregatedResults results = run(executor);
        report(results);
        writer.printStatus(results);
        return results.status;
    }

    /**
     * Produces the aggregated results of the mode.
     * @param executor executor for sequence scans
     * @return aggregated candidates with the run status
     */
    protected abstract AggregatedResults run(Executor executor);

    /**
     * Writes mode specific tables. The default writes quadruplex tables and their gene overlaps.
     */
    protected void report(AggregatedResults results) {
        writeClass(MotifClass.QUADRUPLEX_REPEAT, results.candidates(MotifClass.QUADRUPLEX_REPEAT));
    }

    /**
     * Starts one scan per sequence. The scans share nothing, each owns its sequence.
     * @param executor current Executor for parallel/single mode
     * @return future of the candidates, one list per sequence in input order
     */
    protected CompletableFuture<List<List<MotifCandidate>>> scanAll(Executor executor) {
        List<CompletableFuture<List<MotifCandidate>>> scans = new ArrayList<>();
        for (Sequence sequence : sequences.values()) {
            scans.add(CompletableFuture.supplyAsync(() -> scan(sequence), executor));
        }
        return CompletableFuture.allOf(scans.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<List<MotifCandidate>> result = new ArrayList<>(scans.size());
                    for (CompletableFuture<List<MotifCandidate>> scan : scans) {
                        result.add(scan.join());
                    }
                    if (conf.y) {
                        System.err.println("TIME: Finish scanning " + scans.size() + " sequences: "
                                + LocalDateTime.now());
                    }
                    return result;
                });
    }

    private List<MotifCandidate> scan(Sequence sequence) {
        List<MotifCandidate> candidates = scanner.scan(sequence, conf.minRunLength, conf.maxRunLength,
                conf.maxLoopLength, conf.minScore);
        if (conf.y) {
            System.err.println("Scanned " + sequence.id + " (" + sequence.length() + " bases): "
                    + candidates.size() + " candidates");
        }
        return candidates;
    }

    void writeClass(MotifClass motifClass, List<MotifCandidate> candidates) {
        writer.writeCandidates(motifClass, candidates);
        writer.printSummary(MotifSummary.of(motifClass, candidates));
        if (annotations.isEmpty()) {
            return;
        }
        List<GenomicInterval> genes = new ArrayList<>(annotations.size());
        for (GeneAnnotation annotation : annotations) {
            genes.add(annotation.toInterval());
        }
        List<GenomicInterval> promoters = new PromoterBuilder(conf.upstream, conf.downstream).promoters(annotations);
        List<ColocalizationPair<MotifCandidate, GenomicInterval>> geneOverlaps =
                engine.findOverlapping(candidates, genes);
        List<ColocalizationPair<MotifCandidate, GenomicInterval>> promoterOverlaps =
                engine.findOverlapping(candidates, promoters);
        writer.writeOverlaps(motifClass, "genes", geneOverlaps);
        writer.writeOverlaps(motifClass, "promoters", promoterOverlaps);
    }
}
