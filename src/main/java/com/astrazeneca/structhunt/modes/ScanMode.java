package com.astrazeneca.structhunt.modes;

import com.astrazeneca.structhunt.Configuration;
import com.astrazeneca.structhunt.data.GeneAnnotation;
import com.astrazeneca.structhunt.data.Sequence;
import com.astrazeneca.structhunt.modules.AggregatedResults;
import com.astrazeneca.structhunt.printers.ResultWriter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Mode without predictor: only the quadruplex scan runs.
 */
public class ScanMode extends AbstractMode {

    public ScanMode(Configuration conf, Map<String, Sequence> sequences, List<GeneAnnotation> annotations,
                    ResultWriter writer) {
        super(conf, sequences, annotations, writer);
    }

    @Override
    protected AggregatedResults run(Executor executor) {
        return aggregator.aggregate(scanAll(executor).join());
    }
}
