package io.kestra.plugin.etl.monitor;

import io.kestra.plugin.etl.EtlException;
import io.kestra.plugin.etl.config.ExecutionConfig;
import io.kestra.plugin.etl.engine.DefaultPipelineEngine;
import io.kestra.plugin.etl.engine.ExecutionOutcome;
import io.kestra.plugin.etl.graph.OperationGraph;
import io.kestra.plugin.etl.source.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Runs the same graph sequentially and in parallel over two fresh copies of a source and
 * reports the speedup. The sequential run goes first.
 */
public final class BaselineComparator {
    private static final Logger log = LoggerFactory.getLogger(BaselineComparator.class);

    public BaselineComparison compare(OperationGraph graph, Supplier<? extends RecordSource> sources, ExecutionConfig config) throws EtlException {
        config.validate();
        ExecutionOutcome sequential = new DefaultPipelineEngine(config.toBuilder().concurrency(1).build()).execute(graph, sources.get());
        ExecutionOutcome parallel = new DefaultPipelineEngine(config).execute(graph, sources.get());

        double speedup = ExecutionMonitor.compare(parallel.report(), sequential.report());
        boolean outputsMatch = parallel.output().equals(sequential.output());
        log.info("Sequential {} ms, parallel {} ms with concurrency {}: speedup {}",
            sequential.report().getTotalElapsed().toMillis(),
            parallel.report().getTotalElapsed().toMillis(),
            config.getConcurrency(),
            String.format("%.2f", speedup)
        );
        if (!outputsMatch) {
            log.warn("Sequential and parallel outputs differ for {}", graph.describe());
        }
        return new BaselineComparison(parallel.report(), sequential.report(), speedup, outputsMatch);
    }

    public record BaselineComparison(
        ExecutionReport parallel,
        ExecutionReport sequential,
        double speedup,
        boolean outputsMatch
    ) {
    }
}
