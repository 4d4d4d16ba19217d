package io.kestra.plugin.etl.engine;

import io.kestra.plugin.etl.EtlException;
import io.kestra.plugin.etl.config.ExecutionConfig;
import io.kestra.plugin.etl.graph.OperationGraph;
import io.kestra.plugin.etl.partition.Partition;
import io.kestra.plugin.etl.partition.Partitioner;
import io.kestra.plugin.etl.source.RecordSource;

import java.io.IOException;
import java.util.Iterator;

/**
 * Partitions a record source and runs a graph over it with the configured concurrency. The
 * source is closed once the run ends, whether it succeeded or not.
 */
public final class DefaultPipelineEngine implements PipelineEngine {
    private final ExecutionConfig config;
    private final PartitionScheduler scheduler;

    public DefaultPipelineEngine(ExecutionConfig config) {
        this(config, new PartitionScheduler());
    }

    public DefaultPipelineEngine(ExecutionConfig config, PartitionScheduler scheduler) {
        this.config = config;
        this.scheduler = scheduler;
    }

    @Override
    public ExecutionOutcome execute(OperationGraph graph, RecordSource source) throws EtlException {
        try (source) {
            config.validate();
            Iterator<Partition> partitions = Partitioner.partition(source, config.getTargetPartitionSize());
            return scheduler.run(graph, partitions, config.getConcurrency());
        } catch (IOException e) {
            throw new EtlException("Failed to close record source", e);
        }
    }
}
