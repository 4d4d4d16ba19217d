package io.kestra.plugin.etl.engine;

import io.kestra.plugin.etl.EtlException;
import io.kestra.plugin.etl.graph.OperationGraph;
import io.kestra.plugin.etl.source.IterableRecordSource;
import io.kestra.plugin.etl.source.RecordSource;

public interface PipelineEngine {
    ExecutionOutcome execute(OperationGraph graph, RecordSource source) throws EtlException;

    default ExecutionOutcome execute(OperationGraph graph, Iterable<?> records) throws EtlException {
        return execute(graph, IterableRecordSource.of(records));
    }
}
