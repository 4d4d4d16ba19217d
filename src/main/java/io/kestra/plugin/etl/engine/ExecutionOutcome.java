package io.kestra.plugin.etl.engine;

import io.kestra.plugin.etl.monitor.ExecutionReport;

public record ExecutionOutcome(
    PipelineOutput output,
    ExecutionReport report
) {
}
