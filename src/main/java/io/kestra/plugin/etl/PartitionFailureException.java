package io.kestra.plugin.etl;

import io.kestra.plugin.etl.monitor.ExecutionReport;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised by a run once every partition task has finished and at least one of them
 * failed. Carries all failures, not just the first, and the report of the run.
 */
public class PartitionFailureException extends EtlException {
    private final List<PartitionError> errors;
    private final ExecutionReport report;

    public PartitionFailureException(List<PartitionError> errors, ExecutionReport report) {
        super(describe(errors, report));
        this.errors = List.copyOf(errors);
        this.report = report;
        for (PartitionError error : this.errors) {
            addSuppressed(error.cause());
        }
    }

    public List<PartitionError> getErrors() {
        return errors;
    }

    public List<Integer> getFailedPartitions() {
        return errors.stream().map(PartitionError::partitionIndex).collect(Collectors.toList());
    }

    public ExecutionReport getReport() {
        return report;
    }

    private static String describe(List<PartitionError> errors, ExecutionReport report) {
        String details = errors.stream()
            .map(error -> "partition " + error.partitionIndex() + ": " + error.cause().getMessage())
            .collect(Collectors.joining("; "));
        return errors.size() + " of " + report.getPartitionCount() + " partitions failed [" + details + "]";
    }

    public record PartitionError(int partitionIndex, EvaluationException cause) {
    }
}
