package io.kestra.plugin.etl.monitor;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.List;

/**
 * Immutable summary of a run. Partition timings are ordered by partition index.
 */
@Builder
@Getter
public class ExecutionReport {
    private final Duration totalElapsed;
    private final List<PartitionTiming> partitionTimings;
    private final int partitionCount;
    private final int concurrency;
    private final int peakConcurrency;
    private final int succeededTasks;
    private final int failedTasks;

    public long getTotalRecords() {
        return partitionTimings.stream().mapToLong(PartitionTiming::recordCount).sum();
    }

    @Override
    public String toString() {
        return "ExecutionReport{partitions=" + partitionCount
            + ", concurrency=" + concurrency
            + ", peak=" + peakConcurrency
            + ", succeeded=" + succeededTasks
            + ", failed=" + failedTasks
            + ", elapsed=" + totalElapsed + "}";
    }
}
