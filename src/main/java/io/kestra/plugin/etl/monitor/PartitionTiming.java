package io.kestra.plugin.etl.monitor;

import java.time.Duration;

/**
 * Wall-clock time one partition task took on its worker.
 */
public record PartitionTiming(
    int partitionIndex,
    int recordCount,
    Duration elapsed,
    boolean succeeded,
    String worker
) {
}
