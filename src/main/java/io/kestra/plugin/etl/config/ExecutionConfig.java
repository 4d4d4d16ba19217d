package io.kestra.plugin.etl.config;

import io.kestra.plugin.etl.InvalidConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.InputStream;

/**
 * How a run is partitioned and how many partitions run at once.
 *
 * <pre>{@code
 * targetPartitionSize: 10000
 * concurrency: 8
 * }</pre>
 */
@Builder(toBuilder = true)
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionConfig {
    public static final int DEFAULT_TARGET_PARTITION_SIZE = 10_000;

    @Builder.Default
    private int targetPartitionSize = DEFAULT_TARGET_PARTITION_SIZE;

    @Builder.Default
    private int concurrency = Runtime.getRuntime().availableProcessors();

    public static ExecutionConfig defaults() {
        return ExecutionConfig.builder().build();
    }

    /** Reads and validates a JSON or YAML document. */
    public static ExecutionConfig load(InputStream input) throws InvalidConfigurationException {
        return ConfigMapper.read(input, ExecutionConfig.class).validate();
    }

    public ExecutionConfig validate() throws InvalidConfigurationException {
        if (targetPartitionSize <= 0) {
            throw new InvalidConfigurationException("targetPartitionSize must be > 0, got " + targetPartitionSize);
        }
        if (concurrency <= 0) {
            throw new InvalidConfigurationException("concurrency must be > 0, got " + concurrency);
        }
        return this;
    }

    @Override
    public String toString() {
        return "ExecutionConfig{targetPartitionSize=" + targetPartitionSize + ", concurrency=" + concurrency + "}";
    }
}
