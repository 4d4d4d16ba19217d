package io.kestra.plugin.etl.engine;

/**
 * What one partition task hands to the merger.
 */
public abstract class PartialResult {
    private final int partitionIndex;

    protected PartialResult(int partitionIndex) {
        this.partitionIndex = partitionIndex;
    }

    public int partitionIndex() {
        return partitionIndex;
    }
}
