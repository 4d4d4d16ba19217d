package io.kestra.plugin.etl.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-group accumulators folded from one partition, keyed in first-seen order.
 */
public final class GroupedPartialResult extends PartialResult {
    private final Map<GroupKey, GroupState> groups;

    public GroupedPartialResult(int partitionIndex, Map<GroupKey, GroupState> groups) {
        super(partitionIndex);
        this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    }

    public Map<GroupKey, GroupState> groups() {
        return groups;
    }
}
