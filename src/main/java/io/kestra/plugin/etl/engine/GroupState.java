package io.kestra.plugin.etl.engine;

import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.MergeException;
import io.kestra.plugin.etl.graph.AggregateSpec;
import io.kestra.plugin.etl.graph.GroupAggregateNode;
import io.kestra.plugin.etl.ion.CastException;
import io.kestra.plugin.etl.ion.IonValueUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key column values and one accumulator per aggregate output for a single group.
 */
public final class GroupState {
    private final Map<String, IonValue> keyValues;
    private final Map<String, AggregateAccumulator> accumulators;

    private GroupState(Map<String, IonValue> keyValues, Map<String, AggregateAccumulator> accumulators) {
        this.keyValues = keyValues;
        this.accumulators = accumulators;
    }

    /** Empty state for the group {@code record} belongs to. */
    public static GroupState create(GroupAggregateNode aggregate, IonStruct record) {
        Map<String, IonValue> keyValues = new LinkedHashMap<>();
        for (String column : aggregate.keyColumns()) {
            IonValue value = record.get(column);
            keyValues.put(column, value == null ? IonValueUtils.nullValue() : IonValueUtils.cloneValue(value));
        }
        Map<String, AggregateAccumulator> accumulators = new LinkedHashMap<>();
        for (Map.Entry<String, AggregateSpec> entry : aggregate.aggregates().entrySet()) {
            accumulators.put(entry.getKey(), new AggregateAccumulator(entry.getValue(), aggregate.inputType(entry.getKey())));
        }
        return new GroupState(keyValues, accumulators);
    }

    public void add(IonStruct record) throws CastException {
        for (AggregateAccumulator accumulator : accumulators.values()) {
            AggregateSpec spec = accumulator.spec();
            accumulator.add(spec.countsRows() ? null : record.get(spec.inputColumn()));
        }
    }

    public void combine(GroupState other) throws MergeException {
        if (!accumulators.keySet().equals(other.accumulators.keySet())) {
            throw new MergeException("Cannot combine groups with outputs " + accumulators.keySet()
                + " and " + other.accumulators.keySet());
        }
        for (Map.Entry<String, AggregateAccumulator> entry : accumulators.entrySet()) {
            entry.getValue().combine(other.accumulators.get(entry.getKey()));
        }
    }

    public GroupState copy() {
        Map<String, IonValue> keyValuesCopy = new LinkedHashMap<>();
        for (Map.Entry<String, IonValue> entry : keyValues.entrySet()) {
            keyValuesCopy.put(entry.getKey(), IonValueUtils.cloneValue(entry.getValue()));
        }
        Map<String, AggregateAccumulator> accumulatorsCopy = new LinkedHashMap<>();
        for (Map.Entry<String, AggregateAccumulator> entry : accumulators.entrySet()) {
            accumulatorsCopy.put(entry.getKey(), entry.getValue().copy());
        }
        return new GroupState(keyValuesCopy, accumulatorsCopy);
    }

    public Map<String, AggregateAccumulator> accumulators() {
        return Collections.unmodifiableMap(accumulators);
    }

    /** Finalized group record: key columns, then aggregate outputs. */
    public IonStruct toRecord() {
        IonStruct record = IonValueUtils.system().newEmptyStruct();
        for (Map.Entry<String, IonValue> entry : keyValues.entrySet()) {
            record.put(entry.getKey(), IonValueUtils.cloneValue(entry.getValue()));
        }
        for (Map.Entry<String, AggregateAccumulator> entry : accumulators.entrySet()) {
            record.put(entry.getKey(), entry.getValue().finish());
        }
        record.makeReadOnly();
        return record;
    }
}
