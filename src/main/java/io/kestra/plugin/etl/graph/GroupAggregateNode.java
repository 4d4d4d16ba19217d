package io.kestra.plugin.etl.graph;

import io.kestra.plugin.etl.SchemaException;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.schema.Schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups records by key columns and computes aggregates per group. Evaluated in two
 * phases: a per-partition fold into accumulators, then a merge of all partitions'
 * accumulators followed by finalization.
 * <p>
 * Output records hold the key columns, in declared order, followed by the aggregate
 * columns.
 */
public final class GroupAggregateNode implements OperationNode {
    private final OperationNode upstream;
    private final List<String> keyColumns;
    private final Map<String, AggregateSpec> aggregates;
    private final Schema outputSchema;

    private GroupAggregateNode(OperationNode upstream, List<String> keyColumns, Map<String, AggregateSpec> aggregates, Schema outputSchema) {
        this.upstream = upstream;
        this.keyColumns = keyColumns;
        this.aggregates = aggregates;
        this.outputSchema = outputSchema;
    }

    static GroupAggregateNode create(OperationNode upstream, List<String> keyColumns, Map<String, AggregateSpec> aggregates) throws SchemaException {
        if (keyColumns == null || keyColumns.isEmpty()) {
            throw new SchemaException("groupAggregate requires at least one key column");
        }
        if (aggregates == null || aggregates.isEmpty()) {
            throw new SchemaException("groupAggregate requires at least one aggregate");
        }
        Schema input = upstream.outputSchema();
        Set<String> distinctKeys = new LinkedHashSet<>(keyColumns);
        if (distinctKeys.size() != keyColumns.size()) {
            throw new SchemaException("Duplicate key column in " + keyColumns);
        }

        Schema.Builder output = Schema.builder();
        for (String key : keyColumns) {
            output.column(key, input.require(key, "group key"));
        }
        Map<String, AggregateSpec> ordered = new LinkedHashMap<>();
        for (Map.Entry<String, AggregateSpec> entry : aggregates.entrySet()) {
            String target = entry.getKey();
            AggregateSpec spec = entry.getValue();
            if (spec == null) {
                throw new SchemaException("Aggregate definition is required for '" + target + "'");
            }
            if (distinctKeys.contains(target)) {
                throw new SchemaException("Aggregate output '" + target + "' collides with a key column");
            }
            ColumnType inputType = spec.countsRows() ? null : input.require(spec.inputColumn(), "aggregate '" + target + "'");
            checkInputType(target, spec, inputType);
            output.column(target, spec.kind().outputType(inputType));
            ordered.put(target, spec);
        }
        return new GroupAggregateNode(upstream, List.copyOf(keyColumns), Collections.unmodifiableMap(ordered), output.build());
    }

    private static void checkInputType(String target, AggregateSpec spec, ColumnType inputType) throws SchemaException {
        switch (spec.kind()) {
            case SUM, AVERAGE -> {
                if (!inputType.isNumeric()) {
                    throw new SchemaException(spec + " for '" + target + "' requires a numeric column, got " + inputType);
                }
            }
            case MIN, MAX -> {
                if (!inputType.isOrderable()) {
                    throw new SchemaException(spec + " for '" + target + "' requires an orderable column, got " + inputType);
                }
            }
            case COUNT -> {
            }
        }
    }

    public List<String> keyColumns() {
        return keyColumns;
    }

    public Map<String, AggregateSpec> aggregates() {
        return aggregates;
    }

    /** Declared type of an aggregate's input column, {@code null} for a row count. */
    public ColumnType inputType(String target) {
        AggregateSpec spec = aggregates.get(target);
        return spec == null || spec.countsRows() ? null : upstream.outputSchema().typeOf(spec.inputColumn());
    }

    @Override
    public OperationNode upstream() {
        return upstream;
    }

    @Override
    public Schema outputSchema() {
        return outputSchema;
    }

    @Override
    public String description() {
        return "groupAggregate(" + keyColumns + ", " + aggregates + ")";
    }
}
