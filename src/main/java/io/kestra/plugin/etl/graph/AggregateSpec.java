package io.kestra.plugin.etl.graph;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Map;
import java.util.Objects;

/**
 * One aggregate output: the kind and the column it reads. A {@code COUNT} without an input
 * column counts rows; with one it counts non-null values.
 */
public record AggregateSpec(String inputColumn, AggregateKind kind) {
    public AggregateSpec {
        Objects.requireNonNull(kind, "kind is required");
        if (inputColumn != null && inputColumn.isBlank()) {
            inputColumn = null;
        }
        if (inputColumn == null && kind != AggregateKind.COUNT) {
            throw new IllegalArgumentException(kind.label() + " requires an input column");
        }
    }

    public static AggregateSpec count() {
        return new AggregateSpec(null, AggregateKind.COUNT);
    }

    public static AggregateSpec count(String column) {
        return new AggregateSpec(column, AggregateKind.COUNT);
    }

    public static AggregateSpec sum(String column) {
        return new AggregateSpec(column, AggregateKind.SUM);
    }

    public static AggregateSpec min(String column) {
        return new AggregateSpec(column, AggregateKind.MIN);
    }

    public static AggregateSpec max(String column) {
        return new AggregateSpec(column, AggregateKind.MAX);
    }

    public static AggregateSpec average(String column) {
        return new AggregateSpec(column, AggregateKind.AVERAGE);
    }

    public boolean countsRows() {
        return inputColumn == null;
    }

    /**
     * Parses the {@code kind(column)} shorthand: {@code count()}, {@code sum(amount)},
     * {@code avg(amount)}…
     */
    public static AggregateSpec parse(String expression) {
        String trimmed = expression == null ? "" : expression.trim();
        int open = trimmed.indexOf('(');
        int close = trimmed.lastIndexOf(')');
        if (open <= 0 || close != trimmed.length() - 1) {
            throw new IllegalArgumentException("Unsupported aggregate expression: " + expression);
        }
        AggregateKind kind = AggregateKind.fromLabel(trimmed.substring(0, open));
        String argument = trimmed.substring(open + 1, close).trim();
        return new AggregateSpec(argument.isEmpty() ? null : argument, kind);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AggregateSpec from(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String stringValue) {
            return parse(stringValue);
        }
        if (value instanceof Map<?, ?> map) {
            Object kind = map.get("kind");
            Object column = map.get("column");
            if (kind == null) {
                throw new IllegalArgumentException("Aggregate kind is required: " + value);
            }
            return new AggregateSpec(column == null ? null : String.valueOf(column), AggregateKind.fromLabel(String.valueOf(kind)));
        }
        throw new IllegalArgumentException("Unsupported aggregate definition: " + value);
    }

    @Override
    public String toString() {
        return kind.label() + "(" + (inputColumn == null ? "" : inputColumn) + ")";
    }
}
