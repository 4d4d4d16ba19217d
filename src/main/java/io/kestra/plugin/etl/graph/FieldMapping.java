package io.kestra.plugin.etl.graph;

import io.kestra.plugin.etl.ion.ColumnType;

/**
 * Target column of a map stage: the expression computing it, an optional type to cast the
 * result to, and whether a null result is accepted.
 */
public record FieldMapping(
    String targetField,
    String expression,
    ColumnType type,
    boolean optional
) {
    public static FieldMapping of(String targetField, String expression) {
        return new FieldMapping(targetField, expression, null, true);
    }

    public static FieldMapping of(String targetField, String expression, ColumnType type) {
        return new FieldMapping(targetField, expression, type, true);
    }
}
