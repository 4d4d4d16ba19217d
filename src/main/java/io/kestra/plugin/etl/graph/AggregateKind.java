package io.kestra.plugin.etl.graph;

import io.kestra.plugin.etl.ion.ColumnType;

import java.util.Locale;

public enum AggregateKind {
    COUNT("count"),
    SUM("sum"),
    MIN("min"),
    MAX("max"),
    AVERAGE("avg");

    private final String label;

    AggregateKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Type of the finalized value for an input column of the given type ({@code null} for a
     * row count).
     */
    public ColumnType outputType(ColumnType inputType) {
        return switch (this) {
            case COUNT -> ColumnType.INT;
            case SUM -> inputType == ColumnType.INT ? ColumnType.INT : ColumnType.DECIMAL;
            case AVERAGE -> ColumnType.DECIMAL;
            case MIN, MAX -> inputType;
        };
    }

    public static AggregateKind fromLabel(String label) {
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (AggregateKind kind : values()) {
            if (kind.label.equals(normalized) || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported aggregate: " + label);
    }
}
