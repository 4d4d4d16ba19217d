package io.kestra.plugin.etl.schema;

import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.SchemaException;
import io.kestra.plugin.etl.ion.CastException;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.ion.IonCaster;
import io.kestra.plugin.etl.ion.IonValueUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, fixed set of typed columns shared by every record of a dataset or stage.
 */
public final class Schema {
    private final Map<String, ColumnType> columns;

    private Schema(Map<String, ColumnType> columns) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Schema of(Map<String, ColumnType> columns) throws SchemaException {
        Builder builder = builder();
        for (Map.Entry<String, ColumnType> entry : columns.entrySet()) {
            builder.column(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    public Map<String, ColumnType> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public int size() {
        return columns.size();
    }

    public boolean contains(String column) {
        return columns.containsKey(column);
    }

    public ColumnType typeOf(String column) {
        return columns.get(column);
    }

    public ColumnType require(String column, String context) throws SchemaException {
        ColumnType type = columns.get(column);
        if (type == null) {
            throw new SchemaException("Unknown column '" + column + "' in " + context + "; available columns: " + columns.keySet());
        }
        return type;
    }

    /**
     * Builds a new read-only record holding exactly this schema's columns, in schema order,
     * each cast to its declared type. Missing columns become null.
     *
     * @throws CastException when a value cannot be cast or the record carries a column this
     *                       schema does not declare
     */
    public IonStruct conform(IonStruct record, IonCaster caster) throws CastException {
        for (IonValue value : record) {
            if (!columns.containsKey(value.getFieldName())) {
                throw new CastException("Unexpected column '" + value.getFieldName() + "'");
            }
        }
        IonStruct output = IonValueUtils.system().newEmptyStruct();
        for (Map.Entry<String, ColumnType> column : columns.entrySet()) {
            IonValue value = record.get(column.getKey());
            IonValue casted;
            try {
                casted = caster.cast(value, column.getValue());
            } catch (CastException e) {
                throw new CastException("Column '" + column.getKey() + "': " + e.getMessage(), e);
            }
            output.put(column.getKey(), casted.getContainer() == null && !casted.isReadOnly() ? casted : casted.clone());
        }
        output.makeReadOnly();
        return output;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Schema schema)) {
            return false;
        }
        return List.copyOf(columns.entrySet()).equals(List.copyOf(schema.columns.entrySet()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(List.copyOf(columns.entrySet()));
    }

    @Override
    public String toString() {
        return columns.toString();
    }

    public static final class Builder {
        private final Map<String, ColumnType> columns = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder column(String name, ColumnType type) throws SchemaException {
            if (name == null || name.isBlank()) {
                throw new SchemaException("Column name is required");
            }
            if (type == null) {
                throw new SchemaException("Column type is required for '" + name + "'");
            }
            if (columns.putIfAbsent(name, type) != null) {
                throw new SchemaException("Duplicate column '" + name + "'");
            }
            return this;
        }

        public Schema build() {
            return new Schema(columns);
        }
    }
}
