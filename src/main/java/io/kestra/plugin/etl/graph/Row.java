package io.kestra.plugin.etl.graph;

import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.ion.CastException;
import io.kestra.plugin.etl.ion.IonValueUtils;
import io.kestra.plugin.etl.schema.Schema;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Read access to one record for Java predicates and projections. Reading a column the
 * stage's input schema does not declare fails, which the executor reports as an evaluation
 * error for that record.
 */
public final class Row {
    private final IonStruct record;
    private final Schema schema;

    public Row(IonStruct record, Schema schema) {
        this.record = record;
        this.schema = schema;
    }

    public IonValue get(String column) {
        if (!schema.contains(column)) {
            throw new IllegalArgumentException("Unknown column '" + column + "'");
        }
        IonValue value = record.get(column);
        return value == null ? IonValueUtils.nullValue() : value;
    }

    public boolean isNull(String column) {
        return IonValueUtils.isNull(get(column));
    }

    public Object getValue(String column) {
        return IonValueUtils.toJavaValue(get(column));
    }

    public String getString(String column) {
        return IonValueUtils.asString(get(column));
    }

    public BigDecimal getDecimal(String column) throws CastException {
        return IonValueUtils.asDecimal(get(column));
    }

    public Double getDouble(String column) throws CastException {
        IonValue value = get(column);
        return IonValueUtils.isNull(value) ? null : IonValueUtils.asDouble(value);
    }

    public Long getLong(String column) throws CastException {
        BigDecimal decimal = getDecimal(column);
        try {
            return decimal == null ? null : decimal.longValueExact();
        } catch (ArithmeticException e) {
            throw new CastException("Expected integer value in '" + column + "', got " + decimal, e);
        }
    }

    public Boolean getBoolean(String column) throws CastException {
        return IonValueUtils.asBoolean(get(column));
    }

    public Instant getInstant(String column) throws CastException {
        return IonValueUtils.asInstant(get(column));
    }

    public Map<String, Object> toMap() {
        return (Map<String, Object>) IonValueUtils.toJavaValue(record);
    }

    public IonStruct struct() {
        return record;
    }

    public Schema schema() {
        return schema;
    }

    @Override
    public String toString() {
        return record.toString();
    }
}
