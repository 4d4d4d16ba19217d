package io.kestra.plugin.etl.engine;

import com.amazon.ion.IonStruct;
import io.kestra.plugin.etl.ion.IonValueUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Values of a record's key columns, as plain Java values, in key column order. Null key
 * values are allowed and group together. Decimal values are compared by value, so 1.0 and
 * 1.00 share a group.
 */
public record GroupKey(List<Object> values) {
    public GroupKey {
        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            normalized.add(value instanceof BigDecimal decimal ? decimal.stripTrailingZeros() : value);
        }
        values = Collections.unmodifiableList(normalized);
    }

    public static GroupKey of(Object... values) {
        return new GroupKey(Arrays.asList(values));
    }

    public static GroupKey of(IonStruct record, List<String> keyColumns) {
        List<Object> values = new ArrayList<>(keyColumns.size());
        for (String column : keyColumns) {
            values.add(IonValueUtils.toJavaValue(record.get(column)));
        }
        return new GroupKey(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
