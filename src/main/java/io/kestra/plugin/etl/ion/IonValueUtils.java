package io.kestra.plugin.etl.ion;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonFloat;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonString;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonSystem;
import com.amazon.ion.IonTimestamp;
import com.amazon.ion.IonValue;
import com.amazon.ion.Timestamp;
import com.amazon.ion.system.IonSystemBuilder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

public final class IonValueUtils {
    private static final IonSystem SYSTEM = IonSystemBuilder.standard().build();

    private IonValueUtils() {
    }

    public static IonSystem system() {
        return SYSTEM;
    }

    public static boolean isNull(IonValue value) {
        return value == null || value.isNullValue();
    }

    public static IonValue nullValue() {
        return SYSTEM.newNull();
    }

    /**
     * Copies a value so it can be attached to another container. Read-only values clone
     * into mutable ones.
     */
    public static IonValue cloneValue(IonValue value) {
        if (value == null) {
            return null;
        }
        return value.clone();
    }

    public static IonTimestamp timestamp(Instant instant) {
        return SYSTEM.newTimestamp(Timestamp.forMillis(instant.toEpochMilli(), 0));
    }

    public static IonValue toIonValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof IonValue ionValue) {
            return ionValue;
        }
        if (value instanceof String stringValue) {
            return SYSTEM.newString(stringValue);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return SYSTEM.newInt(((Number) value).longValue());
        }
        if (value instanceof Float || value instanceof Double) {
            return SYSTEM.newFloat(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return SYSTEM.newDecimal(decimal);
        }
        if (value instanceof Boolean bool) {
            return SYSTEM.newBool(bool);
        }
        if (value instanceof Instant instant) {
            return timestamp(instant);
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return timestamp(offsetDateTime.toInstant());
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return timestamp(zonedDateTime.toInstant());
        }
        if (value instanceof Date date) {
            return timestamp(date.toInstant());
        }
        if (value instanceof Map<?, ?> map) {
            IonStruct struct = SYSTEM.newEmptyStruct();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                IonValue ionValue = toIonValue(entry.getValue());
                struct.put(String.valueOf(entry.getKey()), ionValue == null ? nullValue() : cloneIfAttached(ionValue));
            }
            return struct;
        }
        return SYSTEM.newString(String.valueOf(value));
    }

    public static BigDecimal asDecimal(IonValue value) throws CastException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonDecimal ionDecimal) {
            return ionDecimal.bigDecimalValue();
        }
        if (value instanceof IonInt ionInt) {
            return new BigDecimal(ionInt.bigIntegerValue());
        }
        if (value instanceof IonFloat ionFloat) {
            try {
                return BigDecimal.valueOf(ionFloat.doubleValue());
            } catch (NumberFormatException e) {
                throw new CastException("Not a finite number: " + ionFloat.doubleValue(), e);
            }
        }
        if (value instanceof IonString ionString) {
            try {
                return new BigDecimal(ionString.stringValue().trim());
            } catch (NumberFormatException e) {
                throw new CastException("Invalid decimal: " + ionString.stringValue(), e);
            }
        }
        throw new CastException("Expected numeric value, got " + value.getType());
    }

    public static double asDouble(IonValue value) throws CastException {
        if (value instanceof IonFloat ionFloat && !ionFloat.isNullValue()) {
            return ionFloat.doubleValue();
        }
        BigDecimal decimal = asDecimal(value);
        if (decimal == null) {
            throw new CastException("Expected numeric value, got null");
        }
        return decimal.doubleValue();
    }

    public static String asString(IonValue value) {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonString ionString) {
            return ionString.stringValue();
        }
        if (value instanceof IonTimestamp ionTimestamp) {
            return Instant.ofEpochMilli(ionTimestamp.timestampValue().getMillis()).toString();
        }
        return value.toString();
    }

    public static Boolean asBoolean(IonValue value) throws CastException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonBool ionBool) {
            return ionBool.booleanValue();
        }
        if (value instanceof IonString ionString) {
            String raw = ionString.stringValue().trim();
            if ("true".equalsIgnoreCase(raw)) {
                return true;
            }
            if ("false".equalsIgnoreCase(raw)) {
                return false;
            }
        }
        throw new CastException("Expected boolean value, got " + value.getType());
    }

    public static Instant asInstant(IonValue value) throws CastException {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonTimestamp ionTimestamp) {
            return Instant.ofEpochMilli(ionTimestamp.timestampValue().getMillis());
        }
        if (value instanceof IonString ionString) {
            try {
                return Instant.parse(ionString.stringValue().trim());
            } catch (Exception e) {
                throw new CastException("Invalid timestamp: " + ionString.stringValue(), e);
            }
        }
        throw new CastException("Expected timestamp value, got " + value.getType());
    }

    /**
     * Converts to plain Java values: structs become ordered maps, ints longs, floats
     * doubles, decimals {@link BigDecimal}, timestamps ISO-8601 strings.
     */
    public static Object toJavaValue(IonValue value) {
        if (isNull(value)) {
            return null;
        }
        if (value instanceof IonStruct ionStruct) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (IonValue child : ionStruct) {
                map.put(child.getFieldName(), toJavaValue(child));
            }
            return map;
        }
        if (value instanceof IonString ionString) {
            return ionString.stringValue();
        }
        if (value instanceof IonInt ionInt) {
            return ionInt.longValue();
        }
        if (value instanceof IonFloat ionFloat) {
            return ionFloat.doubleValue();
        }
        if (value instanceof IonDecimal ionDecimal) {
            return ionDecimal.bigDecimalValue();
        }
        if (value instanceof IonBool ionBool) {
            return ionBool.booleanValue();
        }
        if (value instanceof IonTimestamp ionTimestamp) {
            return Instant.ofEpochMilli(ionTimestamp.timestampValue().getMillis()).toString();
        }
        return value.toString();
    }

    private static IonValue cloneIfAttached(IonValue value) {
        return value.getContainer() == null && !value.isReadOnly() ? value : value.clone();
    }
}
