package io.kestra.plugin.etl.ion;

import com.amazon.ion.IonValue;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Casts scalars between column types. Strings are parsed, so raw text rows (CSV) can be
 * conformed to a typed schema. Values already of the target type are normalized (ints to
 * longs, timestamps to UTC milliseconds) so equal values always render the same way.
 */
public final class DefaultIonCaster implements IonCaster {
    @Override
    public IonValue cast(IonValue value, ColumnType targetType) throws CastException {
        if (IonValueUtils.isNull(value)) {
            return IonValueUtils.nullValue();
        }

        return switch (targetType) {
            case STRING -> IonValueUtils.system().newString(IonValueUtils.asString(value));
            case INT -> castInt(value);
            case FLOAT -> IonValueUtils.system().newFloat(IonValueUtils.asDouble(value));
            case DECIMAL -> IonValueUtils.system().newDecimal(IonValueUtils.asDecimal(value));
            case BOOLEAN -> IonValueUtils.system().newBool(IonValueUtils.asBoolean(value));
            case TIMESTAMP -> {
                Instant instant = IonValueUtils.asInstant(value);
                yield IonValueUtils.timestamp(instant);
            }
        };
    }

    private IonValue castInt(IonValue value) throws CastException {
        BigDecimal decimal = IonValueUtils.asDecimal(value);
        try {
            return IonValueUtils.system().newInt(decimal.longValueExact());
        } catch (ArithmeticException e) {
            throw new CastException("Expected integer value, got " + decimal, e);
        }
    }
}
