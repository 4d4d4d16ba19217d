package io.kestra.plugin.etl.ion;

import com.amazon.ion.IonType;

/**
 * Scalar column types a record may carry, with the Ion type each one is stored as.
 */
public enum ColumnType {
    INT(IonType.INT),
    FLOAT(IonType.FLOAT),
    DECIMAL(IonType.DECIMAL),
    STRING(IonType.STRING),
    TIMESTAMP(IonType.TIMESTAMP),
    BOOLEAN(IonType.BOOL);

    private final IonType ionType;

    ColumnType(IonType ionType) {
        this.ionType = ionType;
    }

    public IonType ionType() {
        return ionType;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT || this == DECIMAL;
    }

    /** Types min and max can order. */
    public boolean isOrderable() {
        return isNumeric() || this == STRING || this == TIMESTAMP;
    }

    public static ColumnType of(IonType ionType) {
        for (ColumnType type : values()) {
            if (type.ionType == ionType) {
                return type;
            }
        }
        return null;
    }
}
