package io.kestra.plugin.etl.ion;

import com.amazon.ion.IonValue;

public interface IonCaster {
    IonValue cast(IonValue value, ColumnType targetType) throws CastException;
}
