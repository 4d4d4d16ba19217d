package io.kestra.plugin.etl.source;

import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.ion.IonValueUtils;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads records from an in-memory sequence of {@link IonStruct}s or Java maps. Structs are
 * copied, so the caller's instances are neither attached nor frozen by the run.
 */
public final class IterableRecordSource implements RecordSource {
    private final Iterator<?> iterator;

    private IterableRecordSource(Iterator<?> iterator) {
        this.iterator = iterator;
    }

    public static IterableRecordSource of(Iterable<?> records) {
        return new IterableRecordSource(records.iterator());
    }

    public static IterableRecordSource of(Iterator<?> records) {
        return new IterableRecordSource(records);
    }

    @Override
    public boolean hasNext() {
        return iterator.hasNext();
    }

    @Override
    public IonStruct next() {
        if (!iterator.hasNext()) {
            throw new NoSuchElementException();
        }
        Object value = iterator.next();
        if (value instanceof IonStruct struct) {
            return (IonStruct) struct.clone();
        }
        IonValue ionValue = IonValueUtils.toIonValue(value);
        if (ionValue instanceof IonStruct struct) {
            return struct;
        }
        throw new IllegalStateException("Expected struct record, got " + (ionValue == null ? "null" : ionValue.getType()));
    }

    @Override
    public void close() {
    }
}
