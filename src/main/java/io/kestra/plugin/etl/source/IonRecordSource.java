package io.kestra.plugin.etl.source;

import com.amazon.ion.IonList;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.ion.IonValueUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Streams records out of Ion text or binary data. Top-level structs are records; top-level
 * lists are flattened into their struct elements.
 */
public final class IonRecordSource implements RecordSource {
    private final InputStream inputStream;
    private final Iterator<IonValue> values;
    private final Deque<IonValue> pending = new ArrayDeque<>();

    public IonRecordSource(InputStream inputStream) {
        this.inputStream = inputStream;
        this.values = IonValueUtils.system().iterate(inputStream);
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && values.hasNext()) {
            IonValue value = values.next();
            if (value instanceof IonList list) {
                for (IonValue element : list) {
                    pending.add(element);
                }
            } else {
                pending.add(value);
            }
        }
        return !pending.isEmpty();
    }

    @Override
    public IonStruct next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        IonValue value = pending.poll();
        if (value instanceof IonStruct struct) {
            return struct.getContainer() == null ? struct : (IonStruct) struct.clone();
        }
        throw new IllegalStateException("Expected struct record, got " + value.getType());
    }

    @Override
    public void close() throws IOException {
        inputStream.close();
    }
}
