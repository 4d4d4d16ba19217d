package io.kestra.plugin.etl.partition;

import com.amazon.ion.IonStruct;

import java.util.List;

/**
 * A contiguous chunk of the input stream. Its records are read-only, so one partition can
 * be handed to a worker thread without copying.
 */
public record Partition(int index, List<IonStruct> records) {
    public Partition {
        if (index < 0) {
            throw new IllegalArgumentException("Partition index must be >= 0, got " + index);
        }
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
