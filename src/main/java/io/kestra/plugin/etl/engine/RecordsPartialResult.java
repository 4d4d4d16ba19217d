package io.kestra.plugin.etl.engine;

import com.amazon.ion.IonStruct;

import java.util.List;

/**
 * Surviving records of a partition with no group aggregate, in input order.
 */
public final class RecordsPartialResult extends PartialResult {
    private final List<IonStruct> records;

    public RecordsPartialResult(int partitionIndex, List<IonStruct> records) {
        super(partitionIndex);
        this.records = List.copyOf(records);
    }

    public List<IonStruct> records() {
        return records;
    }
}
