package io.kestra.plugin.etl.partition;

import com.amazon.ion.IonStruct;
import io.kestra.plugin.etl.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits a record stream into partitions of at most {@code targetPartitionSize} records.
 * <p>
 * Partitioning is lazy: a partition is cut only when the returned iterator is advanced, and
 * no more than one partition's worth of records is buffered at a time. Indices are
 * contiguous from zero in emission order; only the last partition may be short, and an
 * empty stream yields no partition at all.
 * <p>
 * Every record is made read-only in place, so the iterator must hand over structs nobody
 * else mutates afterwards. The record sources of this project create or copy their structs.
 */
public final class Partitioner {
    private static final Logger log = LoggerFactory.getLogger(Partitioner.class);

    private Partitioner() {
    }

    public static Iterator<Partition> partition(Iterator<IonStruct> records, int targetPartitionSize) throws InvalidConfigurationException {
        if (targetPartitionSize <= 0) {
            throw new InvalidConfigurationException("targetPartitionSize must be > 0, got " + targetPartitionSize);
        }
        return new PartitionIterator(records, targetPartitionSize);
    }

    private static final class PartitionIterator implements Iterator<Partition> {
        private final Iterator<IonStruct> records;
        private final int targetPartitionSize;
        private int nextIndex;

        private PartitionIterator(Iterator<IonStruct> records, int targetPartitionSize) {
            this.records = records;
            this.targetPartitionSize = targetPartitionSize;
        }

        @Override
        public boolean hasNext() {
            return records.hasNext();
        }

        @Override
        public Partition next() {
            if (!records.hasNext()) {
                throw new NoSuchElementException();
            }
            List<IonStruct> buffer = new ArrayList<>(Math.min(targetPartitionSize, 1024));
            while (buffer.size() < targetPartitionSize && records.hasNext()) {
                IonStruct record = records.next();
                record.makeReadOnly();
                buffer.add(record);
            }
            Partition partition = new Partition(nextIndex++, buffer);
            log.debug("Cut partition {} with {} records", partition.index(), partition.size());
            return partition;
        }
    }
}
