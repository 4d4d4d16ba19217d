package io.kestra.plugin.etl.partition;

import com.amazon.ion.IonInt;
import com.amazon.ion.IonStruct;
import io.kestra.plugin.etl.InvalidConfigurationException;
import io.kestra.plugin.etl.ion.IonValueUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

class PartitionerTest {
    @Test
    void cutsCeilOfRecordsOverSize() throws Exception {
        int[][] cases = {{1000, 100}, {1001, 100}, {99, 100}, {1, 1}, {7, 3}};
        for (int[] testCase : cases) {
            int records = testCase[0];
            int size = testCase[1];

            List<Partition> partitions = drain(Partitioner.partition(records(records).iterator(), size));

            assertThat(partitions.size(), is((records + size - 1) / size));
            for (int i = 0; i < partitions.size(); i++) {
                assertThat(partitions.get(i).index(), is(i));
                boolean last = i == partitions.size() - 1;
                if (!last) {
                    assertThat(partitions.get(i).size(), is(size));
                }
            }
            assertThat(partitions.get(partitions.size() - 1).size(), is(records - (partitions.size() - 1) * size));
        }
    }

    @Test
    void preservesOrderAcrossPartitions() throws Exception {
        List<Partition> partitions = drain(Partitioner.partition(records(10).iterator(), 4));

        List<Long> ids = new ArrayList<>();
        for (Partition partition : partitions) {
            for (IonStruct record : partition.records()) {
                ids.add(((IonInt) record.get("id")).longValue());
            }
        }

        assertThat(ids, contains(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L));
    }

    @Test
    void emptyInputHasNoPartitions() throws Exception {
        Iterator<Partition> partitions = Partitioner.partition(Collections.emptyIterator(), 10);

        assertThat(partitions.hasNext(), is(false));
    }

    @Test
    void rejectsNonPositiveSizeWithoutReading() {
        AtomicInteger reads = new AtomicInteger();
        Iterator<IonStruct> source = counting(records(5).iterator(), reads);

        Assertions.assertThrows(InvalidConfigurationException.class, () -> Partitioner.partition(source, 0));
        Assertions.assertThrows(InvalidConfigurationException.class, () -> Partitioner.partition(source, -3));

        assertThat(reads.get(), is(0));
    }

    @Test
    void readsOnlyOnePartitionAhead() throws Exception {
        AtomicInteger reads = new AtomicInteger();
        Iterator<Partition> partitions = Partitioner.partition(counting(records(100).iterator(), reads), 10);

        assertThat(reads.get(), is(0));
        partitions.next();
        assertThat(reads.get(), is(10));
        partitions.next();
        assertThat(reads.get(), is(20));
    }

    @Test
    void makesRecordsReadOnly() throws Exception {
        Partition partition = Partitioner.partition(records(2).iterator(), 5).next();

        assertThat(partition.records().get(0).isReadOnly(), is(true));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> partition.records().add(null));
    }

    private static List<Partition> drain(Iterator<Partition> partitions) {
        List<Partition> drained = new ArrayList<>();
        partitions.forEachRemaining(drained::add);
        return drained;
    }

    private static List<IonStruct> records(int count) {
        List<IonStruct> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            IonStruct record = IonValueUtils.system().newEmptyStruct();
            record.put("id", IonValueUtils.system().newInt(i));
            records.add(record);
        }
        return records;
    }

    private static Iterator<IonStruct> counting(Iterator<IonStruct> delegate, AtomicInteger reads) {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public IonStruct next() {
                reads.incrementAndGet();
                return delegate.next();
            }
        };
    }
}
