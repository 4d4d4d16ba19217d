package io.kestra.plugin.etl.engine;

import com.amazon.ion.IonStruct;
import io.kestra.plugin.etl.EtlException;
import io.kestra.plugin.etl.InvalidConfigurationException;
import io.kestra.plugin.etl.PartitionFailureException;
import io.kestra.plugin.etl.graph.AggregateSpec;
import io.kestra.plugin.etl.graph.OperationGraph;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.ion.IonValueUtils;
import io.kestra.plugin.etl.monitor.PartitionTiming;
import io.kestra.plugin.etl.partition.Partition;
import io.kestra.plugin.etl.partition.Partitioner;
import io.kestra.plugin.etl.schema.Schema;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;

class PartitionSchedulerTest {
    private final PartitionScheduler scheduler = new PartitionScheduler();
    private Schema schema;

    @BeforeEach
    void setUp() throws Exception {
        schema = Schema.builder()
            .column("id", ColumnType.INT)
            .column("amount", ColumnType.DECIMAL)
            .column("region", ColumnType.STRING)
            .build();
    }

    @Test
    void outputIsIdenticalForAnyConcurrency() throws Exception {
        OperationGraph grouped = grouped();
        OperationGraph filtered = OperationGraph.source(schema).filter("amount > 10");
        List<IonStruct> records = records(2_000);

        ExecutionOutcome groupedBaseline = scheduler.run(grouped, Partitioner.partition(records.iterator(), 64), 1);
        ExecutionOutcome filteredBaseline = scheduler.run(filtered, Partitioner.partition(records.iterator(), 64), 1);
        for (int concurrency : new int[]{4, 10}) {
            ExecutionOutcome groupedRun = scheduler.run(grouped, Partitioner.partition(records.iterator(), 64), concurrency);
            ExecutionOutcome filteredRun = scheduler.run(filtered, Partitioner.partition(records.iterator(), 64), concurrency);

            assertThat(groupedRun.output(), is(groupedBaseline.output()));
            assertThat(groupedRun.output().toJavaRecords(), is(groupedBaseline.output().toJavaRecords()));
            assertThat(filteredRun.output(), is(filteredBaseline.output()));
            assertThat(groupedRun.report().getConcurrency(), is(concurrency));
        }
    }

    @Test
    void reportsEveryPartitionOnce() throws Exception {
        ExecutionOutcome outcome = scheduler.run(grouped(), Partitioner.partition(records(1_000).iterator(), 100), 4);

        List<Integer> indices = outcome.report().getPartitionTimings().stream()
            .map(PartitionTiming::partitionIndex)
            .collect(Collectors.toList());
        assertThat(indices, contains(0, 1, 2, 3, 4, 5, 6, 7, 8, 9));
        assertThat(outcome.report().getPartitionCount(), is(10));
        assertThat(outcome.report().getSucceededTasks(), is(10));
        assertThat(outcome.report().getFailedTasks(), is(0));
        assertThat(outcome.report().getTotalRecords(), is(1_000L));
        assertThat(outcome.report().getPeakConcurrency(), lessThanOrEqualTo(4));
    }

    @Test
    void failingRecordFailsOnlyItsPartition() throws Exception {
        List<IonStruct> records = records(1_000);
        IonStruct poisoned = IonValueUtils.system().newEmptyStruct();
        poisoned.put("id", IonValueUtils.system().newString("not-a-number"));
        records.set(537, poisoned);
        AtomicInteger evaluated = new AtomicInteger();
        OperationGraph graph = OperationGraph.source(schema).filter("counted", row -> {
            evaluated.incrementAndGet();
            return true;
        });

        PartitionFailureException exception = Assertions.assertThrows(
            PartitionFailureException.class,
            () -> scheduler.run(graph, Partitioner.partition(records.iterator(), 100), 4)
        );

        assertThat(exception.getFailedPartitions(), contains(5));
        assertThat(exception.getErrors().get(0).cause().getRecordOrdinal(), is(37L));
        assertThat(exception.getReport().getSucceededTasks(), is(9));
        assertThat(exception.getReport().getFailedTasks(), is(1));
        assertThat(exception.getMessage(), containsString("1 of 10 partitions failed"));
        assertThat(evaluated.get(), is(937));
    }

    @Test
    void collectsEveryFailure() throws Exception {
        OperationGraph graph = OperationGraph.source(schema).filter("toInt(region) > 0");

        PartitionFailureException exception = Assertions.assertThrows(
            PartitionFailureException.class,
            () -> scheduler.run(graph, Partitioner.partition(records(300).iterator(), 100), 2)
        );

        assertThat(exception.getFailedPartitions(), contains(0, 1, 2));
        assertThat(exception.getSuppressed().length, is(3));
    }

    @Test
    void emptyInputGivesEmptyOutput() throws Exception {
        ExecutionOutcome outcome = scheduler.run(grouped(), Collections.emptyIterator(), 3);

        assertThat(outcome.output().size(), is(0));
        assertThat(outcome.report().getPartitionTimings(), is(empty()));
        assertThat(outcome.report().getPartitionCount(), is(0));
    }

    @Test
    void rejectsNonPositiveConcurrency() {
        InvalidConfigurationException exception = Assertions.assertThrows(
            InvalidConfigurationException.class,
            () -> scheduler.run(grouped(), Collections.emptyIterator(), 0)
        );

        assertThat(exception.getMessage(), is("concurrency must be > 0, got 0"));
    }

    @Test
    void neverHoldsMoreThanConcurrencyPartitionsInFlight() throws Exception {
        AtomicInteger pulled = new AtomicInteger();
        AtomicInteger done = new AtomicInteger();
        AtomicInteger maxAhead = new AtomicInteger();
        Iterator<Partition> partitions = Partitioner.partition(records(2_000).iterator(), 50);
        Iterator<Partition> tracking = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return partitions.hasNext();
            }

            @Override
            public Partition next() {
                maxAhead.accumulateAndGet(pulled.incrementAndGet() - done.get(), Math::max);
                return partitions.next();
            }
        };
        OperationGraph graph = OperationGraph.source(schema)
            .map(schema, row -> row.toMap())
            .filter("last of partition", row -> {
                if (((Long) row.getValue("id")) % 50 == 49) {
                    done.incrementAndGet();
                }
                return true;
            });

        ExecutionOutcome outcome = scheduler.run(graph, tracking, 3);

        assertThat(outcome.output().size(), is(2_000));
        assertThat(maxAhead.get(), lessThanOrEqualTo(4));
        assertThat(outcome.report().getPeakConcurrency(), lessThanOrEqualTo(3));
    }

    @Test
    void readFailureStopsDispatchAndFails() {
        List<IonStruct> records = records(500);
        Iterator<IonStruct> source = records.iterator();
        AtomicInteger reads = new AtomicInteger();
        Iterator<IonStruct> failing = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public IonStruct next() {
                if (reads.incrementAndGet() > 250) {
                    throw new IllegalStateException("disk gone");
                }
                return source.next();
            }
        };

        EtlException exception = Assertions.assertThrows(
            EtlException.class,
            () -> scheduler.run(grouped(), Partitioner.partition(failing, 100), 2)
        );

        assertThat(exception instanceof PartitionFailureException, is(false));
        assertThat(exception.getMessage(), is("Failed to read input after 2 partitions"));
        assertThat(exception.getCause().getMessage(), is("disk gone"));
    }

    @Test
    void concurrencyOneRunsOnASingleWorker() throws Exception {
        ExecutionOutcome outcome = scheduler.run(grouped(), Partitioner.partition(records(500).iterator(), 50), 1);

        List<String> workers = new ArrayList<>();
        for (PartitionTiming timing : outcome.report().getPartitionTimings()) {
            if (!workers.contains(timing.worker())) {
                workers.add(timing.worker());
            }
        }
        assertThat(workers, hasSize(1));
        assertThat(outcome.report().getPeakConcurrency(), is(1));
    }

    private OperationGraph grouped() throws Exception {
        Map<String, AggregateSpec> aggregates = new LinkedHashMap<>();
        aggregates.put("total", AggregateSpec.sum("amount"));
        aggregates.put("count", AggregateSpec.count());
        aggregates.put("smallest", AggregateSpec.min("amount"));
        aggregates.put("mean", AggregateSpec.average("amount"));
        return OperationGraph.source(schema).groupAggregate(List.of("region"), aggregates);
    }

    private static List<IonStruct> records(int count) {
        List<String> regions = List.of("eu", "us", "apac", "latam", "mea");
        List<IonStruct> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            IonStruct record = IonValueUtils.system().newEmptyStruct();
            record.put("id", IonValueUtils.system().newInt(i));
            record.put("amount", IonValueUtils.system().newDecimal(BigDecimal.valueOf((i * 7919L) % 10_000, 2)));
            record.put("region", IonValueUtils.system().newString(regions.get((i * 31) % regions.size())));
            records.add(record);
        }
        return records;
    }
}
