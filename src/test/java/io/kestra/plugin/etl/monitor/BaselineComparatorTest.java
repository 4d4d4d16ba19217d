package io.kestra.plugin.etl.monitor;

import io.kestra.plugin.etl.config.ExecutionConfig;
import io.kestra.plugin.etl.graph.AggregateSpec;
import io.kestra.plugin.etl.graph.OperationGraph;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.schema.Schema;
import io.kestra.plugin.etl.source.IterableRecordSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;

class BaselineComparatorTest {
    @Test
    void runsBothModesOverFreshSources() throws Exception {
        List<Map<String, Object>> records = new ArrayList<>();
        for (int i = 0; i < 5_000; i++) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("customer", "c" + (i % 97));
            record.put("amount", (i % 113) * 1.25);
            records.add(record);
        }
        Schema schema = Schema.builder()
            .column("customer", ColumnType.STRING)
            .column("amount", ColumnType.FLOAT)
            .build();
        Map<String, AggregateSpec> aggregates = new LinkedHashMap<>();
        aggregates.put("spent", AggregateSpec.sum("amount"));
        aggregates.put("largest", AggregateSpec.max("amount"));
        aggregates.put("orders", AggregateSpec.count());
        OperationGraph graph = OperationGraph.source(schema).groupAggregate(List.of("customer"), aggregates);
        ExecutionConfig config = ExecutionConfig.builder().targetPartitionSize(250).concurrency(4).build();

        BaselineComparator.BaselineComparison comparison = new BaselineComparator()
            .compare(graph, () -> IterableRecordSource.of(records), config);

        assertThat(comparison.outputsMatch(), is(true));
        assertThat(comparison.sequential().getConcurrency(), is(1));
        assertThat(comparison.sequential().getPeakConcurrency(), is(1));
        assertThat(comparison.parallel().getConcurrency(), is(4));
        assertThat(comparison.parallel().getPartitionCount(), is(20));
        assertThat(comparison.sequential().getPartitionCount(), is(20));
        assertThat(comparison.speedup(), greaterThan(0.0));
    }
}
