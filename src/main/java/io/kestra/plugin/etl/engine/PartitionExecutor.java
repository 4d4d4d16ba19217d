package io.kestra.plugin.etl.engine;

import com.amazon.ion.IonStruct;
import io.kestra.plugin.etl.EvaluationException;
import io.kestra.plugin.etl.graph.ExecutionPlan;
import io.kestra.plugin.etl.graph.FilterNode;
import io.kestra.plugin.etl.graph.GroupAggregateNode;
import io.kestra.plugin.etl.graph.MapNode;
import io.kestra.plugin.etl.graph.OperationNode;
import io.kestra.plugin.etl.ion.CastException;
import io.kestra.plugin.etl.ion.DefaultIonCaster;
import io.kestra.plugin.etl.ion.IonCaster;
import io.kestra.plugin.etl.partition.Partition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates the partition stages of a plan over one partition, record by record, and folds
 * the survivors into per-group accumulators when the plan aggregates.
 * <p>
 * Stateless and safe to share between workers. The first failing record aborts the
 * partition; the exception names the partition, the record's zero-based ordinal in it, the
 * stage and the record.
 */
public final class PartitionExecutor {
    static final String CONFORM_STAGE = "conform";

    private final IonCaster caster;

    public PartitionExecutor() {
        this(new DefaultIonCaster());
    }

    public PartitionExecutor(IonCaster caster) {
        this.caster = caster;
    }

    public PartialResult execute(ExecutionPlan plan, Partition partition) throws EvaluationException {
        GroupAggregateNode aggregate = plan.aggregate();
        List<IonStruct> records = aggregate == null ? new ArrayList<>() : null;
        Map<GroupKey, GroupState> groups = aggregate == null ? null : new LinkedHashMap<>();

        long ordinal = 0;
        for (IonStruct input : partition.records()) {
            IonStruct record;
            try {
                record = plan.sourceSchema().conform(input, caster);
            } catch (CastException | RuntimeException e) {
                throw new EvaluationException(partition.index(), ordinal, CONFORM_STAGE, input, e);
            }

            for (OperationNode stage : plan.partitionStages()) {
                try {
                    record = applyStage(stage, record);
                } catch (EvaluationException | RuntimeException e) {
                    throw new EvaluationException(partition.index(), ordinal, stage.description(), record, e);
                }
                if (record == null) {
                    break;
                }
            }

            if (record != null) {
                if (aggregate == null) {
                    records.add(record);
                } else {
                    fold(aggregate, groups, record, partition.index(), ordinal);
                }
            }
            ordinal++;
        }

        return aggregate == null
            ? new RecordsPartialResult(partition.index(), records)
            : new GroupedPartialResult(partition.index(), groups);
    }

    private static void fold(GroupAggregateNode aggregate,
                             Map<GroupKey, GroupState> groups,
                             IonStruct record,
                             int partitionIndex,
                             long ordinal) throws EvaluationException {
        try {
            GroupKey key = GroupKey.of(record, aggregate.keyColumns());
            GroupState state = groups.get(key);
            if (state == null) {
                state = GroupState.create(aggregate, record);
                groups.put(key, state);
            }
            state.add(record);
        } catch (CastException | RuntimeException e) {
            throw new EvaluationException(partitionIndex, ordinal, aggregate.description(), record, e);
        }
    }

    /**
     * Runs a filter or map stage on one record.
     *
     * @return the projected record, the record itself when a filter keeps it, or
     * {@code null} when a filter drops it
     */
    static IonStruct applyStage(OperationNode stage, IonStruct record) throws EvaluationException {
        if (stage instanceof FilterNode filter) {
            return filter.test(record) ? record : null;
        }
        if (stage instanceof MapNode map) {
            return map.apply(record);
        }
        throw new IllegalStateException("Unsupported record stage: " + stage.description());
    }
}
