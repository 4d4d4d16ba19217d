package io.kestra.plugin.etl.engine;

import com.amazon.ion.IonStruct;
import io.kestra.plugin.etl.EvaluationException;
import io.kestra.plugin.etl.MergeException;
import io.kestra.plugin.etl.graph.ExecutionPlan;
import io.kestra.plugin.etl.graph.OperationNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines partial results into the output of a run.
 * <p>
 * Partials are processed in partition-index order whatever order they arrive in, so record
 * output keeps input order and group output lists groups by first appearance in the input.
 * Partials are not modified, so the same list can be merged again.
 */
public final class AggregationMerger {
    private final ExecutionPlan plan;

    public AggregationMerger(ExecutionPlan plan) {
        this.plan = plan;
    }

    public PipelineOutput merge(List<PartialResult> partials) throws MergeException, EvaluationException {
        List<PartialResult> ordered = new ArrayList<>(partials);
        ordered.sort(Comparator.comparingInt(PartialResult::partitionIndex));
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).partitionIndex() == ordered.get(i - 1).partitionIndex()) {
                throw new MergeException("Duplicate partial result for partition " + ordered.get(i).partitionIndex());
            }
        }
        return plan.isAggregating() ? mergeGroups(ordered) : concatenate(ordered);
    }

    private PipelineOutput concatenate(List<PartialResult> ordered) throws MergeException {
        List<IonStruct> records = new ArrayList<>();
        for (PartialResult partial : ordered) {
            if (!(partial instanceof RecordsPartialResult recordsPartial)) {
                throw new MergeException("Expected record results, got " + partial.getClass().getSimpleName()
                    + " for partition " + partial.partitionIndex());
            }
            records.addAll(recordsPartial.records());
        }
        return PipelineOutput.ofRecords(plan.outputSchema(), records);
    }

    private PipelineOutput mergeGroups(List<PartialResult> ordered) throws MergeException, EvaluationException {
        Map<GroupKey, GroupState> merged = new LinkedHashMap<>();
        for (PartialResult partial : ordered) {
            if (!(partial instanceof GroupedPartialResult groupedPartial)) {
                throw new MergeException("Expected grouped results, got " + partial.getClass().getSimpleName()
                    + " for partition " + partial.partitionIndex());
            }
            for (Map.Entry<GroupKey, GroupState> entry : groupedPartial.groups().entrySet()) {
                GroupState existing = merged.get(entry.getKey());
                if (existing == null) {
                    merged.put(entry.getKey(), entry.getValue().copy());
                } else {
                    existing.combine(entry.getValue());
                }
            }
        }

        Map<GroupKey, IonStruct> groups = new LinkedHashMap<>();
        for (Map.Entry<GroupKey, GroupState> entry : merged.entrySet()) {
            IonStruct record = finalStages(entry.getValue().toRecord());
            if (record != null) {
                groups.put(entry.getKey(), record);
            }
        }
        return PipelineOutput.ofGroups(plan.outputSchema(), groups);
    }

    private IonStruct finalStages(IonStruct record) throws EvaluationException {
        IonStruct current = record;
        for (OperationNode stage : plan.finalStages()) {
            try {
                current = PartitionExecutor.applyStage(stage, current);
            } catch (EvaluationException | RuntimeException e) {
                throw new EvaluationException(stage.description() + " failed on group " + current + ": " + e.getMessage(), e);
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }
}
