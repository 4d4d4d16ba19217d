package io.kestra.plugin.etl.graph;

import io.kestra.plugin.etl.schema.Schema;

import java.util.List;

/**
 * A graph flattened for evaluation: the stages every partition runs independently, the
 * optional group aggregate folded per partition and merged afterwards, and the stages
 * applied to finalized groups once the merge is done.
 */
public record ExecutionPlan(
    Schema sourceSchema,
    List<OperationNode> partitionStages,
    GroupAggregateNode aggregate,
    List<OperationNode> finalStages,
    Schema outputSchema
) {
    public ExecutionPlan {
        partitionStages = List.copyOf(partitionStages);
        finalStages = List.copyOf(finalStages);
    }

    public boolean isAggregating() {
        return aggregate != null;
    }
}
