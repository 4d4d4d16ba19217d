package io.kestra.plugin.etl.graph;

import io.kestra.plugin.etl.SchemaException;
import io.kestra.plugin.etl.engine.DefaultRecordTransformer;
import io.kestra.plugin.etl.engine.ProjectionTransformer;
import io.kestra.plugin.etl.expression.CompiledExpression;
import io.kestra.plugin.etl.expression.DefaultExpressionEngine;
import io.kestra.plugin.etl.expression.ExpressionEngine;
import io.kestra.plugin.etl.expression.ExpressionException;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.ion.DefaultIonCaster;
import io.kestra.plugin.etl.ion.IonCaster;
import io.kestra.plugin.etl.schema.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable handle on the head of a lazy pipeline.
 * <p>
 * Every builder method validates the new stage against the upstream schema and returns a
 * new handle; nothing is evaluated until the graph is run. Handles can share upstream
 * stages, so several pipelines may branch off a common prefix.
 *
 * <pre>{@code
 * OperationGraph graph = OperationGraph.source(schema)
 *     .filter("amount > 0")
 *     .groupAggregate(List.of("region"), Map.of(
 *         "total", AggregateSpec.sum("amount"),
 *         "count", AggregateSpec.count()));
 * }</pre>
 */
public final class OperationGraph {
    private final OperationNode head;
    private final ExpressionEngine expressionEngine;
    private final IonCaster caster;

    private OperationGraph(OperationNode head, ExpressionEngine expressionEngine, IonCaster caster) {
        this.head = head;
        this.expressionEngine = expressionEngine;
        this.caster = caster;
    }

    public static OperationGraph source(Schema schema) {
        return source(schema, new DefaultExpressionEngine(), new DefaultIonCaster());
    }

    public static OperationGraph source(Schema schema, ExpressionEngine expressionEngine, IonCaster caster) {
        Objects.requireNonNull(schema, "schema is required");
        return new OperationGraph(new SourceNode(schema), expressionEngine, caster);
    }

    /**
     * Adds a filter written in the expression language.
     *
     * @throws SchemaException when the expression does not parse, reads an unknown column
     *                         or cannot produce a boolean
     */
    public OperationGraph filter(String expression) throws SchemaException {
        CompiledExpression compiled = compile(expression, "filter");
        Schema input = head.outputSchema();
        checkColumns(compiled, input, "filter(" + expression + ")");
        ColumnType type;
        try {
            type = compiled.inferType(input);
        } catch (ExpressionException e) {
            throw new SchemaException("Invalid filter(" + expression + "): " + e.getMessage(), e);
        }
        if (type != null && type != ColumnType.BOOLEAN) {
            throw new SchemaException("filter(" + expression + ") must return a boolean, got " + type);
        }
        return append(FilterNode.ofExpression(head, compiled));
    }

    public OperationGraph filter(RecordPredicate predicate) {
        return filter(predicate.toString(), predicate);
    }

    public OperationGraph filter(String description, RecordPredicate predicate) {
        Objects.requireNonNull(predicate, "predicate is required");
        return append(FilterNode.ofPredicate(head, description, predicate));
    }

    public OperationGraph map(List<FieldMapping> mappings) throws SchemaException {
        return map(mappings, false);
    }

    /**
     * Adds a projection written in the expression language. With {@code keepOriginalFields}
     * the input columns that are not remapped are carried over ahead of the mapped ones.
     */
    public OperationGraph map(List<FieldMapping> mappings, boolean keepOriginalFields) throws SchemaException {
        DefaultRecordTransformer transformer = new DefaultRecordTransformer(
            mappings,
            head.outputSchema(),
            expressionEngine,
            caster,
            keepOriginalFields
        );
        return append(new MapNode(head, "map(" + transformer.describe() + ")", transformer, transformer.outputSchema()));
    }

    /**
     * Adds a Java projection whose results are conformed to {@code outputSchema} at
     * execution time.
     */
    public OperationGraph map(Schema outputSchema, RecordProjection projection) {
        Objects.requireNonNull(outputSchema, "outputSchema is required");
        Objects.requireNonNull(projection, "projection is required");
        ProjectionTransformer transformer = new ProjectionTransformer(projection, head.outputSchema(), outputSchema, caster);
        return append(new MapNode(head, "map(" + outputSchema.columnNames() + ")", transformer, outputSchema));
    }

    public OperationGraph groupAggregate(List<String> keyColumns, Map<String, AggregateSpec> aggregates) throws SchemaException {
        for (OperationNode node = head; node != null; node = node.upstream()) {
            if (node instanceof GroupAggregateNode) {
                throw new SchemaException("A graph supports a single groupAggregate stage");
            }
        }
        return append(GroupAggregateNode.create(head, keyColumns, aggregates));
    }

    public OperationNode head() {
        return head;
    }

    public Schema schema() {
        return head.outputSchema();
    }

    /** Stages from the source to the head, source first. */
    public List<OperationNode> nodes() {
        List<OperationNode> nodes = new ArrayList<>();
        for (OperationNode node = head; node != null; node = node.upstream()) {
            nodes.add(node);
        }
        Collections.reverse(nodes);
        return nodes;
    }

    public ExecutionPlan plan() {
        List<OperationNode> nodes = nodes();
        SourceNode source = (SourceNode) nodes.get(0);
        List<OperationNode> partitionStages = new ArrayList<>();
        List<OperationNode> finalStages = new ArrayList<>();
        GroupAggregateNode aggregate = null;
        for (OperationNode node : nodes.subList(1, nodes.size())) {
            if (node instanceof GroupAggregateNode groupAggregate) {
                aggregate = groupAggregate;
            } else if (aggregate == null) {
                partitionStages.add(node);
            } else {
                finalStages.add(node);
            }
        }
        return new ExecutionPlan(source.outputSchema(), partitionStages, aggregate, finalStages, head.outputSchema());
    }

    public String describe() {
        List<String> parts = new ArrayList<>();
        for (OperationNode node : nodes()) {
            parts.add(node.description());
        }
        return String.join(" -> ", parts);
    }

    @Override
    public String toString() {
        return describe();
    }

    private OperationGraph append(OperationNode node) {
        return new OperationGraph(node, expressionEngine, caster);
    }

    private CompiledExpression compile(String expression, String stage) throws SchemaException {
        try {
            return expressionEngine.compile(expression);
        } catch (ExpressionException e) {
            throw new SchemaException("Invalid " + stage + " expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    private static void checkColumns(CompiledExpression expression, Schema schema, String context) throws SchemaException {
        for (String column : expression.referencedColumns()) {
            schema.require(column, context);
        }
    }
}
