package io.kestra.plugin.etl.graph;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.EvaluationException;
import io.kestra.plugin.etl.expression.CompiledExpression;
import io.kestra.plugin.etl.expression.ExpressionException;
import io.kestra.plugin.etl.ion.IonValueUtils;
import io.kestra.plugin.etl.schema.Schema;

/**
 * Keeps the records its predicate accepts. The output schema is the input schema.
 */
public final class FilterNode implements OperationNode {
    private final OperationNode upstream;
    private final String description;
    private final CompiledExpression expression;
    private final RecordPredicate predicate;

    private FilterNode(OperationNode upstream, String description, CompiledExpression expression, RecordPredicate predicate) {
        this.upstream = upstream;
        this.description = description;
        this.expression = expression;
        this.predicate = predicate;
    }

    static FilterNode ofExpression(OperationNode upstream, CompiledExpression expression) {
        return new FilterNode(upstream, "filter(" + expression.source() + ")", expression, null);
    }

    static FilterNode ofPredicate(OperationNode upstream, String description, RecordPredicate predicate) {
        return new FilterNode(upstream, "filter(" + description + ")", null, predicate);
    }

    public boolean test(IonStruct record) throws EvaluationException {
        if (expression != null) {
            return testExpression(record);
        }
        try {
            return predicate.test(new Row(record, upstream.outputSchema()));
        } catch (EvaluationException e) {
            throw e;
        } catch (Exception e) {
            throw new EvaluationException(e.getMessage() == null ? e.getClass().getName() : e.getMessage(), e);
        }
    }

    private boolean testExpression(IonStruct record) throws EvaluationException {
        IonValue evaluated;
        try {
            evaluated = expression.evaluate(record);
        } catch (ExpressionException e) {
            throw new EvaluationException(e.getMessage(), e);
        }
        if (IonValueUtils.isNull(evaluated)) {
            throw new EvaluationException("Filter expression evaluated to null");
        }
        if (evaluated instanceof IonBool ionBool) {
            return ionBool.booleanValue();
        }
        throw new EvaluationException("Filter expression must return boolean, got " + evaluated.getType());
    }

    @Override
    public OperationNode upstream() {
        return upstream;
    }

    @Override
    public Schema outputSchema() {
        return upstream.outputSchema();
    }

    @Override
    public String description() {
        return description;
    }
}
