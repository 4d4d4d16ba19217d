package io.kestra.plugin.etl.engine;

import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.EvaluationException;
import io.kestra.plugin.etl.SchemaException;
import io.kestra.plugin.etl.expression.CompiledExpression;
import io.kestra.plugin.etl.expression.ExpressionEngine;
import io.kestra.plugin.etl.expression.ExpressionException;
import io.kestra.plugin.etl.graph.FieldMapping;
import io.kestra.plugin.etl.ion.CastException;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.ion.IonCaster;
import io.kestra.plugin.etl.ion.IonValueUtils;
import io.kestra.plugin.etl.schema.Schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evaluates field mappings written in the expression language. Expressions are compiled
 * and checked against the input schema once, when the stage is declared.
 */
public final class DefaultRecordTransformer implements RecordTransformer {
    private final List<CompiledMapping> mappings;
    private final Set<String> mappedTargets;
    private final IonCaster caster;
    private final boolean keepOriginalFields;
    private final Schema inputSchema;
    private final Schema outputSchema;

    public DefaultRecordTransformer(List<FieldMapping> mappings,
                                    Schema inputSchema,
                                    ExpressionEngine expressionEngine,
                                    IonCaster caster,
                                    boolean keepOriginalFields) throws SchemaException {
        if (mappings == null || mappings.isEmpty()) {
            throw new SchemaException("map requires at least one field mapping");
        }
        this.caster = caster;
        this.keepOriginalFields = keepOriginalFields;
        this.inputSchema = inputSchema;
        this.mappings = new ArrayList<>();
        this.mappedTargets = new HashSet<>();
        for (FieldMapping mapping : mappings) {
            if (!mappedTargets.add(mapping.targetField())) {
                throw new SchemaException("Duplicate target field '" + mapping.targetField() + "'");
            }
            this.mappings.add(compile(mapping, inputSchema, expressionEngine));
        }
        this.outputSchema = buildOutputSchema();
    }

    private static CompiledMapping compile(FieldMapping mapping, Schema inputSchema, ExpressionEngine expressionEngine) throws SchemaException {
        String context = "mapping '" + mapping.targetField() + "'";
        CompiledExpression expression;
        ColumnType inferred;
        try {
            expression = expressionEngine.compile(mapping.expression());
            for (String column : expression.referencedColumns()) {
                inputSchema.require(column, context);
            }
            inferred = expression.inferType(inputSchema);
        } catch (ExpressionException e) {
            throw new SchemaException("Invalid " + context + " '" + mapping.expression() + "': " + e.getMessage(), e);
        }
        ColumnType type = mapping.type() != null ? mapping.type() : inferred;
        if (type == null) {
            throw new SchemaException("Cannot infer the type of " + context + " '" + mapping.expression() + "'; declare one");
        }
        return new CompiledMapping(mapping, expression, type);
    }

    private Schema buildOutputSchema() throws SchemaException {
        Schema.Builder builder = Schema.builder();
        if (keepOriginalFields) {
            for (Map.Entry<String, ColumnType> column : inputSchema.columns().entrySet()) {
                if (!mappedTargets.contains(column.getKey())) {
                    builder.column(column.getKey(), column.getValue());
                }
            }
        }
        for (CompiledMapping mapping : mappings) {
            builder.column(mapping.mapping().targetField(), mapping.type());
        }
        return builder.build();
    }

    public Schema outputSchema() {
        return outputSchema;
    }

    public String describe() {
        return mappings.stream()
            .map(mapping -> mapping.mapping().targetField() + "=" + mapping.expression().source())
            .collect(Collectors.joining(", "));
    }

    @Override
    public IonStruct transform(IonStruct input) throws EvaluationException {
        IonStruct output = IonValueUtils.system().newEmptyStruct();

        if (keepOriginalFields) {
            for (String column : inputSchema.columnNames()) {
                if (mappedTargets.contains(column)) {
                    continue;
                }
                IonValue value = input.get(column);
                output.put(column, value == null ? IonValueUtils.nullValue() : IonValueUtils.cloneValue(value));
            }
        }

        for (CompiledMapping mapping : mappings) {
            String target = mapping.mapping().targetField();
            try {
                IonValue evaluated = mapping.expression().evaluate(input);
                if (IonValueUtils.isNull(evaluated)) {
                    if (!mapping.mapping().optional()) {
                        throw new EvaluationException("Missing required field: " + target);
                    }
                    output.put(target, IonValueUtils.nullValue());
                    continue;
                }
                IonValue casted = caster.cast(evaluated, mapping.type());
                output.put(target, casted.getContainer() == null && !casted.isReadOnly() ? casted : IonValueUtils.cloneValue(casted));
            } catch (ExpressionException | CastException e) {
                throw new EvaluationException("Field '" + target + "': " + e.getMessage(), e);
            }
        }

        output.makeReadOnly();
        return output;
    }

    private record CompiledMapping(FieldMapping mapping, CompiledExpression expression, ColumnType type) {
    }
}
