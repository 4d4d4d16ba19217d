package io.kestra.plugin.etl.engine;

import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.kestra.plugin.etl.EvaluationException;
import io.kestra.plugin.etl.graph.RecordProjection;
import io.kestra.plugin.etl.graph.Row;
import io.kestra.plugin.etl.ion.CastException;
import io.kestra.plugin.etl.ion.IonCaster;
import io.kestra.plugin.etl.ion.IonValueUtils;
import io.kestra.plugin.etl.schema.Schema;

import java.util.Map;

/**
 * Runs a Java {@link RecordProjection} and conforms what it returns to the declared output
 * schema.
 */
public final class ProjectionTransformer implements RecordTransformer {
    private final RecordProjection projection;
    private final Schema inputSchema;
    private final Schema outputSchema;
    private final IonCaster caster;

    public ProjectionTransformer(RecordProjection projection, Schema inputSchema, Schema outputSchema, IonCaster caster) {
        this.projection = projection;
        this.inputSchema = inputSchema;
        this.outputSchema = outputSchema;
        this.caster = caster;
    }

    @Override
    public IonStruct transform(IonStruct input) throws EvaluationException {
        Map<String, Object> projected;
        try {
            projected = projection.apply(new Row(input, inputSchema));
        } catch (Exception e) {
            throw new EvaluationException(e.getMessage() == null ? e.getClass().getName() : e.getMessage(), e);
        }
        if (projected == null) {
            throw new EvaluationException("Projection returned no record");
        }
        IonValue converted = IonValueUtils.toIonValue(projected);
        try {
            return outputSchema.conform((IonStruct) converted, caster);
        } catch (CastException e) {
            throw new EvaluationException("Projection result does not match " + outputSchema + ": " + e.getMessage(), e);
        }
    }
}
