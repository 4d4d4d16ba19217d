package io.kestra.plugin.etl.graph;

import com.amazon.ion.IonStruct;
import io.kestra.plugin.etl.EvaluationException;
import io.kestra.plugin.etl.engine.RecordTransformer;
import io.kestra.plugin.etl.schema.Schema;

/**
 * Projects every record through a {@link RecordTransformer} into the node's output schema.
 */
public final class MapNode implements OperationNode {
    private final OperationNode upstream;
    private final String description;
    private final RecordTransformer transformer;
    private final Schema outputSchema;

    MapNode(OperationNode upstream, String description, RecordTransformer transformer, Schema outputSchema) {
        this.upstream = upstream;
        this.description = description;
        this.transformer = transformer;
        this.outputSchema = outputSchema;
    }

    public IonStruct apply(IonStruct record) throws EvaluationException {
        return transformer.transform(record);
    }

    @Override
    public OperationNode upstream() {
        return upstream;
    }

    @Override
    public Schema outputSchema() {
        return outputSchema;
    }

    @Override
    public String description() {
        return description;
    }
}
