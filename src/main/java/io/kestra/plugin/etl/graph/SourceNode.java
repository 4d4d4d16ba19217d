package io.kestra.plugin.etl.graph;

import io.kestra.plugin.etl.schema.Schema;

public final class SourceNode implements OperationNode {
    private final Schema schema;

    SourceNode(Schema schema) {
        this.schema = schema;
    }

    @Override
    public OperationNode upstream() {
        return null;
    }

    @Override
    public Schema outputSchema() {
        return schema;
    }

    @Override
    public String description() {
        return "source" + schema;
    }
}
