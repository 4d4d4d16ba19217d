package io.kestra.plugin.etl.graph;

import io.kestra.plugin.etl.schema.Schema;

/**
 * One stage of an operation graph. Nodes describe a transformation and the schema it
 * produces; they never hold records.
 */
public interface OperationNode {
    /** The node this one reads from, {@code null} for a source. */
    OperationNode upstream();

    Schema outputSchema();

    String description();
}
