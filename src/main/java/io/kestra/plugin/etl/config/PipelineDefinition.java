package io.kestra.plugin.etl.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import io.kestra.plugin.etl.InvalidConfigurationException;
import io.kestra.plugin.etl.SchemaException;
import io.kestra.plugin.etl.graph.AggregateSpec;
import io.kestra.plugin.etl.graph.FieldMapping;
import io.kestra.plugin.etl.graph.OperationGraph;
import io.kestra.plugin.etl.ion.ColumnType;
import io.kestra.plugin.etl.schema.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declarative pipeline, bound from JSON or YAML and turned into an {@link OperationGraph}.
 *
 * <pre>{@code
 * schema:
 *   amount: FLOAT
 *   region: STRING
 * stages:
 *   - filter: amount > 0
 *   - map:
 *       region: upper(region)
 *       amount: { expr: "amount", type: DECIMAL }
 *   - groupBy: [region]
 *     aggregates:
 *       total: sum(amount)
 *       count: count()
 * }</pre>
 */
@Builder
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class PipelineDefinition {
    private Map<String, ColumnType> schema;

    @Builder.Default
    private List<StageDefinition> stages = new ArrayList<>();

    public static PipelineDefinition load(InputStream input) throws InvalidConfigurationException {
        return ConfigMapper.read(input, PipelineDefinition.class);
    }

    public OperationGraph toGraph() throws InvalidConfigurationException, SchemaException {
        if (schema == null || schema.isEmpty()) {
            throw new InvalidConfigurationException("Pipeline schema is required");
        }
        OperationGraph graph = OperationGraph.source(Schema.of(schema));
        List<StageDefinition> definitions = stages == null ? List.of() : stages;
        for (int i = 0; i < definitions.size(); i++) {
            graph = definitions.get(i).appendTo(graph, i);
        }
        return graph;
    }

    @Builder
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StageDefinition {
        private String filter;

        private Map<String, FieldDefinition> map;

        @Builder.Default
        private boolean keepOriginalFields = false;

        private List<String> groupBy;

        private Map<String, AggregateSpec> aggregates;

        OperationGraph appendTo(OperationGraph graph, int position) throws InvalidConfigurationException, SchemaException {
            int kinds = (filter != null ? 1 : 0) + (map != null ? 1 : 0) + (groupBy != null || aggregates != null ? 1 : 0);
            if (kinds != 1) {
                throw new InvalidConfigurationException("Stage " + position + " must declare exactly one of filter, map or groupBy");
            }
            if (filter != null) {
                return graph.filter(filter);
            }
            if (map != null) {
                List<FieldMapping> mappings = new ArrayList<>();
                for (Map.Entry<String, FieldDefinition> entry : map.entrySet()) {
                    FieldDefinition field = entry.getValue();
                    if (field == null || field.getExpr() == null) {
                        throw new InvalidConfigurationException("Stage " + position + ": expression is required for '" + entry.getKey() + "'");
                    }
                    mappings.add(new FieldMapping(entry.getKey(), field.getExpr(), field.getType(), field.isOptional()));
                }
                return graph.map(mappings, keepOriginalFields);
            }
            if (groupBy == null || aggregates == null) {
                throw new InvalidConfigurationException("Stage " + position + ": groupBy and aggregates go together");
            }
            return graph.groupAggregate(groupBy, aggregates);
        }
    }

    /**
     * A mapped field, written either as a bare expression or as
     * {@code {expr, type, optional}}.
     */
    @Builder
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldDefinition {
        private String expr;
        private ColumnType type;

        @Builder.Default
        private boolean optional = false;

        @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
        public static FieldDefinition from(Object value) {
            if (value == null) {
                return null;
            }
            if (value instanceof String stringValue) {
                return FieldDefinition.builder().expr(stringValue).build();
            }
            if (value instanceof Map<?, ?> map) {
                Object exprValue = map.get("expr");
                Object typeValue = map.get("type");
                Object optionalValue = map.get("optional");
                ColumnType type = null;
                if (typeValue instanceof ColumnType columnType) {
                    type = columnType;
                } else if (typeValue instanceof String typeString) {
                    type = ColumnType.valueOf(typeString.trim().toUpperCase(Locale.ROOT));
                }
                boolean optional = optionalValue instanceof Boolean bool ? bool : false;
                return FieldDefinition.builder()
                    .expr(exprValue == null ? null : String.valueOf(exprValue))
                    .type(type)
                    .optional(optional)
                    .build();
            }
            throw new IllegalArgumentException("Unsupported field definition: " + value);
        }
    }
}
