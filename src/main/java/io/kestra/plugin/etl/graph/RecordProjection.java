package io.kestra.plugin.etl.graph;

import java.util.Map;

/**
 * Java projection for a map stage. The returned values are converted to Ion and conformed
 * to the stage's declared output schema.
 */
@FunctionalInterface
public interface RecordProjection {
    Map<String, Object> apply(Row row) throws Exception;
}
