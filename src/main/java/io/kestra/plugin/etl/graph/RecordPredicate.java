package io.kestra.plugin.etl.graph;

@FunctionalInterface
public interface RecordPredicate {
    boolean test(Row row) throws Exception;
}
