package io.kestra.plugin.etl.engine;

import com.amazon.ion.IonStruct;
import io.kestra.plugin.etl.ion.IonValueUtils;
import io.kestra.plugin.etl.schema.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Final result of a run: the output records in order, and for an aggregating pipeline the
 * same records keyed by group.
 */
public final class PipelineOutput {
    private final Schema schema;
    private final List<IonStruct> records;
    private final Map<GroupKey, IonStruct> groups;

    private PipelineOutput(Schema schema, List<IonStruct> records, Map<GroupKey, IonStruct> groups) {
        this.schema = schema;
        this.records = records;
        this.groups = groups;
    }

    public static PipelineOutput ofRecords(Schema schema, List<IonStruct> records) {
        return new PipelineOutput(schema, Collections.unmodifiableList(new ArrayList<>(records)), null);
    }

    public static PipelineOutput ofGroups(Schema schema, Map<GroupKey, IonStruct> groups) {
        Map<GroupKey, IonStruct> ordered = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
        return new PipelineOutput(schema, List.copyOf(ordered.values()), ordered);
    }

    public Schema schema() {
        return schema;
    }

    public boolean isGrouped() {
        return groups != null;
    }

    public List<IonStruct> records() {
        return records;
    }

    /**
     * @throws IllegalStateException when the pipeline does not aggregate
     */
    public Map<GroupKey, IonStruct> groups() {
        if (groups == null) {
            throw new IllegalStateException("Output is not grouped");
        }
        return groups;
    }

    public int size() {
        return records.size();
    }

    public List<Map<String, Object>> toJavaRecords() {
        List<Map<String, Object>> javaRecords = new ArrayList<>(records.size());
        for (IonStruct record : records) {
            javaRecords.add((Map<String, Object>) IonValueUtils.toJavaValue(record));
        }
        return javaRecords;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PipelineOutput that)) {
            return false;
        }
        return isGrouped() == that.isGrouped()
            && Objects.equals(schema, that.schema)
            && toJavaRecords().equals(that.toJavaRecords());
    }

    @Override
    public int hashCode() {
        return Objects.hash(isGrouped(), schema, toJavaRecords());
    }

    @Override
    public String toString() {
        return (isGrouped() ? "grouped" : "records") + records;
    }
}
