package io.kestra.plugin.etl;

import com.amazon.ion.IonStruct;

/**
 * A data-dependent failure for one record: a predicate or projection threw, produced a
 * value of the wrong type, or the record does not conform to the schema.
 * <p>
 * Stages throw it without context; the partition executor rethrows it attributed to a
 * partition, a record ordinal and the offending record.
 */
public class EvaluationException extends EtlException {
    private final int partitionIndex;
    private final long recordOrdinal;
    private final String stage;
    private final String record;

    public EvaluationException(String message) {
        this(message, null);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
        this.partitionIndex = -1;
        this.recordOrdinal = -1L;
        this.stage = null;
        this.record = null;
    }

    public EvaluationException(int partitionIndex, long recordOrdinal, String stage, IonStruct record, Throwable cause) {
        super(describe(partitionIndex, recordOrdinal, stage, record, cause), cause);
        this.partitionIndex = partitionIndex;
        this.recordOrdinal = recordOrdinal;
        this.stage = stage;
        this.record = record == null ? null : record.toString();
    }

    public int getPartitionIndex() {
        return partitionIndex;
    }

    public long getRecordOrdinal() {
        return recordOrdinal;
    }

    public String getStage() {
        return stage;
    }

    public String getRecord() {
        return record;
    }

    private static String describe(int partitionIndex, long recordOrdinal, String stage, IonStruct record, Throwable cause) {
        String reason = cause == null || cause.getMessage() == null
            ? (cause == null ? "unknown error" : cause.getClass().getSimpleName())
            : cause.getMessage();
        return stage + " failed on record #" + recordOrdinal + " of partition " + partitionIndex
            + " " + record + ": " + reason;
    }
}
