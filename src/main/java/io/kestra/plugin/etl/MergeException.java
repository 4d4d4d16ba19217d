package io.kestra.plugin.etl;

public class MergeException extends EtlException {
    public MergeException(String message) {
        super(message);
    }
}
