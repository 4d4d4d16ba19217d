package io.kestra.plugin.etl;

public class EtlException extends Exception {
    public EtlException(String message) {
        super(message);
    }

    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
