package io.kestra.plugin.etl;

/**
 * Raised while a graph is being built, when a stage references a column the upstream
 * schema does not have or when a stage is statically ill-typed.
 */
public class SchemaException extends EtlException {
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
