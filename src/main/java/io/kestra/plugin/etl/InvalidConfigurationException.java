package io.kestra.plugin.etl;

/**
 * Raised before anything executes when a partition size, a concurrency level or a
 * configuration document is not usable.
 */
public class InvalidConfigurationException extends EtlException {
    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
