package fr.lapetina.rpcpool.exception;

/**
 * Exception for configuration errors.
 *
 * Thrown synchronously at construction or load time, before any network activity:
 * empty endpoint list, unknown strategy type, unreadable or invalid configuration file.
 */
public final class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
