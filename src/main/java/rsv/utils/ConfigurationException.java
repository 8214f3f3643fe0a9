package rsv.utils;

/**
 * Missing or invalid configuration: absent keys, malformed values, unknown endpoint, preset,
 * filter or component names.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
