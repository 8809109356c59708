package skytiles.acquisition.config;

/**
 * Invalid flags, environment or paths. Fatal at startup: the daemon does not start.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
