package fr.lapetina.gamelb.domain.exception;

/**
 * Thrown when the simulation is configured with values it cannot run with
 * (empty server pool, negative player count, invalid delay bounds, ...).
 *
 * Always raised before any dispatch is issued.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
