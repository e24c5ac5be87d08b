package fr.lapetina.gamelb.domain.exception;

/**
 * Exception thrown when a metrics record or an export cannot be written.
 *
 * Once raised the integrity of the collected metrics can no longer be guaranteed,
 * so the simulation stops issuing requests. Records appended before the failure
 * remain valid.
 */
public final class SinkWriteException extends RuntimeException {

    public SinkWriteException(String message) {
        super(message);
    }

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
