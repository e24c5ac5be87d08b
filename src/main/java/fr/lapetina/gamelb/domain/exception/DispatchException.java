package fr.lapetina.gamelb.domain.exception;

import fr.lapetina.gamelb.domain.model.ErrorType;

/**
 * Exception raised when a single player request cannot be dispatched.
 *
 * The failing request leaves no trace in the server counters or the metrics sink;
 * the simulation records the failure and carries on with the remaining requests.
 */
public final class DispatchException extends RuntimeException {

    private final String playerId;
    private final ErrorType errorType;

    public DispatchException(String playerId, ErrorType errorType, String message) {
        super("Dispatch failed for player " + playerId + ": " + message);
        this.playerId = playerId;
        this.errorType = errorType;
    }

    public DispatchException(String playerId, ErrorType errorType, String message, Throwable cause) {
        super("Dispatch failed for player " + playerId + ": " + message, cause);
        this.playerId = playerId;
        this.errorType = errorType;
    }

    public String getPlayerId() {
        return playerId;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
