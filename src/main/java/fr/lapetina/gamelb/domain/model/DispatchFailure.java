package fr.lapetina.gamelb.domain.model;

/**
 * A player request that was attempted and failed.
 */
public record DispatchFailure(String playerId, ErrorType errorType, String message) {
}
