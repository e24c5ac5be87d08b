package fr.lapetina.gamelb.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A logical player connection request.
 * Immutable and thread-safe.
 */
public record PlayerRequest(
        String playerId,
        long sequence,
        Instant submittedAt
) {
    public PlayerRequest {
        Objects.requireNonNull(playerId, "Player ID is required");
        if (submittedAt == null) {
            submittedAt = Instant.now();
        }
    }

    /**
     * Creates the request for the n-th player, numbered from 1.
     */
    public static PlayerRequest forPlayer(long number) {
        return new PlayerRequest(String.valueOf(number), number, Instant.now());
    }
}
