package fr.lapetina.gamelb.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Observable outcome of one completed dispatch.
 * Immutable and thread-safe; created once and never modified.
 *
 * @param responseTime simulated processing time in seconds
 */
public record MetricsRecord(
        String playerId,
        String serverId,
        int serverIndex,
        Instant startedAt,
        Instant completedAt,
        double responseTime
) {
    public MetricsRecord {
        Objects.requireNonNull(playerId, "Player ID is required");
        Objects.requireNonNull(serverId, "Server ID is required");
        Objects.requireNonNull(startedAt, "Start time is required");
        Objects.requireNonNull(completedAt, "Completion time is required");
    }

    /**
     * Completion timestamp of the dispatch.
     */
    public Instant timestamp() {
        return completedAt;
    }
}
