package fr.lapetina.gamelb.domain.event;

import fr.lapetina.gamelb.domain.model.ErrorType;
import fr.lapetina.gamelb.domain.model.PlayerRequest;

import java.time.Duration;
import java.time.Instant;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer.
 * It should never be accessed outside the dispatch workers.
 */
public final class PlayerRequestEvent {

    private PlayerRequest request;
    private EventState state;
    private ErrorType errorType;
    private Instant issuedAt;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.request = null;
        this.state = null;
        this.errorType = null;
        this.issuedAt = null;
    }

    /**
     * Initializes the event with a new request.
     */
    public void initialize(PlayerRequest request) {
        clear();
        this.request = request;
        this.state = EventState.PENDING;
    }

    public PlayerRequest getRequest() {
        return request;
    }

    public EventState getState() {
        return state;
    }

    public void setState(EventState state) {
        this.state = state;
        if (state == EventState.ISSUED) {
            this.issuedAt = Instant.now();
        }
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public void fail(ErrorType errorType) {
        this.state = EventState.FAILED;
        this.errorType = errorType;
    }

    /**
     * Time the request spent in the ring buffer before a worker issued it.
     */
    public Duration queueWait() {
        if (request == null || issuedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(request.submittedAt(), issuedAt);
    }

    @Override
    public String toString() {
        return "PlayerRequestEvent{" +
                "playerId=" + (request != null ? request.playerId() : null) +
                ", state=" + state +
                ", errorType=" + errorType +
                '}';
    }
}
