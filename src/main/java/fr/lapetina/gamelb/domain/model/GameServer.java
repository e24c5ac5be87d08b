package fr.lapetina.gamelb.domain.model;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Represents a game server in the pool.
 * Thread-safe for concurrent completions from multiple dispatch workers.
 */
public final class GameServer {
    private final int index;
    private final String id;

    // Swapped as a whole so requestsServed and totalResponseTime never tear
    private final AtomicReference<ServerLoad> load = new AtomicReference<>(ServerLoad.EMPTY);

    public GameServer(int index, String id) {
        this.index = index;
        this.id = Objects.requireNonNull(id, "Server ID is required");
    }

    public int getIndex() {
        return index;
    }

    public String getId() {
        return id;
    }

    public ServerLoad getLoad() {
        return load.get();
    }

    public long getRequestsServed() {
        return load.get().requestsServed();
    }

    public double getTotalResponseTime() {
        return load.get().totalResponseTime();
    }

    /**
     * Records one completed request.
     *
     * @return the load including this completion
     */
    public ServerLoad recordCompletion(double responseTime) {
        return load.updateAndGet(current -> current.plus(responseTime));
    }

    public ServerStats toStats() {
        ServerLoad current = load.get();
        return new ServerStats(index, id, current.requestsServed(), current.totalResponseTime());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GameServer that = (GameServer) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        ServerLoad current = load.get();
        return "GameServer{" +
                "index=" + index +
                ", id='" + id + '\'' +
                ", requestsServed=" + current.requestsServed() +
                ", totalResponseTime=" + current.totalResponseTime() +
                '}';
    }
}
