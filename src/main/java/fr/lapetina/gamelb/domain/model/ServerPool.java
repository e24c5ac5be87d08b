package fr.lapetina.gamelb.domain.model;

import fr.lapetina.gamelb.domain.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed, ordered pool of game servers.
 *
 * The pool size is set at construction and never changes. Counter updates go
 * through {@link GameServer#recordCompletion(double)}, which is lock-free and
 * never loses an update.
 */
public final class ServerPool {

    private static final Logger log = LoggerFactory.getLogger(ServerPool.class);

    public static final String DEFAULT_NAME_PREFIX = "Game_Server_";

    private final List<GameServer> servers;

    public ServerPool(List<String> serverIds) {
        if (serverIds == null || serverIds.isEmpty()) {
            throw new ConfigurationException("Server pool must contain at least one server");
        }
        Set<String> seen = new HashSet<>();
        List<GameServer> created = new ArrayList<>(serverIds.size());
        for (String id : serverIds) {
            if (id == null || id.isBlank()) {
                throw new ConfigurationException("Server ID must not be blank");
            }
            if (!seen.add(id)) {
                throw new ConfigurationException("Duplicate server ID: " + id);
            }
            created.add(new GameServer(created.size(), id));
        }
        this.servers = List.copyOf(created);
        log.info("Server pool created with {} servers: {}", servers.size(), serverIds);
    }

    /**
     * Creates a pool of {@code count} servers named {@code <prefix>1 .. <prefix>count}.
     */
    public static ServerPool of(int count, String namePrefix) {
        if (count <= 0) {
            throw new ConfigurationException("Server count must be positive, got " + count);
        }
        String prefix = namePrefix != null ? namePrefix : DEFAULT_NAME_PREFIX;
        List<String> ids = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            ids.add(prefix + i);
        }
        return new ServerPool(ids);
    }

    public static ServerPool of(int count) {
        return of(count, DEFAULT_NAME_PREFIX);
    }

    public int size() {
        return servers.size();
    }

    /**
     * Gets a server by index, or empty if the index is outside {@code [0, size)}.
     */
    public Optional<GameServer> get(int index) {
        if (index < 0 || index >= servers.size()) {
            return Optional.empty();
        }
        return Optional.of(servers.get(index));
    }

    public List<GameServer> getServers() {
        return servers;
    }

    /**
     * Adds one completed request and its response time to a server.
     *
     * @throws IllegalArgumentException for an unknown index or an invalid response time;
     *                                  no counter is touched in that case
     */
    public void recordCompletion(int serverIndex, double responseTime) {
        if (!Double.isFinite(responseTime) || responseTime < 0) {
            throw new IllegalArgumentException("Invalid response time: " + responseTime);
        }
        GameServer server = get(serverIndex).orElseThrow(() ->
                new IllegalArgumentException("No server at index " + serverIndex + " (pool size " + size() + ")"));
        ServerLoad updated = server.recordCompletion(responseTime);
        log.debug("Completion recorded: serverId={}, requestsServed={}, totalResponseTime={}",
                server.getId(), updated.requestsServed(), updated.totalResponseTime());
    }

    /**
     * Returns the counters of every server in pool order. Each entry is consistent
     * on its own; the list as a whole is not an atomic cut across servers.
     */
    public List<ServerStats> snapshot() {
        return servers.stream()
                .map(GameServer::toStats)
                .toList();
    }

    public long totalRequestsServed() {
        return servers.stream()
                .mapToLong(GameServer::getRequestsServed)
                .sum();
    }
}
