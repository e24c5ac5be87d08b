package fr.lapetina.gamelb.domain.model;

/**
 * Point-in-time view of one server's counters, used for reporting.
 */
public record ServerStats(
        int index,
        String serverId,
        long requestsServed,
        double totalResponseTime
) {
    public double averageResponseTime() {
        return requestsServed > 0 ? totalResponseTime / requestsServed : 0.0;
    }
}
