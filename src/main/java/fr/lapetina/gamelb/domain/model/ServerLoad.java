package fr.lapetina.gamelb.domain.model;

/**
 * Counter pair of a game server. Immutable, so both values always come from the
 * same update.
 */
public record ServerLoad(long requestsServed, double totalResponseTime) {

    public static final ServerLoad EMPTY = new ServerLoad(0, 0.0);

    /**
     * Returns the load after one more completed request.
     */
    public ServerLoad plus(double responseTime) {
        return new ServerLoad(requestsServed + 1, totalResponseTime + responseTime);
    }

    public double averageResponseTime() {
        return requestsServed > 0 ? totalResponseTime / requestsServed : 0.0;
    }
}
