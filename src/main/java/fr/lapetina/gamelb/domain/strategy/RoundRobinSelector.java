package fr.lapetina.gamelb.domain.strategy;

import fr.lapetina.gamelb.domain.exception.ConfigurationException;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin server selection over a fixed pool.
 *
 * The cursor always holds the next index to hand out and stays within
 * {@code [0, poolSize)}. Each call advances it exactly once with a single atomic
 * update, so concurrent callers never share an index and no index is skipped.
 */
public final class RoundRobinSelector implements ServerSelector {

    private final int poolSize;
    private final AtomicInteger cursor = new AtomicInteger(0);

    public RoundRobinSelector(int poolSize) {
        if (poolSize <= 0) {
            throw new ConfigurationException("Round-robin selection needs a positive pool size, got " + poolSize);
        }
        this.poolSize = poolSize;
    }

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public int selectNext() {
        return cursor.getAndUpdate(current -> (current + 1) % poolSize);
    }

    /**
     * Index the next call will return.
     */
    public int peekNext() {
        return cursor.get();
    }

    public int getPoolSize() {
        return poolSize;
    }

    @Override
    public void reset() {
        cursor.set(0);
    }
}
