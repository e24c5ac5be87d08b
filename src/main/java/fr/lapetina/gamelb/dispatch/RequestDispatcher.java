package fr.lapetina.gamelb.dispatch;

import fr.lapetina.gamelb.domain.delay.DelayDistribution;
import fr.lapetina.gamelb.domain.exception.ConfigurationException;
import fr.lapetina.gamelb.domain.exception.DispatchException;
import fr.lapetina.gamelb.domain.exception.SinkWriteException;
import fr.lapetina.gamelb.domain.model.ErrorType;
import fr.lapetina.gamelb.domain.model.GameServer;
import fr.lapetina.gamelb.domain.model.MetricsRecord;
import fr.lapetina.gamelb.domain.model.ServerPool;
import fr.lapetina.gamelb.domain.strategy.ServerSelector;
import fr.lapetina.gamelb.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.gamelb.infrastructure.metrics.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Routes one player request to a server and simulates its processing.
 *
 * A dispatch selects a server, waits for a sampled processing delay, then commits
 * the result: the metrics record is appended to the sink and the server counters are
 * updated. Nothing shared is modified before the commit, so a dispatch that fails
 * earlier leaves no trace. The delay runs outside every lock, which lets concurrent
 * dispatches overlap.
 *
 * Thread-safe: one instance serves all dispatch workers.
 */
public final class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    /**
     * Logger carrying one line per completed dispatch, routed to the server log file.
     * Kept outside every class package so no class logger inherits its appender.
     */
    public static final String DISPATCH_LOGGER = "gamelb.dispatch-log";

    private static final Logger dispatchLog = LoggerFactory.getLogger(DISPATCH_LOGGER);

    private final ServerPool serverPool;
    private final ServerSelector selector;
    private final DelayDistribution delayDistribution;
    private final MetricsSink metricsSink;
    private final MetricsRegistry metricsRegistry;
    private final Sleeper sleeper;
    private final Duration timeScale;

    private RequestDispatcher(Builder builder) {
        this.serverPool = builder.serverPool;
        this.selector = builder.selector;
        this.delayDistribution = builder.delayDistribution;
        this.metricsSink = builder.metricsSink;
        this.metricsRegistry = builder.metricsRegistry;
        this.sleeper = builder.sleeper;
        this.timeScale = builder.timeScale;

        log.info("RequestDispatcher created: selector={}, delay={}, timeScale={}ms per simulated second",
                selector.getName(), delayDistribution.describe(), timeScale.toMillis());
    }

    /**
     * Dispatches one player request.
     *
     * @param playerId the player issuing the request
     * @return the committed metrics record
     * @throws DispatchException  if the request could not be routed or processed; no
     *                            counter was updated and no record was appended
     * @throws SinkWriteException if the record could not be appended; no counter was updated
     */
    public MetricsRecord dispatch(String playerId) {
        Objects.requireNonNull(playerId, "Player ID is required");
        Instant startedAt = Instant.now();

        int index = selectIndex(playerId);
        GameServer server = serverPool.get(index).orElseThrow(() ->
                new DispatchException(playerId, ErrorType.INVALID_SERVER_INDEX,
                        "selector returned index " + index + " outside pool of " + serverPool.size()));

        MDC.put("playerId", playerId);
        MDC.put("serverId", server.getId());
        try {
            log.debug("Player routed: playerId={}, serverId={}", playerId, server.getId());

            double responseTime = sampleDelay(playerId);
            simulateProcessing(playerId, responseTime);

            MetricsRecord record = new MetricsRecord(
                    playerId, server.getId(), index, startedAt, Instant.now(), responseTime);

            // Commit: sink first, so a rejected append leaves the counters untouched
            metricsSink.append(record);
            serverPool.recordCompletion(index, responseTime);

            metricsRegistry.recordDispatch(server.getId(), responseTime);
            dispatchLog.info("{} player={} server={} response_time={}",
                    record.timestamp(), playerId, server.getId(),
                    String.format(Locale.ROOT, "%.3f", responseTime));
            return record;
        } finally {
            MDC.remove("playerId");
            MDC.remove("serverId");
        }
    }

    private int selectIndex(String playerId) {
        try {
            return selector.selectNext();
        } catch (RuntimeException e) {
            throw new DispatchException(playerId, ErrorType.SELECTION_ERROR,
                    "selector " + selector.getName() + " failed", e);
        }
    }

    private double sampleDelay(String playerId) {
        double delay;
        try {
            delay = delayDistribution.sample();
        } catch (RuntimeException e) {
            throw new DispatchException(playerId, ErrorType.DELAY_SAMPLING_ERROR,
                    "delay sampling failed for " + delayDistribution.describe(), e);
        }
        if (!Double.isFinite(delay) || delay < 0) {
            throw new DispatchException(playerId, ErrorType.INVALID_DELAY,
                    "invalid processing delay " + delay,
                    new ConfigurationException("Delay distribution " + delayDistribution.describe()
                            + " produced " + delay));
        }
        return delay;
    }

    private void simulateProcessing(String playerId, double simulatedSeconds) {
        Duration wait = Duration.ofNanos(Math.round(simulatedSeconds * timeScale.toNanos()));
        metricsRegistry.dispatchStarted();
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException(playerId, ErrorType.INTERRUPTED,
                    "interrupted during simulated processing", e);
        } finally {
            metricsRegistry.dispatchFinished();
        }
    }

    public ServerPool getServerPool() {
        return serverPool;
    }

    public MetricsSink getMetricsSink() {
        return metricsSink;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for RequestDispatcher.
     */
    public static final class Builder {
        private ServerPool serverPool;
        private ServerSelector selector;
        private DelayDistribution delayDistribution;
        private MetricsSink metricsSink;
        private MetricsRegistry metricsRegistry;
        private Sleeper sleeper = Sleeper.THREAD_SLEEP;
        private Duration timeScale = Duration.ofSeconds(1);

        public Builder serverPool(ServerPool serverPool) {
            this.serverPool = serverPool;
            return this;
        }

        public Builder selector(ServerSelector selector) {
            this.selector = selector;
            return this;
        }

        public Builder delayDistribution(DelayDistribution delayDistribution) {
            this.delayDistribution = delayDistribution;
            return this;
        }

        public Builder metricsSink(MetricsSink metricsSink) {
            this.metricsSink = metricsSink;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /**
         * Real time that stands for one simulated second.
         */
        public Builder timeScale(Duration timeScale) {
            if (timeScale == null || timeScale.isNegative()) {
                throw new ConfigurationException("Time scale must not be negative: " + timeScale);
            }
            this.timeScale = timeScale;
            return this;
        }

        public RequestDispatcher build() {
            if (serverPool == null) {
                throw new IllegalStateException("ServerPool is required");
            }
            if (selector == null) {
                throw new IllegalStateException("ServerSelector is required");
            }
            if (delayDistribution == null) {
                throw new IllegalStateException("DelayDistribution is required");
            }
            if (metricsSink == null) {
                throw new IllegalStateException("MetricsSink is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (sleeper == null) {
                throw new IllegalStateException("Sleeper is required");
            }
            return new RequestDispatcher(this);
        }
    }
}
