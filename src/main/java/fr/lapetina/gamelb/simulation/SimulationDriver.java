package fr.lapetina.gamelb.simulation;

import fr.lapetina.gamelb.dispatch.RequestDispatcher;
import fr.lapetina.gamelb.dispatch.Sleeper;
import fr.lapetina.gamelb.disruptor.DispatchWorkerPool;
import fr.lapetina.gamelb.domain.exception.ConfigurationException;
import fr.lapetina.gamelb.domain.exception.SinkWriteException;
import fr.lapetina.gamelb.domain.model.PlayerRequest;
import fr.lapetina.gamelb.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.gamelb.infrastructure.metrics.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Generates player requests and dispatches them with bounded concurrency.
 *
 * <p>State machine: {@code IDLE -> RUNNING -> DRAINING -> COMPLETED}. The driver moves to
 * {@code DRAINING} once every request has been handed to the worker pool (or given up on
 * after a timeout or abort) and to {@code COMPLETED} once every request is accounted for
 * and the metrics sink has been flushed. Each request is attempted at most once; failed
 * dispatches are not retried.
 *
 * <p>A driver runs once. Create a new one for another simulation.
 */
public final class SimulationDriver {

    private static final Logger log = LoggerFactory.getLogger(SimulationDriver.class);

    private final RequestDispatcher dispatcher;
    private final MetricsSink metricsSink;
    private final MetricsRegistry metricsRegistry;
    private final AtomicReference<SimulationState> state = new AtomicReference<>(SimulationState.IDLE);

    private final int defaultNumPlayers;
    private final int defaultConcurrencyLimit;
    private final Duration timeout;
    private final Duration arrivalInterval;
    private final Sleeper arrivalSleeper;
    private final int ringBufferSize;
    private final String waitStrategy;

    private SimulationDriver(Builder builder) {
        this.dispatcher = builder.dispatcher;
        this.metricsSink = dispatcher.getMetricsSink();
        this.metricsRegistry = dispatcher.getMetricsRegistry();
        this.defaultNumPlayers = builder.numPlayers;
        this.defaultConcurrencyLimit = builder.concurrencyLimit;
        this.timeout = builder.timeout;
        this.arrivalInterval = builder.arrivalInterval;
        this.arrivalSleeper = builder.arrivalSleeper;
        this.ringBufferSize = builder.ringBufferSize;
        this.waitStrategy = builder.waitStrategy;
    }

    /**
     * Runs with the configured player count and concurrency limit.
     */
    public SimulationSummary run() {
        int limit = defaultConcurrencyLimit > 0 ? defaultConcurrencyLimit : Math.max(1, defaultNumPlayers);
        return run(defaultNumPlayers, limit);
    }

    /**
     * Dispatches {@code numPlayers} requests with at most {@code concurrencyLimit} in flight,
     * waits for all of them, then flushes the metrics sink.
     *
     * @throws ConfigurationException if the arguments are invalid; nothing is dispatched
     * @throws IllegalStateException  if this driver has already run
     */
    public SimulationSummary run(int numPlayers, int concurrencyLimit) {
        validate(numPlayers, concurrencyLimit);
        if (!state.compareAndSet(SimulationState.IDLE, SimulationState.RUNNING)) {
            throw new IllegalStateException("Simulation already started, state=" + state.get());
        }

        long startNanos = System.nanoTime();
        log.info("Starting simulation: players={}, concurrencyLimit={}, servers={}, timeout={}",
                numPlayers, concurrencyLimit, dispatcher.getServerPool().size(),
                timeout.isZero() ? "none" : timeout);

        SimulationRun run = new SimulationRun(numPlayers, timeout);
        if (numPlayers > 0) {
            dispatchAll(run, numPlayers, concurrencyLimit);
        } else {
            transition(SimulationState.RUNNING, SimulationState.DRAINING);
        }

        try {
            metricsSink.flush();
        } catch (SinkWriteException e) {
            run.abort("Metrics flush failed: " + e.getMessage());
            log.error("Failed to flush metrics sink", e);
        }

        transition(SimulationState.DRAINING, SimulationState.COMPLETED);
        SimulationSummary summary = run.toSummary(Duration.ofNanos(System.nanoTime() - startNanos));
        log.info("Simulation completed: outcome={}, dispatched={}, failed={}, notIssued={}, wallTime={}ms",
                summary.outcome(), summary.dispatched(), summary.failed(), summary.notIssued(),
                summary.wallTime().toMillis());
        return summary;
    }

    private void dispatchAll(SimulationRun run, int numPlayers, int concurrencyLimit) {
        DispatchWorkerPool pool = DispatchWorkerPool.builder()
                .workers(concurrencyLimit)
                .ringBufferSize(ringBufferSize)
                .waitStrategy(waitStrategy)
                .dispatcher(dispatcher)
                .metricsRegistry(metricsRegistry)
                .run(run)
                .build();
        pool.start();
        try {
            publishAll(run, pool, numPlayers);
            transition(SimulationState.RUNNING, SimulationState.DRAINING);
            run.awaitResolution();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.abort("Driver interrupted");
            log.warn("Simulation interrupted while waiting for {} unresolved requests", run.getUnresolved());
            state.compareAndSet(SimulationState.RUNNING, SimulationState.DRAINING);
        } finally {
            pool.close();
        }
    }

    private void publishAll(SimulationRun run, DispatchWorkerPool pool, int numPlayers) throws InterruptedException {
        for (int player = 1; player <= numPlayers; player++) {
            if (player > 1 && !arrivalInterval.isZero()) {
                arrivalSleeper.sleep(arrivalInterval);
            }
            if (!run.mayIssue()) {
                int remaining = numPlayers - player + 1;
                run.recordNotIssued(remaining);
                metricsRegistry.recordNotIssued(remaining);
                log.warn("Stopped issuing requests ({}): {} of {} requests not issued",
                        run.isAborted() ? "aborted" : "timed out", remaining, numPlayers);
                return;
            }
            pool.publish(PlayerRequest.forPlayer(player));
        }
        log.debug("All {} requests published", numPlayers);
    }

    private void validate(int numPlayers, int concurrencyLimit) {
        if (numPlayers < 0) {
            throw new ConfigurationException("Number of players must not be negative, got " + numPlayers);
        }
        if (concurrencyLimit < 1) {
            throw new ConfigurationException("Concurrency limit must be positive, got " + concurrencyLimit);
        }
        if (numPlayers > 0 && concurrencyLimit > numPlayers) {
            throw new ConfigurationException("Concurrency limit (" + concurrencyLimit
                    + ") exceeds number of players (" + numPlayers + ")");
        }
    }

    private void transition(SimulationState from, SimulationState to) {
        if (state.compareAndSet(from, to)) {
            log.debug("Simulation state: {} -> {}", from, to);
        }
    }

    public SimulationState getState() {
        return state.get();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for SimulationDriver.
     */
    public static final class Builder {
        private RequestDispatcher dispatcher;
        private int numPlayers = 20;
        private int concurrencyLimit = 0;
        private Duration timeout = Duration.ZERO;
        private Duration arrivalInterval = Duration.ZERO;
        private Sleeper arrivalSleeper = Sleeper.THREAD_SLEEP;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public Builder dispatcher(RequestDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder numPlayers(int numPlayers) {
            this.numPlayers = numPlayers;
            return this;
        }

        /**
         * Maximum dispatches in flight; 0 means one per player.
         */
        public Builder concurrencyLimit(int concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
            return this;
        }

        /**
         * Overall issuance timeout; zero disables it.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout != null ? timeout : Duration.ZERO;
            return this;
        }

        /**
         * Real time between two consecutive player requests.
         */
        public Builder arrivalInterval(Duration arrivalInterval) {
            this.arrivalInterval = arrivalInterval != null ? arrivalInterval : Duration.ZERO;
            return this;
        }

        public Builder arrivalSleeper(Sleeper arrivalSleeper) {
            this.arrivalSleeper = arrivalSleeper;
            return this;
        }

        public Builder ringBufferSize(int ringBufferSize) {
            this.ringBufferSize = ringBufferSize;
            return this;
        }

        public Builder waitStrategy(String waitStrategy) {
            this.waitStrategy = waitStrategy;
            return this;
        }

        public SimulationDriver build() {
            if (dispatcher == null) {
                throw new IllegalStateException("RequestDispatcher is required");
            }
            if (arrivalSleeper == null) {
                throw new IllegalStateException("Arrival sleeper is required");
            }
            if (timeout.isNegative() || arrivalInterval.isNegative()) {
                throw new ConfigurationException("Timeout and arrival interval must not be negative");
            }
            return new SimulationDriver(this);
        }
    }
}
