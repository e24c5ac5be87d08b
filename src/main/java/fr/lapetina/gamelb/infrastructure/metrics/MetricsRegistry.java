package fr.lapetina.gamelb.infrastructure.metrics;

import fr.lapetina.gamelb.domain.model.ErrorType;
import fr.lapetina.gamelb.domain.model.GameServer;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Completed dispatch counters and response time timers per server
 * - Failure counters by error type
 * - In-flight dispatch gauge
 * - Requests-served gauges per server
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> responseTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> dispatchCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorType, Counter> failureCounters = new ConcurrentHashMap<>();

    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final Counter notIssued;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        Gauge.builder(prefix + "_inflight_dispatches", inFlight, AtomicInteger::get)
                .description("Number of dispatches currently in their processing delay")
                .register(registry);

        this.notIssued = Counter.builder(prefix + "_requests_not_issued_total")
                .description("Player requests never issued because the run timed out or was aborted")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("game_lb");
    }

    /**
     * Records a completed dispatch and its simulated response time.
     */
    public void recordDispatch(String serverId, double responseTimeSeconds) {
        dispatchCounters.computeIfAbsent(serverId, k ->
                Counter.builder(prefix + "_dispatches_total")
                        .description("Total number of completed dispatches")
                        .tag("server", serverId)
                        .register(registry)
        ).increment();

        responseTimers.computeIfAbsent(serverId, k ->
                Timer.builder(prefix + "_response_time")
                        .description("Simulated response time per dispatch")
                        .tag("server", serverId)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(Duration.ofNanos(Math.round(responseTimeSeconds * 1_000_000_000L)));
    }

    /**
     * Increments the failure counter for an error type.
     */
    public void recordFailure(ErrorType errorType) {
        failureCounters.computeIfAbsent(errorType, k ->
                Counter.builder(prefix + "_dispatch_failures_total")
                        .description("Total number of failed dispatches")
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    public void recordNotIssued(int count) {
        notIssued.increment(count);
    }

    /**
     * Registers a gauge for the requests served by a server.
     */
    public void registerServer(GameServer server) {
        Gauge.builder(prefix + "_server_requests_served", server, GameServer::getRequestsServed)
                .description("Requests served per server")
                .tag("server", server.getId())
                .register(registry);
    }

    public void dispatchStarted() {
        inFlight.incrementAndGet();
    }

    public void dispatchFinished() {
        inFlight.decrementAndGet();
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
