package fr.lapetina.gamelb;

import fr.lapetina.gamelb.dispatch.RequestDispatcher;
import fr.lapetina.gamelb.dispatch.Sleeper;
import fr.lapetina.gamelb.domain.delay.DelayDistribution;
import fr.lapetina.gamelb.domain.delay.DelayDistributions;
import fr.lapetina.gamelb.domain.model.GameServer;
import fr.lapetina.gamelb.domain.model.ServerPool;
import fr.lapetina.gamelb.domain.strategy.RoundRobinSelector;
import fr.lapetina.gamelb.domain.strategy.ServerSelector;
import fr.lapetina.gamelb.infrastructure.config.ConfigLoader;
import fr.lapetina.gamelb.infrastructure.config.SimulationConfig;
import fr.lapetina.gamelb.infrastructure.export.CsvMetricsExporter;
import fr.lapetina.gamelb.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.gamelb.infrastructure.metrics.MetricsSink;
import fr.lapetina.gamelb.report.SimulationReport;
import fr.lapetina.gamelb.simulation.SimulationDriver;
import fr.lapetina.gamelb.simulation.SimulationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Factory for creating fully-wired simulation instances from configuration.
 * This is the primary entry point for obtaining a configured SimulationDriver.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SimulationFactory factory = SimulationFactory.create("simulation.yaml")) {
 *     SimulationSummary summary = factory.getDriver().run();
 *     SimulationReport report = factory.report(summary);
 * }
 * }</pre>
 *
 * <p>The factory owns the metrics sink and the metrics registry and closes both.
 */
public class SimulationFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SimulationFactory.class);

    private final SimulationConfig config;
    private final ServerPool serverPool;
    private final ServerSelector selector;
    private final MetricsRegistry metricsRegistry;
    private final MetricsSink metricsSink;
    private final RequestDispatcher dispatcher;
    private final SimulationDriver driver;

    protected SimulationFactory(SimulationConfig config, DelayDistribution delayOverride, Sleeper sleeperOverride) {
        this.config = config.validate();
        log.info("Initializing SimulationFactory: servers={}, players={}",
                config.getServers().getCount(), config.getSimulation().getNumPlayers());

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Fixed server pool and its selector
        this.serverPool = ServerPool.of(config.getServers().getCount(), config.getServers().getNamePrefix());
        this.selector = new RoundRobinSelector(serverPool.size());
        for (GameServer server : serverPool.getServers()) {
            metricsRegistry.registerServer(server);
        }

        // Metrics sink, exported to CSV on flush
        this.metricsSink = new MetricsSink(Duration.ofMillis(config.getSink().getAppendTimeoutMs()));
        Path csv = outputFile(config.getOutput().getMetricsCsv());
        if (csv != null) {
            metricsSink.addExporter(new CsvMetricsExporter(csv));
        }

        // Delay distribution (allow override for testing)
        SimulationConfig.ProcessingTimeConfig processing = config.getProcessingTime();
        DelayDistribution delay = delayOverride != null ? delayOverride : DelayDistributions.create(
                processing.getDistribution(), processing.getMin(), processing.getMax(), processing.getSeed());
        Sleeper sleeper = sleeperOverride != null ? sleeperOverride : Sleeper.THREAD_SLEEP;
        Duration timeScale = Duration.ofMillis(config.getSimulation().getTimeScaleMillis());

        this.dispatcher = RequestDispatcher.builder()
                .serverPool(serverPool)
                .selector(selector)
                .delayDistribution(delay)
                .metricsSink(metricsSink)
                .metricsRegistry(metricsRegistry)
                .sleeper(sleeper)
                .timeScale(timeScale)
                .build();

        SimulationConfig.RunConfig run = config.getSimulation();
        this.driver = SimulationDriver.builder()
                .dispatcher(dispatcher)
                .numPlayers(run.getNumPlayers())
                .concurrencyLimit(config.effectiveConcurrencyLimit())
                .timeout(Duration.ofMillis(run.getTimeoutMs()))
                .arrivalInterval(Duration.ofNanos(Math.round(run.getArrivalIntervalSeconds() * timeScale.toNanos())))
                .arrivalSleeper(sleeper)
                .ringBufferSize(config.getDisruptor().getRingBufferSize())
                .waitStrategy(config.getDisruptor().getWaitStrategy())
                .build();

        log.info("SimulationFactory initialized: selector={}, delay={}", selector.getName(), delay.describe());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static SimulationFactory create(String configPath) {
        return new SimulationFactory(new ConfigLoader(configPath).load(), null, null);
    }

    /**
     * Creates a factory from the default configuration (simulation.yaml).
     */
    public static SimulationFactory create() {
        return create("simulation.yaml");
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static SimulationFactory create(SimulationConfig config) {
        return new SimulationFactory(config, null, null);
    }

    /**
     * Runs the configured simulation.
     */
    public SimulationSummary run() {
        return driver.run();
    }

    /**
     * Builds the final statistics of a finished run.
     */
    public SimulationReport report(SimulationSummary summary) {
        return SimulationReport.of(summary, serverPool.snapshot(), metricsSink.drain());
    }

    /**
     * Resolves an output file name against the output directory, or null if disabled.
     */
    public Path outputFile(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return null;
        }
        return Paths.get(config.getOutput().getDirectory()).resolve(fileName);
    }

    public SimulationConfig getConfig() {
        return config;
    }

    public ServerPool getServerPool() {
        return serverPool;
    }

    public ServerSelector getSelector() {
        return selector;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public MetricsSink getMetricsSink() {
        return metricsSink;
    }

    public RequestDispatcher getDispatcher() {
        return dispatcher;
    }

    public SimulationDriver getDriver() {
        return driver;
    }

    @Override
    public void close() {
        log.info("Shutting down SimulationFactory...");

        try {
            metricsSink.close();
        } catch (Exception e) {
            log.warn("Error closing metrics sink", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("SimulationFactory shut down");
    }
}
