package fr.lapetina.gamelb.infrastructure.config;

import fr.lapetina.gamelb.domain.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the simulation.
 * Designed to be populated from YAML.
 */
public class SimulationConfig {

    private ServersConfig servers = new ServersConfig();
    private RunConfig simulation = new RunConfig();
    private ProcessingTimeConfig processingTime = new ProcessingTimeConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private SinkConfig sink = new SinkConfig();
    private OutputConfig output = new OutputConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServersConfig getServers() { return servers; }
    public void setServers(ServersConfig servers) { this.servers = servers; }

    public RunConfig getSimulation() { return simulation; }
    public void setSimulation(RunConfig simulation) { this.simulation = simulation; }

    public ProcessingTimeConfig getProcessingTime() { return processingTime; }
    public void setProcessingTime(ProcessingTimeConfig processingTime) { this.processingTime = processingTime; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public SinkConfig getSink() { return sink; }
    public void setSink(SinkConfig sink) { this.sink = sink; }

    public OutputConfig getOutput() { return output; }
    public void setOutput(OutputConfig output) { this.output = output; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Checks every section and reports all problems at once.
     *
     * @throws ConfigurationException if any value is out of range
     */
    public SimulationConfig validate() {
        List<String> problems = new ArrayList<>();

        if (servers.getCount() <= 0) {
            problems.add("servers.count must be positive, got " + servers.getCount());
        }
        if (simulation.getNumPlayers() < 0) {
            problems.add("simulation.numPlayers must not be negative, got " + simulation.getNumPlayers());
        }
        if (simulation.getConcurrencyLimit() < 0) {
            problems.add("simulation.concurrencyLimit must not be negative, got " + simulation.getConcurrencyLimit());
        } else if (simulation.getConcurrencyLimit() > simulation.getNumPlayers() && simulation.getNumPlayers() > 0) {
            problems.add("simulation.concurrencyLimit (" + simulation.getConcurrencyLimit()
                    + ") exceeds simulation.numPlayers (" + simulation.getNumPlayers() + ")");
        }
        if (simulation.getArrivalIntervalSeconds() < 0 || !Double.isFinite(simulation.getArrivalIntervalSeconds())) {
            problems.add("simulation.arrivalIntervalSeconds must be a non-negative number");
        }
        if (simulation.getTimeoutMs() < 0) {
            problems.add("simulation.timeoutMs must not be negative");
        }
        if (simulation.getTimeScaleMillis() < 0) {
            problems.add("simulation.timeScaleMillis must not be negative");
        }
        if (processingTime.getMin() < 0 || processingTime.getMax() < 0) {
            problems.add("processingTime bounds must not be negative");
        }
        if (processingTime.getMin() > processingTime.getMax()) {
            problems.add("processingTime.min exceeds processingTime.max");
        }
        if (disruptor.getRingBufferSize() <= 0 || Integer.bitCount(disruptor.getRingBufferSize()) != 1) {
            problems.add("disruptor.ringBufferSize must be a power of 2, got " + disruptor.getRingBufferSize());
        }
        if (sink.getAppendTimeoutMs() <= 0) {
            problems.add("sink.appendTimeoutMs must be positive");
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
        return this;
    }

    /**
     * Concurrency limit with the "0 means one worker per player" default applied.
     */
    public int effectiveConcurrencyLimit() {
        int limit = simulation.getConcurrencyLimit();
        return limit > 0 ? limit : Math.max(1, simulation.getNumPlayers());
    }

    /**
     * Server pool configuration.
     */
    public static class ServersConfig {
        private int count = 3;
        private String namePrefix = "Game_Server_";

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }

        public String getNamePrefix() { return namePrefix; }
        public void setNamePrefix(String namePrefix) { this.namePrefix = namePrefix; }
    }

    /**
     * Run parameters.
     */
    public static class RunConfig {
        private int numPlayers = 20;
        private int concurrencyLimit = 0;
        private double arrivalIntervalSeconds = 0.0;
        private long timeoutMs = 0;
        private long timeScaleMillis = 1000;

        public int getNumPlayers() { return numPlayers; }
        public void setNumPlayers(int numPlayers) { this.numPlayers = numPlayers; }

        public int getConcurrencyLimit() { return concurrencyLimit; }
        public void setConcurrencyLimit(int concurrencyLimit) { this.concurrencyLimit = concurrencyLimit; }

        public double getArrivalIntervalSeconds() { return arrivalIntervalSeconds; }
        public void setArrivalIntervalSeconds(double arrivalIntervalSeconds) { this.arrivalIntervalSeconds = arrivalIntervalSeconds; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public long getTimeScaleMillis() { return timeScaleMillis; }
        public void setTimeScaleMillis(long timeScaleMillis) { this.timeScaleMillis = timeScaleMillis; }
    }

    /**
     * Simulated processing time distribution.
     */
    public static class ProcessingTimeConfig {
        private String distribution = "uniform";
        private double min = 1.0;
        private double max = 3.0;
        private Long seed;

        public String getDistribution() { return distribution; }
        public void setDistribution(String distribution) { this.distribution = distribution; }

        public double getMin() { return min; }
        public void setMin(double min) { this.min = min; }

        public double getMax() { return max; }
        public void setMax(double max) { this.max = max; }

        public Long getSeed() { return seed; }
        public void setSeed(Long seed) { this.seed = seed; }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Metrics sink configuration.
     */
    public static class SinkConfig {
        private long appendTimeoutMs = 1000;

        public long getAppendTimeoutMs() { return appendTimeoutMs; }
        public void setAppendTimeoutMs(long appendTimeoutMs) { this.appendTimeoutMs = appendTimeoutMs; }
    }

    /**
     * Output files. A blank file name disables that output.
     */
    public static class OutputConfig {
        private String directory = "output/logs";
        private String metricsCsv = "metrics.csv";
        private String summaryJson = "summary.json";
        private String prometheusFile = "metrics.prom";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getMetricsCsv() { return metricsCsv; }
        public void setMetricsCsv(String metricsCsv) { this.metricsCsv = metricsCsv; }

        public String getSummaryJson() { return summaryJson; }
        public void setSummaryJson(String summaryJson) { this.summaryJson = summaryJson; }

        public String getPrometheusFile() { return prometheusFile; }
        public void setPrometheusFile(String prometheusFile) { this.prometheusFile = prometheusFile; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "game_lb";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
