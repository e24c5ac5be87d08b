package fr.lapetina.gamelb;

import fr.lapetina.gamelb.domain.exception.ConfigurationException;
import fr.lapetina.gamelb.report.ReportJsonWriter;
import fr.lapetina.gamelb.report.SimulationReport;
import fr.lapetina.gamelb.simulation.SimulationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Main entry point for the game server load balancer simulation.
 */
public class GameLoadBalancerApplication {

    private static final Logger log = LoggerFactory.getLogger(GameLoadBalancerApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    private final String configPath;

    public GameLoadBalancerApplication(String configPath) {
        this.configPath = configPath;
    }

    /**
     * Runs one simulation and writes its outputs.
     *
     * @return the process exit status
     */
    public int execute() {
        try (SimulationFactory factory = SimulationFactory.create(configPath)) {
            SimulationSummary summary = factory.run();
            SimulationReport report = factory.report(summary);

            log.info("\n{}", report.render());
            writeOutputs(factory, report);

            return exitStatus(summary);
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
    }

    private void writeOutputs(SimulationFactory factory, SimulationReport report) {
        Path summaryJson = factory.outputFile(factory.getConfig().getOutput().getSummaryJson());
        if (summaryJson != null) {
            try {
                new ReportJsonWriter().write(report, summaryJson);
            } catch (IOException e) {
                log.warn("Error writing report to {}", summaryJson, e);
            }
        }

        Path prometheus = factory.outputFile(factory.getConfig().getOutput().getPrometheusFile());
        if (prometheus != null) {
            try {
                Files.createDirectories(prometheus.toAbsolutePath().getParent());
                Files.writeString(prometheus, factory.getMetricsRegistry().scrape(), StandardCharsets.UTF_8);
                log.info("Prometheus metrics written to {}", prometheus);
            } catch (IOException e) {
                log.warn("Error writing Prometheus metrics to {}", prometheus, e);
            }
        }

        Path csv = factory.outputFile(factory.getConfig().getOutput().getMetricsCsv());
        if (csv != null) {
            log.info("CSV metrics: {}", csv);
        }
    }

    static int exitStatus(SimulationSummary summary) {
        return summary.isClean() ? EXIT_OK : EXIT_RUN_FAILED;
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "simulation.yaml";
        int status = new GameLoadBalancerApplication(configPath).execute();
        System.exit(status);
    }
}
