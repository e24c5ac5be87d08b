package fr.lapetina.gamelb.infrastructure.metrics;

import fr.lapetina.gamelb.domain.model.MetricsRecord;

import java.io.IOException;
import java.util.List;

/**
 * Writes the records collected by a {@link MetricsSink} to persistent output.
 */
public interface MetricsExporter {

    /**
     * Returns the name of this exporter for logging.
     */
    String getName();

    /**
     * Exports the records, replacing any earlier export.
     *
     * @param records records in append order
     */
    void export(List<MetricsRecord> records) throws IOException;
}
