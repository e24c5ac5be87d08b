package fr.lapetina.gamelb.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link SimulationReport} as indented JSON.
 */
public final class ReportJsonWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportJsonWriter.class);

    private final ObjectMapper objectMapper;

    public ReportJsonWriter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(SimulationReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }

    public void write(SimulationReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), report);
        log.info("Simulation report written to {}", target);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
