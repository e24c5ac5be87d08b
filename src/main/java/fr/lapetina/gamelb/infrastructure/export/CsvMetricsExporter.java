package fr.lapetina.gamelb.infrastructure.export;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import fr.lapetina.gamelb.domain.model.MetricsRecord;
import fr.lapetina.gamelb.infrastructure.metrics.MetricsExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Exports metrics records as CSV, one row per record with a header line.
 *
 * Columns: {@code player_id, server_id, start_time, end_time, processing_time}.
 */
public final class CsvMetricsExporter implements MetricsExporter {

    private static final Logger log = LoggerFactory.getLogger(CsvMetricsExporter.class);

    private final Path target;
    private final ZoneId zone;
    private final CsvSchema schema;
    private final ObjectWriter writer;

    public CsvMetricsExporter(Path target) {
        this(target, ZoneId.systemDefault());
    }

    public CsvMetricsExporter(Path target, ZoneId zone) {
        this.target = Objects.requireNonNull(target, "Target path is required");
        this.zone = Objects.requireNonNull(zone, "Zone is required");
        CsvMapper mapper = new CsvMapper();
        this.schema = mapper.schemaFor(MetricsRow.class).withHeader();
        this.writer = mapper.writer(schema);
    }

    @Override
    public String getName() {
        return "csv:" + target;
    }

    @Override
    public void export(List<MetricsRecord> records) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        List<MetricsRow> rows = records.stream()
                .map(record -> MetricsRow.from(record, zone))
                .toList();
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            if (rows.isEmpty()) {
                // The CSV generator only emits the header together with the first row
                out.write(headerLine());
            } else {
                writer.writeValues(out).writeAll(rows).close();
            }
        }
        log.debug("Wrote {} rows to {}", rows.size(), target);
    }

    private String headerLine() {
        StringJoiner header = new StringJoiner(String.valueOf(schema.getColumnSeparator()), "", "\n");
        for (CsvSchema.Column column : schema) {
            header.add(column.getName());
        }
        return header.toString();
    }
}
