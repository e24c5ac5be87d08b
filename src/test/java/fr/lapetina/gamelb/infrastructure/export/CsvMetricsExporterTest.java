package fr.lapetina.gamelb.infrastructure.export;

import fr.lapetina.gamelb.domain.model.MetricsRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvMetricsExporterTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should write a header and one row per record")
    void shouldWriteRows() throws Exception {
        Path target = tempDir.resolve("logs/metrics.csv");
        CsvMetricsExporter exporter = new CsvMetricsExporter(target, ZoneOffset.UTC);
        Instant start = Instant.parse("2024-05-01T10:15:30.123456Z");
        Instant end = Instant.parse("2024-05-01T10:15:32.623456Z");

        exporter.export(List.of(
                new MetricsRecord("1", "Game_Server_1", 0, start, end, 2.5),
                new MetricsRecord("2", "Game_Server_2", 1, start, end, 1.25)
        ));

        List<String> lines = Files.readAllLines(target, StandardCharsets.UTF_8);
        assertThat(lines).containsExactly(
                "player_id,server_id,start_time,end_time,processing_time",
                "1,Game_Server_1,\"2024-05-01 10:15:30.123456\",\"2024-05-01 10:15:32.623456\",2.500",
                "2,Game_Server_2,\"2024-05-01 10:15:30.123456\",\"2024-05-01 10:15:32.623456\",1.250"
        );
    }

    @Test
    @DisplayName("should write only the header when there are no records")
    void shouldWriteHeaderOnly() throws Exception {
        Path target = tempDir.resolve("empty.csv");

        new CsvMetricsExporter(target, ZoneOffset.UTC).export(List.of());

        assertThat(Files.readAllLines(target, StandardCharsets.UTF_8))
                .containsExactly("player_id,server_id,start_time,end_time,processing_time");
    }

    @Test
    @DisplayName("should name itself after its target")
    void shouldExposeName() {
        Path target = tempDir.resolve("metrics.csv");

        assertThat(new CsvMetricsExporter(target).getName()).isEqualTo("csv:" + target);
    }
}
