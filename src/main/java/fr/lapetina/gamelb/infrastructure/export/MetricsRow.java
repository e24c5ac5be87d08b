package fr.lapetina.gamelb.infrastructure.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import fr.lapetina.gamelb.domain.model.MetricsRecord;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * One CSV row per completed dispatch.
 */
@JsonPropertyOrder({"player_id", "server_id", "start_time", "end_time", "processing_time"})
public record MetricsRow(
        @JsonProperty("player_id") String playerId,
        @JsonProperty("server_id") String serverId,
        @JsonProperty("start_time") String startTime,
        @JsonProperty("end_time") String endTime,
        @JsonProperty("processing_time") String processingTime
) {
    static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    static MetricsRow from(MetricsRecord record, ZoneId zone) {
        return new MetricsRow(
                record.playerId(),
                record.serverId(),
                format(record.startedAt(), zone),
                format(record.completedAt(), zone),
                String.format(Locale.ROOT, "%.3f", record.responseTime())
        );
    }

    private static String format(Instant instant, ZoneId zone) {
        return TIME_FORMAT.format(instant.atZone(zone));
    }
}
