package fr.lapetina.gamelb.report;

import fr.lapetina.gamelb.domain.model.MetricsRecord;
import fr.lapetina.gamelb.domain.model.ServerStats;
import fr.lapetina.gamelb.simulation.SimulationSummary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Final statistics of a simulation: per-server load and overall totals.
 *
 * Built from the run summary, the server pool snapshot and the drained metrics records.
 */
public record SimulationReport(
        SimulationSummary summary,
        List<ServerReport> servers,
        long totalPlayers,
        double averageResponseTime
) {
    public SimulationReport {
        servers = List.copyOf(servers);
    }

    /**
     * Per-server section of the report.
     *
     * @param playerIds players routed to the server, in completion order
     */
    public record ServerReport(
            String serverId,
            long playersHandled,
            double totalResponseTime,
            double averageResponseTime,
            List<String> playerIds
    ) {
        public ServerReport {
            playerIds = List.copyOf(playerIds);
        }
    }

    public static SimulationReport of(SimulationSummary summary,
                                      List<ServerStats> snapshot,
                                      List<MetricsRecord> records) {
        Map<String, List<String>> playersByServer = new LinkedHashMap<>();
        for (ServerStats stats : snapshot) {
            playersByServer.put(stats.serverId(), new ArrayList<>());
        }
        for (MetricsRecord record : records) {
            playersByServer.computeIfAbsent(record.serverId(), k -> new ArrayList<>()).add(record.playerId());
        }

        List<ServerReport> servers = new ArrayList<>(snapshot.size());
        long totalPlayers = 0;
        double totalTime = 0.0;
        for (ServerStats stats : snapshot) {
            servers.add(new ServerReport(
                    stats.serverId(),
                    stats.requestsServed(),
                    stats.totalResponseTime(),
                    stats.averageResponseTime(),
                    playersByServer.get(stats.serverId())
            ));
            totalPlayers += stats.requestsServed();
            totalTime += stats.totalResponseTime();
        }
        double average = totalPlayers > 0 ? totalTime / totalPlayers : 0.0;
        return new SimulationReport(summary, servers, totalPlayers, average);
    }

    /**
     * Renders the report as plain text for the console or the log.
     */
    public String render() {
        StringBuilder out = new StringBuilder();
        out.append("Final Server Statistics").append('\n');
        out.append("=".repeat(50)).append('\n');
        for (ServerReport server : servers) {
            out.append('\n').append(server.serverId()).append(":\n");
            out.append("  Players Handled: ").append(server.playersHandled()).append('\n');
            out.append("  Average Response Time: ")
                    .append(String.format(Locale.ROOT, "%.3f", server.averageResponseTime()))
                    .append(" seconds\n");
            out.append("  Player List: ");
            List<String> labels = server.playerIds().stream().map(id -> "Player_" + id).toList();
            out.append(String.join(", ", labels)).append('\n');
        }
        out.append('\n').append("Overall Statistics").append('\n');
        out.append("=".repeat(50)).append('\n');
        out.append("Outcome: ").append(summary.outcome()).append('\n');
        out.append("Total Players Connected: ").append(totalPlayers).append('\n');
        out.append("Failed Requests: ").append(summary.failed()).append('\n');
        out.append("Requests Not Issued: ").append(summary.notIssued()).append('\n');
        out.append("Average Response Time Across All Servers: ")
                .append(String.format(Locale.ROOT, "%.3f", averageResponseTime))
                .append(" seconds\n");
        out.append("Wall Time: ").append(summary.wallTime().toMillis()).append(" ms\n");
        if (summary.abortReason() != null) {
            out.append("Abort Reason: ").append(summary.abortReason()).append('\n');
        }
        return out.toString();
    }
}
