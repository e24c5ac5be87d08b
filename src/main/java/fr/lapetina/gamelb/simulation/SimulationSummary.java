package fr.lapetina.gamelb.simulation;

import fr.lapetina.gamelb.domain.model.DispatchFailure;

import java.time.Duration;
import java.util.List;

/**
 * Result of one simulation run.
 * Immutable and thread-safe.
 *
 * @param requested   player requests generated
 * @param dispatched  requests that committed a metrics record
 * @param failed      requests that were attempted and failed
 * @param notIssued   requests never attempted because the run timed out or was aborted
 * @param abortReason why the run was aborted, or null
 */
public record SimulationSummary(
        int requested,
        int dispatched,
        int failed,
        int notIssued,
        Duration wallTime,
        Outcome outcome,
        List<DispatchFailure> failures,
        String abortReason
) {
    public SimulationSummary {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public static SimulationSummary empty(Duration wallTime) {
        return new SimulationSummary(0, 0, 0, 0, wallTime, Outcome.COMPLETED, List.of(), null);
    }

    /**
     * True when every request was dispatched successfully.
     */
    public boolean isClean() {
        return outcome == Outcome.COMPLETED && failed == 0 && notIssued == 0;
    }

    /**
     * How a run ended.
     */
    public enum Outcome {
        /** Every request was attempted */
        COMPLETED,

        /** The overall timeout stopped issuance */
        TIMED_OUT,

        /** A metrics write failure stopped issuance */
        ABORTED
    }
}
