package fr.lapetina.gamelb.simulation;

/**
 * Lifecycle of a {@link SimulationDriver}.
 */
public enum SimulationState {
    /** Created, not yet run */
    IDLE,

    /** Issuing player requests */
    RUNNING,

    /** Every request has been published; waiting for in-flight dispatches */
    DRAINING,

    /** Every request resolved and the metrics flushed */
    COMPLETED
}
