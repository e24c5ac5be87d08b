package fr.lapetina.gamelb.domain.model;

/**
 * Error taxonomy for player request dispatches.
 * Provides clear categorization for failure reporting and metrics.
 */
public enum ErrorType {
    /** The selector itself failed to produce an index */
    SELECTION_ERROR,

    /** The selector produced an index outside the server pool */
    INVALID_SERVER_INDEX,

    /** The delay distribution threw while sampling */
    DELAY_SAMPLING_ERROR,

    /** The delay distribution returned a negative or non-finite value */
    INVALID_DELAY,

    /** The worker was interrupted during the simulated processing delay */
    INTERRUPTED,

    /** The metrics record could not be appended to the sink */
    SINK_WRITE_ERROR,

    /** Internal system error */
    INTERNAL_ERROR
}
