package fr.lapetina.gamelb.domain.event;

/**
 * Lifecycle of a player request inside the dispatch ring buffer.
 */
public enum EventState {
    /** Published, not yet taken by a worker */
    PENDING,

    /** Taken by a worker and being dispatched */
    ISSUED,

    /** Dispatch committed a metrics record */
    COMPLETED,

    /** Dispatch was attempted and failed */
    FAILED,

    /** Taken after the run timed out or was aborted; never attempted */
    NOT_ISSUED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == NOT_ISSUED;
    }
}
