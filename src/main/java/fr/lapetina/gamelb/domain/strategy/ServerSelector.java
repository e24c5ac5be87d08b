package fr.lapetina.gamelb.domain.strategy;

/**
 * Strategy interface for picking the server that handles the next player request.
 *
 * Implementations must be thread-safe as they will be called from
 * multiple dispatch worker threads concurrently.
 */
public interface ServerSelector {

    /**
     * Returns the name of this selector for configuration and logging.
     */
    String getName();

    /**
     * Selects the next server.
     *
     * @return index of the selected server in the pool
     */
    int selectNext();

    /**
     * Resets any internal state.
     */
    default void reset() {
        // Default no-op
    }
}
