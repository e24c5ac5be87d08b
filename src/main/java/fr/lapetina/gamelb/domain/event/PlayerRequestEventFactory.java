package fr.lapetina.gamelb.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating PlayerRequestEvent instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates events at startup; they are then reused by
 * clearing and re-initializing them.
 */
public final class PlayerRequestEventFactory implements EventFactory<PlayerRequestEvent> {

    @Override
    public PlayerRequestEvent newInstance() {
        return new PlayerRequestEvent();
    }
}
