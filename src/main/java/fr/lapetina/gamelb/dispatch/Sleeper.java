package fr.lapetina.gamelb.dispatch;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking wait used for simulated processing delays.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps on the calling thread.
     */
    Sleeper THREAD_SLEEP = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        }
    };

    /**
     * Returns immediately. Useful when only the simulated time matters.
     */
    Sleeper NONE = duration -> { };

    void sleep(Duration duration) throws InterruptedException;
}
