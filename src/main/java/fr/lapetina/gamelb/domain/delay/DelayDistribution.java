package fr.lapetina.gamelb.domain.delay;

/**
 * Source of simulated processing delays.
 *
 * Implementations must be thread-safe; every dispatch worker samples from the
 * same instance.
 */
public interface DelayDistribution {

    /**
     * Samples one processing delay.
     *
     * @return delay in simulated seconds
     */
    double sample();

    /**
     * Short human-readable description, used in logs.
     */
    String describe();
}
