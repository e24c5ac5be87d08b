package fr.lapetina.gamelb.domain.delay;

import fr.lapetina.gamelb.domain.exception.ConfigurationException;

final class DelayBounds {

    private DelayBounds() {
        // Utility class
    }

    static void check(double value, String name) {
        if (!Double.isFinite(value) || value < 0) {
            throw new ConfigurationException("Processing time " + name + " must be a finite, non-negative number, got " + value);
        }
    }
}
