package fr.lapetina.gamelb.domain.delay;

import fr.lapetina.gamelb.domain.exception.ConfigurationException;

import java.util.Locale;

/**
 * Factory for delay distributions referenced by name in configuration.
 */
public final class DelayDistributions {

    public static final String UNIFORM = "uniform";
    public static final String FIXED = "fixed";

    private DelayDistributions() {
        // Utility class
    }

    /**
     * Creates a distribution by name.
     *
     * @param name distribution name ({@code uniform} or {@code fixed})
     * @param min  lower bound; also the value of a fixed distribution
     * @param max  upper bound, ignored by {@code fixed}
     * @param seed optional seed for {@code uniform}
     * @throws ConfigurationException for an unknown name or invalid bounds
     */
    public static DelayDistribution create(String name, double min, double max, Long seed) {
        String key = name == null ? UNIFORM : name.toLowerCase(Locale.ROOT);
        return switch (key) {
            case UNIFORM -> new UniformDelayDistribution(min, max, seed);
            case FIXED -> new FixedDelayDistribution(min);
            default -> throw new ConfigurationException("Unknown processing time distribution: " + name);
        };
    }
}
