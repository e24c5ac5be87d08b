package fr.lapetina.gamelb.domain.delay;

import fr.lapetina.gamelb.domain.exception.ConfigurationException;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Delays drawn uniformly from {@code [min, max]}.
 *
 * Without a seed each thread draws from its own {@link ThreadLocalRandom}. With a
 * seed a shared {@link Random} is used, which makes the sequence of samples
 * reproducible for a single-threaded caller.
 */
public final class UniformDelayDistribution implements DelayDistribution {

    public static final double DEFAULT_MIN = 1.0;
    public static final double DEFAULT_MAX = 3.0;

    private final double min;
    private final double max;
    private final Random seeded;

    public UniformDelayDistribution(double min, double max) {
        this(min, max, null);
    }

    public UniformDelayDistribution(double min, double max, Long seed) {
        DelayBounds.check(min, "min");
        DelayBounds.check(max, "max");
        if (min > max) {
            throw new ConfigurationException("Processing time min (" + min + ") exceeds max (" + max + ")");
        }
        this.min = min;
        this.max = max;
        this.seeded = seed != null ? new Random(seed) : null;
    }

    public static UniformDelayDistribution defaults() {
        return new UniformDelayDistribution(DEFAULT_MIN, DEFAULT_MAX);
    }

    @Override
    public double sample() {
        if (min == max) {
            return min;
        }
        double unit = seeded != null ? seeded.nextDouble() : ThreadLocalRandom.current().nextDouble();
        return min + unit * (max - min);
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    @Override
    public String describe() {
        return "uniform[" + min + ", " + max + "]";
    }
}
