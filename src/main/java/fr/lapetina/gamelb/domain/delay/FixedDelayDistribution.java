package fr.lapetina.gamelb.domain.delay;

/**
 * Always returns the same delay.
 */
public final class FixedDelayDistribution implements DelayDistribution {

    private final double delay;

    public FixedDelayDistribution(double delay) {
        DelayBounds.check(delay, "delay");
        this.delay = delay;
    }

    @Override
    public double sample() {
        return delay;
    }

    @Override
    public String describe() {
        return "fixed[" + delay + "]";
    }
}
