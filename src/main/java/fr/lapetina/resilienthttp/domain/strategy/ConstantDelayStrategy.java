package fr.lapetina.resilienthttp.domain.strategy;

import java.time.Duration;

/**
 * Same delay before every retry.
 */
public final class ConstantDelayStrategy implements DelayStrategy {

    private final Duration delay;

    public ConstantDelayStrategy(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("Delay must be non-negative: " + delay);
        }
        this.delay = delay;
    }

    @Override
    public Duration delayFor(int retries) {
        return delay;
    }

    @Override
    public String getName() {
        return "constant";
    }

    @Override
    public String toString() {
        return "ConstantDelayStrategy{delay=" + delay + "}";
    }
}
