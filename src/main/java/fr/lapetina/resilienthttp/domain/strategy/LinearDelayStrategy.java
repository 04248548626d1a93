package fr.lapetina.resilienthttp.domain.strategy;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Delay of {@code retries} units: 1, 2, 3...
 */
public final class LinearDelayStrategy implements DelayStrategy {

    private final ChronoUnit unit;

    public LinearDelayStrategy() {
        this(ChronoUnit.SECONDS);
    }

    public LinearDelayStrategy(ChronoUnit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("Delay unit is required");
        }
        this.unit = unit;
    }

    @Override
    public Duration delayFor(int retries) {
        return Duration.of(Math.max(retries, 0), unit);
    }

    @Override
    public String getName() {
        return "linear";
    }

    @Override
    public String toString() {
        return "LinearDelayStrategy{unit=" + unit + "}";
    }
}
