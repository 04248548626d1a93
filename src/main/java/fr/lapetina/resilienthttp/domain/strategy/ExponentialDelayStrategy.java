package fr.lapetina.resilienthttp.domain.strategy;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Delay of {@code 2^retries} units: 2, 4, 8... seconds by default.
 *
 * The exponent is capped at 30 so the delay cannot overflow.
 */
public final class ExponentialDelayStrategy implements DelayStrategy {

    private static final int MAX_EXPONENT = 30;

    private final ChronoUnit unit;

    public ExponentialDelayStrategy() {
        this(ChronoUnit.SECONDS);
    }

    public ExponentialDelayStrategy(ChronoUnit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("Delay unit is required");
        }
        this.unit = unit;
    }

    @Override
    public Duration delayFor(int retries) {
        int exponent = Math.min(Math.max(retries, 0), MAX_EXPONENT);
        return Duration.of(1L << exponent, unit);
    }

    @Override
    public String getName() {
        return "exponential";
    }

    public ChronoUnit getUnit() {
        return unit;
    }

    @Override
    public String toString() {
        return "ExponentialDelayStrategy{unit=" + unit + "}";
    }
}
