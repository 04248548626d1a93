package fr.lapetina.resilienthttp.retry;

import java.time.Duration;

/**
 * Blocks the calling thread for a delay.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration delay) throws InterruptedException;

    /**
     * Sleeper backed by {@link Thread#sleep(long, int)}.
     */
    static Sleeper system() {
        return delay -> {
            if (!delay.isNegative() && !delay.isZero()) {
                Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);
            }
        };
    }
}
