package fr.lapetina.resilienthttp.domain.strategy;

import java.time.Duration;

/**
 * Maps a retry count to the delay before that retry is sent.
 *
 * Implementations must be pure and thread-safe: the same count always
 * yields the same delay, whichever thread asks.
 */
@FunctionalInterface
public interface DelayStrategy {

    /**
     * @param retries 1-based retry count
     * @return delay before sending retry number {@code retries}, never negative
     */
    Duration delayFor(int retries);

    /**
     * Returns the name of this strategy for configuration and logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
