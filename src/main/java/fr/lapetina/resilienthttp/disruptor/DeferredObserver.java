package fr.lapetina.resilienthttp.disruptor;

import java.time.Instant;

/**
 * Delayed work offered to a {@link BatchContext} on each poll cycle.
 */
@FunctionalInterface
public interface DeferredObserver {

    /**
     * Runs the work if it is due.
     *
     * @param context the context running the poll cycle
     * @param now     the poll cycle's time
     * @return true if the work ran during this call
     */
    boolean update(BatchContext context, Instant now);
}
