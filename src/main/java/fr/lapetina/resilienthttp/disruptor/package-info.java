/**
 * LMAX Disruptor batch pool for sending many requests without blocking.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * Dispatch (async transport call) → Metrics (MDC, counters, slot cleanup)
 * </pre>
 *
 * <p>Deferred observers registered through {@link fr.lapetina.resilienthttp.disruptor.BatchContext}
 * run on the pool's poller thread, which is where delayed retries are resubmitted.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilienthttp.disruptor.BatchPool} - Ring buffer, poller and per-request futures</li>
 *   <li>{@link fr.lapetina.resilienthttp.disruptor.BatchContext} - What retry logic sees of a pool</li>
 *   <li>{@link fr.lapetina.resilienthttp.disruptor.exception.BackpressureException} - Thrown when the ring buffer is full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.resilienthttp.disruptor;
