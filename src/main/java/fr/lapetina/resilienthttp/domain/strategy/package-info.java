/**
 * Delay strategies for retry backoff.
 *
 * <p>A {@link fr.lapetina.resilienthttp.domain.strategy.DelayStrategy} maps a 1-based
 * retry count to a delay. Strategies are pure functions and shared across threads.
 *
 * <table border="1">
 *   <tr><th>Name</th><th>Delay for retry n</th></tr>
 *   <tr><td>{@code exponential}</td><td>2^n units (default, seconds)</td></tr>
 *   <tr><td>{@code linear}</td><td>n units</td></tr>
 *   <tr><td>{@code constant}</td><td>1 unit</td></tr>
 * </table>
 *
 * <pre>{@code
 * DelayStrategy strategy = DelayStrategyFactory.create("exponential", ChronoUnit.SECONDS).orElseThrow();
 * Duration third = strategy.delayFor(3); // 8 seconds
 * }</pre>
 */
package fr.lapetina.resilienthttp.domain.strategy;
