/**
 * YAML configuration and reload notification.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilienthttp.infrastructure.config.ResilientHttpConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.resilienthttp.infrastructure.config.ConfigLoader} - YAML loading from file or classpath</li>
 *   <li>{@link fr.lapetina.resilienthttp.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code retry} - maxRetries, failureCodes, delayStrategy, delayUnit</li>
 *   <li>{@code batch} - ring buffer size, wait strategy, deferred poll interval</li>
 *   <li>{@code transport} - connect and request timeouts</li>
 *   <li>{@code metrics} - meter name prefix</li>
 * </ul>
 */
package fr.lapetina.resilienthttp.infrastructure.config;
