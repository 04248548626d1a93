package fr.lapetina.resilienthttp.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer meters for transfers and retries, exposed in Prometheus format.
 *
 * Provides:
 * - Dispatches through the batch pool
 * - Retries scheduled, by mode (sync or deferred)
 * - Retries abandoned once the budget is spent
 * - Deferred observers fired
 * - Responses by status code and transfer latency
 * - Pending deferred observers gauge
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "resilient_http";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, Counter> responseCounters = new ConcurrentHashMap<>();
    private final Counter dispatchCounter;
    private final Counter exhaustedCounter;
    private final Counter deferredFiredCounter;
    private final Counter transportErrorCounter;
    private final Timer transferLatency;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        this.dispatchCounter = Counter.builder(prefix + "_dispatches_total")
                .description("Requests handed to a transport by the batch pool, retries included")
                .register(registry);

        this.exhaustedCounter = Counter.builder(prefix + "_retries_exhausted_total")
                .description("Requests left failed after spending their retry budget")
                .register(registry);

        this.deferredFiredCounter = Counter.builder(prefix + "_deferred_fired_total")
                .description("Deferred retry observers that fired and resubmitted their request")
                .register(registry);

        this.transportErrorCounter = Counter.builder(prefix + "_transport_errors_total")
                .description("Transfers that ended without a response")
                .register(registry);

        this.transferLatency = Timer.builder(prefix + "_transfer_latency")
                .description("Time from dispatch to response for pooled transfers")
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Counts a scheduled retry.
     *
     * @param mode {@code sync} or {@code deferred}
     */
    public void incrementRetries(String mode) {
        retryCounters.computeIfAbsent(mode, m ->
                Counter.builder(prefix + "_retries_total")
                        .description("Retries scheduled after a failing response")
                        .tag("mode", m)
                        .register(registry)
        ).increment();
    }

    public void incrementDispatches() {
        dispatchCounter.increment();
    }

    public void incrementRetriesExhausted() {
        exhaustedCounter.increment();
    }

    public void incrementDeferredFired() {
        deferredFiredCounter.increment();
    }

    public void incrementTransportErrors() {
        transportErrorCounter.increment();
    }

    /**
     * Counts a received response by status code.
     */
    public void incrementResponses(int statusCode) {
        responseCounters.computeIfAbsent(statusCode, code ->
                Counter.builder(prefix + "_responses_total")
                        .description("Responses received, by status code")
                        .tag("status", Integer.toString(code))
                        .register(registry)
        ).increment();
    }

    public void recordTransferLatency(Duration latency) {
        transferLatency.record(latency);
    }

    /**
     * Registers a gauge for observers waiting on their delay.
     */
    public void registerPendingDeferred(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_deferred_pending", valueSupplier, s -> s.get().doubleValue())
                .description("Deferred retry observers waiting for their delay")
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
