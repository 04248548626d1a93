package fr.lapetina.resilienthttp;

import fr.lapetina.resilienthttp.disruptor.BatchPool;
import fr.lapetina.resilienthttp.domain.model.TransferRequest;
import fr.lapetina.resilienthttp.domain.model.TransferResponse;
import fr.lapetina.resilienthttp.infrastructure.config.ConfigLoader;
import fr.lapetina.resilienthttp.infrastructure.config.ResilientHttpConfig;
import fr.lapetina.resilienthttp.infrastructure.http.JdkHttpTransport;
import fr.lapetina.resilienthttp.infrastructure.http.Transport;
import fr.lapetina.resilienthttp.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.resilienthttp.retry.ExponentialBackoffCoordinator;
import fr.lapetina.resilienthttp.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Builds a fully wired client from configuration: transport, retry
 * coordinator, batch pool and metrics.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ResilientClientFactory client = ResilientClientFactory.create("resilient-http.yaml").start()) {
 *     TransferRequest request = client.newRequest().uri("http://localhost:8080/items").build();
 *     TransferResponse solo = client.send(request);
 *     CompletableFuture<TransferResponse> pooled = client.submit(client.newRequest().uri(...).build());
 * }
 * }</pre>
 */
public class ResilientClientFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientClientFactory.class);

    private final ConfigLoader configLoader;
    private final ResilientHttpConfig config;
    private final MetricsRegistry metricsRegistry;
    private final Transport transport;
    private final ExponentialBackoffCoordinator coordinator;
    private final BatchPool pool;

    protected ResilientClientFactory(String configPath, Transport transportOverride, Clock clock, Sleeper sleeper) {
        log.info("Initializing ResilientClientFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Allow override for testing
        this.transport = transportOverride != null ? transportOverride : createTransport();

        this.coordinator = new ExponentialBackoffCoordinator(metricsRegistry, sleeper);
        coordinator.onConfigChanged(null, config);
        configLoader.addListener(coordinator);

        this.pool = BatchPool.builder()
                .fromConfig(config)
                .transport(transport)
                .metricsRegistry(metricsRegistry)
                .clock(clock)
                .build();

        log.info("ResilientClientFactory initialized: maxRetries={}, failureCodes={}, delayStrategy={}",
                coordinator.getMaxRetries(), coordinator.getFailureCodes(), coordinator.getDelayStrategy().getName());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ResilientClientFactory create(String configPath) {
        return new ResilientClientFactory(configPath, null, Clock.systemUTC(), Sleeper.system());
    }

    /**
     * Creates a factory from the default configuration (resilient-http.yaml).
     */
    public static ResilientClientFactory create() {
        return create("resilient-http.yaml");
    }

    /**
     * Starts the batch pool.
     */
    public ResilientClientFactory start() {
        pool.start();
        log.info("Batch pool started");
        return this;
    }

    /**
     * Returns a request builder bound to this client's transport.
     */
    public TransferRequest.Builder newRequest() {
        return TransferRequest.builder().transport(transport);
    }

    /**
     * Sends a request on the calling thread, retrying failures inline.
     */
    public TransferResponse send(TransferRequest request) {
        coordinator.attach(request);
        return request.send();
    }

    /**
     * Sends a request through the batch pool; retries are deferred and never
     * block the pool's threads.
     */
    public CompletableFuture<TransferResponse> submit(TransferRequest request) {
        coordinator.attach(request);
        return pool.add(request);
    }

    /**
     * Re-reads the configuration; the retry policy follows the new values.
     */
    public ResilientHttpConfig reloadConfig() {
        return configLoader.reload();
    }

    public BatchPool getPool() {
        return pool;
    }

    public ExponentialBackoffCoordinator getCoordinator() {
        return coordinator;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public Transport getTransport() {
        return transport;
    }

    public ResilientHttpConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private Transport createTransport() {
        return new JdkHttpTransport(
                Duration.ofMillis(config.getTransport().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTransport().getRequestTimeoutMs())
        );
    }

    @Override
    public void close() {
        log.info("Shutting down ResilientClientFactory...");

        configLoader.removeListener(coordinator);

        try {
            pool.close();
        } catch (RuntimeException e) {
            log.warn("Error closing batch pool", e);
        }

        try {
            metricsRegistry.close();
        } catch (RuntimeException e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ResilientClientFactory shut down");
    }
}
