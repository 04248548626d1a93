package fr.lapetina.resilienthttp.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.resilienthttp.disruptor.exception.BackpressureException;
import fr.lapetina.resilienthttp.disruptor.handlers.DispatchHandler;
import fr.lapetina.resilienthttp.disruptor.handlers.MetricsHandler;
import fr.lapetina.resilienthttp.domain.event.DispatchEvent;
import fr.lapetina.resilienthttp.domain.event.DispatchEventFactory;
import fr.lapetina.resilienthttp.domain.model.TransferRequest;
import fr.lapetina.resilienthttp.domain.model.TransferResponse;
import fr.lapetina.resilienthttp.infrastructure.config.ResilientHttpConfig;
import fr.lapetina.resilienthttp.infrastructure.http.Transport;
import fr.lapetina.resilienthttp.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batch dispatcher on an LMAX Disruptor ring buffer.
 *
 * Requests from any thread are published to the ring buffer (MULTI producer)
 * and dispatched asynchronously by {@link DispatchHandler}, so the consumer
 * thread never waits on the network. Deferred observers are polled on a
 * separate scheduler thread every {@code pollIntervalMs}; {@link #poll()} can
 * also be driven by hand.
 *
 * Each request keeps one future across all of its dispatches. It completes
 * when the request reaches a final state, at which point the request is
 * unbound from this pool.
 */
public final class BatchPool implements BatchContext, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchPool.class);

    private final Disruptor<DispatchEvent> disruptor;
    private final RingBuffer<DispatchEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Clock clock;
    private final long pollIntervalMs;
    private final ScheduledExecutorService poller;

    private final Set<DeferredObserver> deferred = ConcurrentHashMap.newKeySet();
    private final Map<Long, CompletableFuture<TransferResponse>> pending = new ConcurrentHashMap<>();

    private BatchPool(Builder builder) {
        this.clock = builder.clock;
        this.pollIntervalMs = builder.pollIntervalMs;

        this.disruptor = new Disruptor<>(
                new DispatchEventFactory(),
                builder.ringBufferSize,
                new NamedThreadFactory("batch-dispatch"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        DispatchHandler dispatchHandler = new DispatchHandler(
                builder.transport,
                builder.metricsRegistry,
                clock,
                builder.requestTimeoutMs
        );
        MetricsHandler metricsHandler = new MetricsHandler(builder.metricsRegistry);

        disruptor
                .handleEventsWith(dispatchHandler)
                .then(metricsHandler);
        disruptor.setDefaultExceptionHandler(new DispatchExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();
        this.poller = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("batch-poller"));

        builder.metricsRegistry.registerPendingDeferred(deferred::size);

        log.info("BatchPool created: ringBufferSize={}, waitStrategy={}, pollIntervalMs={}",
                builder.ringBufferSize, builder.waitStrategy, pollIntervalMs);
    }

    /**
     * Starts the dispatch consumers and the deferred poller.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            poller.scheduleWithFixedDelay(this::pollSafely, pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS);
            log.info("BatchPool started");
        }
    }

    /**
     * Publishes a request for dispatch and binds it to this pool.
     *
     * @throws BackpressureException if the pool is not running or the ring buffer is full;
     *         the request's future, if one exists, fails with the same exception
     */
    @Override
    public CompletableFuture<TransferResponse> add(TransferRequest request) {
        if (!running.get()) {
            throw reject(request, new BackpressureException(
                    BackpressureException.BackpressureReason.POOL_NOT_RUNNING, request.getId()));
        }

        CompletableFuture<TransferResponse> future = pending.computeIfAbsent(request.getId(), id -> {
            CompletableFuture<TransferResponse> created = new CompletableFuture<>();
            created.whenComplete((response, throwable) -> {
                pending.remove(id, created);
                request.setBatchContext(null);
            });
            return created;
        });
        request.setBatchContext(this);

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw reject(request, new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    request.getId(),
                    "remaining capacity: " + ringBuffer.remainingCapacity()
            ));
        }

        try {
            ringBuffer.get(sequence).initialize(request, future, clock.instant(), sequence);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.debug("Request published: requestId={}, sequence={}", request.getId(), sequence);
        return future;
    }

    private BackpressureException reject(TransferRequest request, BackpressureException e) {
        log.warn("Request rejected: requestId={}, reason={}", request.getId(), e.getReason());
        CompletableFuture<TransferResponse> future = pending.get(request.getId());
        if (future != null) {
            future.completeExceptionally(e);
        }
        return e;
    }

    @Override
    public void registerDeferred(DeferredObserver observer) {
        deferred.add(observer);
        log.debug("Deferred observer registered: observer={}, pending={}", observer, deferred.size());
    }

    @Override
    public boolean unregisterDeferred(DeferredObserver observer) {
        return deferred.remove(observer);
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    /**
     * Offers every registered observer the current clock instant.
     *
     * An observer that throws is logged and dropped.
     *
     * @return number of observers that ran
     */
    public int poll() {
        Instant now = clock.instant();
        int fired = 0;
        for (DeferredObserver observer : new ArrayList<>(deferred)) {
            try {
                if (observer.update(this, now)) {
                    fired++;
                }
            } catch (RuntimeException e) {
                deferred.remove(observer);
                log.error("Deferred observer failed and was dropped: observer={}", observer, e);
            }
        }
        if (fired > 0) {
            log.debug("Poll cycle fired deferred observers: fired={}, remaining={}", fired, deferred.size());
        }
        return fired;
    }

    private void pollSafely() {
        try {
            poll();
        } catch (RuntimeException e) {
            // Keeps the scheduled poller alive
            log.error("Deferred poll cycle failed", e);
        }
    }

    public int getPendingDeferredCount() {
        return deferred.size();
    }

    public int getPendingRequestCount() {
        return pending.size();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops polling, drains the ring buffer and fails every request still pending.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down BatchPool...");
            poller.shutdownNow();
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                log.warn("BatchPool shutdown timed out, halting...");
                disruptor.halt();
            }

            List<CompletableFuture<TransferResponse>> abandoned = new ArrayList<>(pending.values());
            abandoned.forEach(f -> f.completeExceptionally(new IllegalStateException("Batch pool closed")));
            deferred.clear();
            log.info("BatchPool shut down: abandonedRequests={}", abandoned.size());
        } else {
            poller.shutdownNow();
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class NamedThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class DispatchExceptionHandler implements ExceptionHandler<DispatchEvent> {

        private static final Logger log = LoggerFactory.getLogger(DispatchExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, DispatchEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);
            if (event.getResponseFuture() != null && !event.getResponseFuture().isDone()) {
                event.getResponseFuture().completeExceptionally(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for BatchPool.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long pollIntervalMs = 100;
        private long requestTimeoutMs = 30_000;
        private Clock clock = Clock.systemUTC();
        private Transport transport;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (size <= 0 || Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder pollIntervalMs(long intervalMs) {
            if (intervalMs <= 0) {
                throw new IllegalArgumentException("Poll interval must be positive");
            }
            this.pollIntervalMs = intervalMs;
            return this;
        }

        public Builder requestTimeoutMs(long timeoutMs) {
            this.requestTimeoutMs = timeoutMs;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Transport for requests that do not carry their own.
         */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(ResilientHttpConfig config) {
            ringBufferSize(config.getBatch().getRingBufferSize());
            pollIntervalMs(config.getBatch().getPollIntervalMs());
            this.waitStrategy = config.getBatch().getWaitStrategy();
            this.requestTimeoutMs = config.getTransport().getRequestTimeoutMs();
            return this;
        }

        public BatchPool build() {
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            return new BatchPool(this);
        }
    }
}
