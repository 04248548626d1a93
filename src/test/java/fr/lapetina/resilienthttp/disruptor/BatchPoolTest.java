package fr.lapetina.resilienthttp.disruptor;

import fr.lapetina.resilienthttp.disruptor.exception.BackpressureException;
import fr.lapetina.resilienthttp.domain.model.RequestState;
import fr.lapetina.resilienthttp.domain.model.TransferException;
import fr.lapetina.resilienthttp.domain.model.TransferRequest;
import fr.lapetina.resilienthttp.domain.model.TransferResponse;
import fr.lapetina.resilienthttp.domain.strategy.ExponentialDelayStrategy;
import fr.lapetina.resilienthttp.infrastructure.http.StubTransport;
import fr.lapetina.resilienthttp.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.resilienthttp.retry.ExponentialBackoffCoordinator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchPoolTest {

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private MetricsRegistry metrics;
    private ExponentialBackoffCoordinator coordinator;
    private BatchPool pool;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("pool_test");
        coordinator = new ExponentialBackoffCoordinator(metrics, sleeps::add);
        coordinator.configure(3, null, new ExponentialDelayStrategy(ChronoUnit.MILLIS));
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
        metrics.close();
    }

    private BatchPool startPool(StubTransport transport) {
        pool = BatchPool.builder()
                .ringBufferSize(16)
                .pollIntervalMs(5)
                .requestTimeoutMs(5_000)
                .transport(transport)
                .metricsRegistry(metrics)
                .build();
        pool.start();
        return pool;
    }

    private TransferRequest attachedRequest() {
        TransferRequest request = TransferRequest.builder().uri("http://localhost/pooled").build();
        coordinator.attach(request);
        return request;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5 seconds");
            }
            Thread.sleep(5);
        }
    }

    @Test
    @DisplayName("should dispatch a request and complete its future")
    void shouldDispatchRequest() throws Exception {
        StubTransport transport = StubTransport.always(200);
        startPool(transport);

        TransferRequest request = attachedRequest();
        TransferResponse response = pool.add(request).get(5, TimeUnit.SECONDS);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(request.getState()).isEqualTo(RequestState.COMPLETE);
        assertThat(transport.getSendCount()).isEqualTo(1);
        assertThat(coordinator.isTracked(request)).isFalse();
    }

    @Test
    @DisplayName("should retry through deferred observers without sleeping")
    void shouldRetryDeferred() throws Exception {
        StubTransport transport = StubTransport.sequence(503, 503, 200);
        startPool(transport);

        TransferRequest request = attachedRequest();
        TransferResponse response = pool.add(request).get(5, TimeUnit.SECONDS);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(transport.getSendCount()).isEqualTo(3);
        assertThat(transport.getSentRequestIds()).containsOnly(request.getId());
        assertThat(sleeps).isEmpty();
        assertThat(pool.getPendingDeferredCount()).isZero();
    }

    @Test
    @DisplayName("should complete with the last failing response once retries are spent")
    void shouldCompleteAfterExhaustion() throws Exception {
        StubTransport transport = StubTransport.always(503);
        startPool(transport);

        TransferRequest request = attachedRequest();
        TransferResponse response = pool.add(request).get(5, TimeUnit.SECONDS);

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(transport.getSendCount()).isEqualTo(4);
        assertThat(metrics.scrape()).contains("pool_test_retries_exhausted_total");
    }

    @Test
    @DisplayName("should fail the future on transport errors")
    void shouldFailOnTransportError() {
        StubTransport transport = StubTransport.always(200).failWith(new IOException("connection reset"));
        startPool(transport);

        TransferRequest request = attachedRequest();
        CompletableFuture<TransferResponse> future = pool.add(request);

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TransferException.class)
                .hasRootCauseInstanceOf(IOException.class);
        assertThat(request.getState()).isEqualTo(RequestState.ERROR);
        assertThat(coordinator.isTracked(request)).isFalse();
    }

    @Test
    @DisplayName("should fire a deferred retry only once the clock has passed its delay")
    void shouldHonorClockOnPoll() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        coordinator.configure(3, null, new ExponentialDelayStrategy(ChronoUnit.SECONDS));
        StubTransport transport = StubTransport.sequence(503, 200);
        pool = BatchPool.builder()
                .ringBufferSize(16)
                .pollIntervalMs(60_000)
                .clock(clock)
                .transport(transport)
                .metricsRegistry(metrics)
                .build();
        pool.start();

        TransferRequest request = attachedRequest();
        CompletableFuture<TransferResponse> future = pool.add(request);
        awaitCondition(() -> pool.getPendingDeferredCount() == 1);

        clock.advance(Duration.ofMillis(1_999));
        assertThat(pool.poll()).isZero();
        assertThat(future).isNotDone();

        clock.advance(Duration.ofMillis(1));
        assertThat(pool.poll()).isEqualTo(1);

        assertThat(future.get(5, TimeUnit.SECONDS).statusCode()).isEqualTo(200);
        assertThat(pool.getPendingDeferredCount()).isZero();
    }

    @Test
    @DisplayName("should drop an observer that throws and keep polling the others")
    void shouldDropFailingObserver() {
        startPool(StubTransport.always(200));
        pool.registerDeferred((context, now) -> {
            throw new IllegalStateException("broken observer");
        });
        pool.registerDeferred((context, now) -> false);

        assertThat(pool.poll()).isZero();
        assertThat(pool.getPendingDeferredCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reject requests before start")
    void shouldRejectWhenNotRunning() {
        pool = BatchPool.builder()
                .transport(StubTransport.always(200))
                .metricsRegistry(metrics)
                .build();

        TransferRequest request = attachedRequest();

        assertThatThrownBy(() -> pool.add(request))
                .isInstanceOfSatisfying(BackpressureException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(BackpressureException.BackpressureReason.POOL_NOT_RUNNING);
                    assertThat(e.getRequestId()).isEqualTo(request.getId());
                });
    }

    @Test
    @DisplayName("should fail pending futures on close")
    void shouldFailPendingOnClose() throws Exception {
        StubTransport transport = StubTransport.always(200).hang();
        startPool(transport);

        CompletableFuture<TransferResponse> future = pool.add(attachedRequest());
        awaitCondition(() -> transport.getSendCount() == 1);
        pool.close();

        assertThatThrownBy(() -> future.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(pool.isRunning()).isFalse();
    }

    @Test
    @DisplayName("should require a power of two ring buffer")
    void shouldValidateRingBufferSize() {
        assertThatThrownBy(() -> BatchPool.builder().ringBufferSize(100))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
