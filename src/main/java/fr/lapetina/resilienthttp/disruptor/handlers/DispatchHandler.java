package fr.lapetina.resilienthttp.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.resilienthttp.domain.event.DispatchEvent;
import fr.lapetina.resilienthttp.domain.model.RequestState;
import fr.lapetina.resilienthttp.domain.model.TransferException;
import fr.lapetina.resilienthttp.domain.model.TransferRequest;
import fr.lapetina.resilienthttp.domain.model.TransferResponse;
import fr.lapetina.resilienthttp.infrastructure.http.Transport;
import fr.lapetina.resilienthttp.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * First stage handler: hands the request to its transport without blocking.
 *
 * The response is applied to the request on the transport's callback thread.
 * Applying it notifies the request's listeners, so a retry coordinator may
 * reset the request for a deferred resend; the caller's future is completed
 * only if the request is still complete afterwards.
 */
public final class DispatchHandler implements EventHandler<DispatchEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final Transport defaultTransport;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final long requestTimeoutMs;

    public DispatchHandler(
            Transport defaultTransport,
            MetricsRegistry metricsRegistry,
            Clock clock,
            long requestTimeoutMs
    ) {
        this.defaultTransport = defaultTransport;
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    @Override
    public void onEvent(DispatchEvent event, long sequence, boolean endOfBatch) {
        TransferRequest request = event.getRequest();
        CompletableFuture<TransferResponse> future = event.getResponseFuture();
        if (request == null || future == null) {
            log.warn("Skipping empty dispatch event: sequence={}", sequence);
            return;
        }

        Transport transport = request.getTransport().orElse(defaultTransport);
        if (transport == null) {
            request.fail(new IllegalStateException("No transport configured"));
            future.completeExceptionally(new TransferException(request, "no transport configured"));
            return;
        }

        Instant startTime = clock.instant();
        event.markDispatched(startTime);
        request.setState(RequestState.TRANSFER);

        log.debug("Dispatching request: requestId={}, method={}, uri={}, sequence={}",
                request.getId(), request.getMethod(), request.getUri(), sequence);

        CompletableFuture<TransferResponse> transfer;
        try {
            transfer = transport.sendAsync(request);
        } catch (RuntimeException e) {
            transfer = CompletableFuture.failedFuture(e);
        }

        transfer
                .orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((response, throwable) ->
                        handleResponse(request, future, response, throwable, startTime));
    }

    private void handleResponse(
            TransferRequest request,
            CompletableFuture<TransferResponse> future,
            TransferResponse response,
            Throwable throwable,
            Instant startTime
    ) {
        Duration latency = Duration.between(startTime, clock.instant());

        if (throwable != null) {
            Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                    ? throwable.getCause()
                    : throwable;
            metricsRegistry.incrementTransportErrors();
            log.error("Request failed: requestId={}, uri={}, error={}, latencyMs={}",
                    request.getId(), request.getUri(), cause.toString(), latency.toMillis());
            request.fail(cause);
            future.completeExceptionally(new TransferException(request, cause));
            return;
        }

        metricsRegistry.incrementResponses(response.statusCode());
        metricsRegistry.recordTransferLatency(latency);

        request.complete(response);

        if (request.getState() == RequestState.COMPLETE && request.getResponse() == response) {
            log.info("Request completed: requestId={}, status={}, latencyMs={}",
                    request.getId(), response.statusCode(), latency.toMillis());
            future.complete(response);
        } else {
            log.debug("Request re-armed after response: requestId={}, status={}, state={}",
                    request.getId(), response.statusCode(), request.getState());
        }
    }
}
