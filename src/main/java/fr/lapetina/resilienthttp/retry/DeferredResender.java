package fr.lapetina.resilienthttp.retry;

import fr.lapetina.resilienthttp.disruptor.BatchContext;
import fr.lapetina.resilienthttp.domain.model.TransferRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Registers a {@link DeferredRetryObserver} with the request's batch context
 * and returns immediately.
 */
public final class DeferredResender implements Resender {

    private final Consumer<DeferredRetryObserver> onFire;

    public DeferredResender() {
        this(observer -> { });
    }

    /**
     * @param onFire passed to every observer, called once it has resubmitted its request
     */
    public DeferredResender(Consumer<DeferredRetryObserver> onFire) {
        this.onFire = onFire;
    }

    /**
     * @throws IllegalStateException if the request is not bound to a batch context
     */
    @Override
    public void resend(TransferRequest request, Duration delay) {
        BatchContext context = request.getBatchContext()
                .orElseThrow(() -> new IllegalStateException(
                        "Request is not bound to a batch context: requestId=" + request.getId()));
        Instant decidedAt = context.getClock().instant();
        context.registerDeferred(new DeferredRetryObserver(request, delay, decidedAt, onFire));
    }

    @Override
    public String getMode() {
        return "deferred";
    }
}
