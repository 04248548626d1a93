package fr.lapetina.resilienthttp.retry;

import fr.lapetina.resilienthttp.disruptor.BatchContext;
import fr.lapetina.resilienthttp.disruptor.DeferredObserver;
import fr.lapetina.resilienthttp.domain.model.TransferRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Resubmits one request to its batch context once its delay has elapsed.
 *
 * Fires at most once, however many poll cycles call it concurrently.
 */
public final class DeferredRetryObserver implements DeferredObserver {

    private static final Logger log = LoggerFactory.getLogger(DeferredRetryObserver.class);

    private final TransferRequest request;
    private final Duration delay;
    private final Instant armAt;
    private final AtomicBoolean fired = new AtomicBoolean(false);
    private final Consumer<DeferredRetryObserver> onFire;

    public DeferredRetryObserver(TransferRequest request, Duration delay, Instant decidedAt) {
        this(request, delay, decidedAt, observer -> { });
    }

    /**
     * @param onFire called after the request has been resubmitted
     */
    public DeferredRetryObserver(
            TransferRequest request,
            Duration delay,
            Instant decidedAt,
            Consumer<DeferredRetryObserver> onFire
    ) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay must be non-negative: " + delay);
        }
        this.request = request;
        this.delay = delay;
        this.armAt = decidedAt.plus(delay);
        this.onFire = onFire;
    }

    /**
     * Resubmits the request if {@code now} has reached the arm time and this
     * observer has not fired yet. The observer unregisters itself before the
     * resubmission.
     */
    @Override
    public boolean update(BatchContext context, Instant now) {
        if (now.isBefore(armAt)) {
            return false;
        }
        if (!fired.compareAndSet(false, true)) {
            return false;
        }
        context.unregisterDeferred(this);
        log.debug("Deferred retry due: requestId={}, delayMs={}, lateByMs={}",
                request.getId(), delay.toMillis(), Duration.between(armAt, now).toMillis());
        context.add(request);
        onFire.accept(this);
        return true;
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(armAt);
    }

    public boolean hasFired() {
        return fired.get();
    }

    public TransferRequest getRequest() {
        return request;
    }

    public Duration getDelay() {
        return delay;
    }

    public Instant getArmAt() {
        return armAt;
    }

    @Override
    public String toString() {
        return "DeferredRetryObserver{requestId=" + request.getId() + ", armAt=" + armAt + ", fired=" + fired.get() + "}";
    }
}
