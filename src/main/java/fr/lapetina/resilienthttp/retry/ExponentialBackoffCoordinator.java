package fr.lapetina.resilienthttp.retry;

import fr.lapetina.resilienthttp.domain.model.RequestState;
import fr.lapetina.resilienthttp.domain.model.RequestStateListener;
import fr.lapetina.resilienthttp.domain.model.TransferRequest;
import fr.lapetina.resilienthttp.domain.model.TransferResponse;
import fr.lapetina.resilienthttp.domain.strategy.DelayStrategy;
import fr.lapetina.resilienthttp.domain.strategy.DelayStrategyFactory;
import fr.lapetina.resilienthttp.domain.strategy.ExponentialDelayStrategy;
import fr.lapetina.resilienthttp.infrastructure.config.ConfigChangeListener;
import fr.lapetina.resilienthttp.infrastructure.config.ResilientHttpConfig;
import fr.lapetina.resilienthttp.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Set;

/**
 * Retries requests whose response status is a configured failure code,
 * with a growing delay between attempts.
 *
 * Attached requests are re-evaluated on every state change. A request that
 * completes with a failure code is reset to {@code NEW} and resent until its
 * retry budget is spent; the last failing response is then left in place.
 * Requests bound to a batch context are resent through a deferred observer
 * and never block; others wait on the calling thread.
 *
 * Tracking ends when a request reaches a final outcome: a non-failure
 * response, a spent budget, or a transport error.
 */
public final class ExponentialBackoffCoordinator implements RequestStateListener, ConfigChangeListener {

    private static final Logger log = LoggerFactory.getLogger(ExponentialBackoffCoordinator.class);

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Set<Integer> DEFAULT_FAILURE_CODES = Set.of(500, 503);

    private final RetryState retryState = new RetryState();
    private final Resender synchronousResender;
    private final Resender deferredResender;
    private final MetricsRegistry metricsRegistry;

    private volatile RetryPolicy policy = new RetryPolicy(
            DEFAULT_MAX_RETRIES, DEFAULT_FAILURE_CODES, new ExponentialDelayStrategy());

    public ExponentialBackoffCoordinator() {
        this(null, Sleeper.system());
    }

    /**
     * @param metricsRegistry may be null to disable metrics
     * @param sleeper         used for the blocking wait of synchronous retries
     */
    public ExponentialBackoffCoordinator(MetricsRegistry metricsRegistry, Sleeper sleeper) {
        this(metricsRegistry,
                new SynchronousResender(sleeper),
                new DeferredResender(observer -> {
                    if (metricsRegistry != null) {
                        metricsRegistry.incrementDeferredFired();
                    }
                }));
    }

    public ExponentialBackoffCoordinator(
            MetricsRegistry metricsRegistry,
            Resender synchronousResender,
            Resender deferredResender
    ) {
        this.metricsRegistry = metricsRegistry;
        this.synchronousResender = synchronousResender;
        this.deferredResender = deferredResender;
    }

    /**
     * Starts tracking a request. Attaching it again keeps its retry count.
     */
    public void attach(TransferRequest request) {
        if (retryState.track(request.getId())) {
            log.debug("Request attached: requestId={}", request.getId());
        }
        request.addListener(this);
    }

    /**
     * Stops tracking a request and unsubscribes from its state changes.
     */
    public void detach(TransferRequest request) {
        retryState.release(request.getId());
        request.removeListener(this);
    }

    /**
     * Replaces the whole retry policy.
     *
     * @param maxRetries    clamped to 0 when negative
     * @param failureCodes  null for {@link #DEFAULT_FAILURE_CODES}
     * @param delayStrategy null for {@code 2^retries} seconds
     */
    public void configure(int maxRetries, Collection<Integer> failureCodes, DelayStrategy delayStrategy) {
        this.policy = new RetryPolicy(
                Math.max(0, maxRetries),
                failureCodes == null ? DEFAULT_FAILURE_CODES : Set.copyOf(failureCodes),
                delayStrategy == null ? new ExponentialDelayStrategy() : delayStrategy
        );
        log.info("Retry policy configured: maxRetries={}, failureCodes={}, delayStrategy={}",
                policy.maxRetries(), policy.failureCodes(), policy.delayStrategy().getName());
    }

    @Override
    public void onRequestStateChange(TransferRequest request) {
        long id = request.getId();
        if (!retryState.isTracked(id)) {
            return;
        }

        RequestState state = request.getState();
        if (state == RequestState.ERROR) {
            log.debug("Request ended with transport error, not retried: requestId={}", id);
            detach(request);
            return;
        }
        if (state != RequestState.COMPLETE) {
            return;
        }

        RetryPolicy current = policy;
        TransferResponse response = request.getResponse();
        if (response == null || !current.failureCodes().contains(response.statusCode())) {
            detach(request);
            return;
        }

        if (retryState.count(id) >= current.maxRetries()) {
            log.warn("Retry budget exhausted: requestId={}, status={}, retries={}",
                    id, response.statusCode(), retryState.count(id));
            if (metricsRegistry != null) {
                metricsRegistry.incrementRetriesExhausted();
            }
            detach(request);
            return;
        }

        int retries = retryState.increment(id);
        Duration delay = current.delayStrategy().delayFor(retries);
        if (delay == null || delay.isNegative()) {
            log.warn("Delay strategy returned an invalid delay, resending now: requestId={}, strategy={}, delay={}",
                    id, current.delayStrategy().getName(), delay);
            delay = Duration.ZERO;
        }
        Resender resender = request.getBatchContext().isPresent() ? deferredResender : synchronousResender;

        log.info("Retrying request: requestId={}, status={}, retry={}/{}, delayMs={}, mode={}",
                id, response.statusCode(), retries, current.maxRetries(), delay.toMillis(), resender.getMode());
        if (metricsRegistry != null) {
            metricsRegistry.incrementRetries(resender.getMode());
        }

        request.setState(RequestState.NEW);
        resender.resend(request, delay);
    }

    /**
     * Applies the {@code retry} section of a (re)loaded configuration.
     * An unknown strategy or unit falls back to exponential seconds.
     */
    @Override
    public void onConfigChanged(ResilientHttpConfig oldConfig, ResilientHttpConfig newConfig) {
        ResilientHttpConfig.RetryConfig retry = newConfig.getRetry();
        ChronoUnit unit;
        try {
            unit = DelayStrategyFactory.parseUnit(retry.getDelayUnit());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid retry delay unit '{}', using seconds", retry.getDelayUnit());
            unit = ChronoUnit.SECONDS;
        }
        DelayStrategy strategy = DelayStrategyFactory.create(retry.getDelayStrategy(), unit).orElse(null);
        if (strategy == null) {
            log.warn("Unknown retry delay strategy '{}', using exponential", retry.getDelayStrategy());
            strategy = new ExponentialDelayStrategy(unit);
        }
        configure(retry.getMaxRetries(), retry.getFailureCodes(), strategy);
    }

    public int getMaxRetries() {
        return policy.maxRetries();
    }

    public void setMaxRetries(int maxRetries) {
        RetryPolicy current = policy;
        configure(maxRetries, current.failureCodes(), current.delayStrategy());
    }

    public Set<Integer> getFailureCodes() {
        return policy.failureCodes();
    }

    public void setFailureCodes(Collection<Integer> failureCodes) {
        RetryPolicy current = policy;
        configure(current.maxRetries(), failureCodes, current.delayStrategy());
    }

    public DelayStrategy getDelayStrategy() {
        return policy.delayStrategy();
    }

    public void setDelayStrategy(DelayStrategy delayStrategy) {
        RetryPolicy current = policy;
        configure(current.maxRetries(), current.failureCodes(), delayStrategy);
    }

    /**
     * Returns the retries already spent on a request, 0 if it is not tracked.
     */
    public int getRetryCount(TransferRequest request) {
        return retryState.count(request.getId());
    }

    public boolean isTracked(TransferRequest request) {
        return retryState.isTracked(request.getId());
    }

    public int getTrackedCount() {
        return retryState.size();
    }

    private record RetryPolicy(int maxRetries, Set<Integer> failureCodes, DelayStrategy delayStrategy) {
    }
}
