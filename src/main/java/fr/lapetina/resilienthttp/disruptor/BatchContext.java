package fr.lapetina.resilienthttp.disruptor;

import fr.lapetina.resilienthttp.domain.model.TransferRequest;
import fr.lapetina.resilienthttp.domain.model.TransferResponse;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * A dispatcher that sends many requests concurrently and drives deferred
 * work with its own poll cycle.
 *
 * Requests sent through a context carry a reference to it, which is how the
 * retry coordinator knows it must not block.
 */
public interface BatchContext {

    /**
     * Queues a request for sending.
     *
     * Adding a request that is already pending in this context returns the
     * same future.
     *
     * @return future completed when the request reaches a final state
     */
    CompletableFuture<TransferResponse> add(TransferRequest request);

    /**
     * Registers an observer to be offered every poll cycle until it removes itself.
     */
    void registerDeferred(DeferredObserver observer);

    /**
     * @return true if the observer was registered
     */
    boolean unregisterDeferred(DeferredObserver observer);

    /**
     * Clock used for deferred arm times and poll cycles.
     */
    Clock getClock();
}
