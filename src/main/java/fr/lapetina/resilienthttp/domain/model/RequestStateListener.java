package fr.lapetina.resilienthttp.domain.model;

/**
 * Receives a request after each of its state transitions.
 *
 * Called on the thread that performed the transition, which for pooled
 * requests is a transport callback thread.
 */
@FunctionalInterface
public interface RequestStateListener {

    /**
     * @param request the request, already in its new state
     */
    void onRequestStateChange(TransferRequest request);
}
