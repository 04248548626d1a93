package fr.lapetina.resilienthttp.domain.event;

import fr.lapetina.resilienthttp.domain.model.TransferRequest;
import fr.lapetina.resilienthttp.domain.model.TransferResponse;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Ring buffer slot for one dispatch of a request.
 *
 * Mutable and reused across the ring buffer. Handlers must copy what they
 * need before handing work to another thread.
 */
public final class DispatchEvent {

    private TransferRequest request;
    private CompletableFuture<TransferResponse> responseFuture;
    private Instant acceptedAt;
    private Instant dispatchedAt;
    private long sequence = -1;

    public void clear() {
        this.request = null;
        this.responseFuture = null;
        this.acceptedAt = null;
        this.dispatchedAt = null;
        this.sequence = -1;
    }

    public void initialize(
            TransferRequest request,
            CompletableFuture<TransferResponse> responseFuture,
            Instant acceptedAt,
            long sequence
    ) {
        clear();
        this.request = request;
        this.responseFuture = responseFuture;
        this.acceptedAt = acceptedAt;
        this.sequence = sequence;
    }

    public void markDispatched(Instant at) {
        this.dispatchedAt = at;
    }

    public TransferRequest getRequest() {
        return request;
    }

    public CompletableFuture<TransferResponse> getResponseFuture() {
        return responseFuture;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "DispatchEvent{sequence=" + sequence
                + ", requestId=" + (request != null ? request.getId() : "none") + "}";
    }
}
