package fr.lapetina.resilienthttp.infrastructure.http;

import fr.lapetina.resilienthttp.domain.model.TransferRequest;
import fr.lapetina.resilienthttp.domain.model.TransferResponse;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Sends a request over the wire and produces its response.
 *
 * A transport never changes the request's state; callers do that with the
 * returned response. Implementations must be thread-safe.
 */
public interface Transport {

    /**
     * Sends the request and blocks until the response arrives.
     *
     * @throws IOException if no response could be obtained
     */
    TransferResponse send(TransferRequest request) throws IOException, InterruptedException;

    /**
     * Sends the request without blocking the calling thread.
     * The future fails with the transport error if no response could be obtained.
     */
    CompletableFuture<TransferResponse> sendAsync(TransferRequest request);
}
