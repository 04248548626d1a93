package fr.lapetina.resilienthttp.retry;

import fr.lapetina.resilienthttp.domain.model.TransferRequest;

import java.time.Duration;

/**
 * Sends a request again once a delay has passed.
 *
 * The request is already back in the {@code NEW} state when this is called.
 */
public interface Resender {

    void resend(TransferRequest request, Duration delay);

    /**
     * Short label for logs and metrics.
     */
    String getMode();
}
