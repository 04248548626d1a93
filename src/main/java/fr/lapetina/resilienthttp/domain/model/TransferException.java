package fr.lapetina.resilienthttp.domain.model;

/**
 * Thrown when a request could not be sent or produced no response.
 */
public final class TransferException extends RuntimeException {

    private final long requestId;

    public TransferException(TransferRequest request, Throwable cause) {
        super("Transfer failed: requestId=" + request.getId() + ", " + request.getMethod() + " "
                + request.getUri() + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.requestId = request.getId();
    }

    public TransferException(TransferRequest request, String message) {
        super("Transfer failed: requestId=" + request.getId() + ": " + message);
        this.requestId = request.getId();
    }

    public long getRequestId() {
        return requestId;
    }
}
