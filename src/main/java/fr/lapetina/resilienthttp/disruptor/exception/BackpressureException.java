package fr.lapetina.resilienthttp.disruptor.exception;

/**
 * Thrown when a batch pool cannot accept a request, whether a first
 * submission or a deferred retry being resubmitted.
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;
    private final long requestId;

    public BackpressureException(BackpressureReason reason, long requestId) {
        super("Request rejected: requestId=" + requestId + ", " + reason.getDescription());
        this.reason = reason;
        this.requestId = requestId;
    }

    public BackpressureException(BackpressureReason reason, long requestId, String details) {
        super("Request rejected: requestId=" + requestId + ", " + reason.getDescription() + " (" + details + ")");
        this.reason = reason;
        this.requestId = requestId;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public long getRequestId() {
        return requestId;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("no free ring buffer slot"),
        POOL_NOT_RUNNING("pool not started or already closed");

        private final String description;

        BackpressureReason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }
}
