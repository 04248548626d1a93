package fr.lapetina.resilienthttp.retry;

import fr.lapetina.resilienthttp.domain.model.TransferRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Waits on the calling thread, then sends the request inline.
 *
 * Only for requests sent on their own: the caller's thread is blocked for
 * the whole delay.
 */
public final class SynchronousResender implements Resender {

    private static final Logger log = LoggerFactory.getLogger(SynchronousResender.class);

    private final Sleeper sleeper;

    public SynchronousResender() {
        this(Sleeper.system());
    }

    public SynchronousResender(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * An interrupted wait marks the request as failed instead of resending it.
     */
    @Override
    public void resend(TransferRequest request, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Retry wait interrupted: requestId={}, delayMs={}", request.getId(), delay.toMillis());
            request.fail(e);
            return;
        }
        request.send();
    }

    @Override
    public String getMode() {
        return "sync";
    }
}
