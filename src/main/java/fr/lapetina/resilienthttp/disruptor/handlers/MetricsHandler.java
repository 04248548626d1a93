package fr.lapetina.resilienthttp.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.resilienthttp.domain.event.DispatchEvent;
import fr.lapetina.resilienthttp.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Last stage handler: counts the dispatch, logs it with MDC context and
 * releases the slot's references.
 */
public final class MetricsHandler implements EventHandler<DispatchEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(DispatchEvent event, long sequence, boolean endOfBatch) {
        if (event.getRequest() == null) {
            event.clear();
            return;
        }

        MDC.put("requestId", Long.toString(event.getRequest().getId()));
        try {
            if (event.getDispatchedAt() != null) {
                metricsRegistry.incrementDispatches();
                if (event.getAcceptedAt() != null) {
                    Duration queueTime = Duration.between(event.getAcceptedAt(), event.getDispatchedAt());
                    log.debug("Dispatch recorded: sequence={}, queueMs={}", sequence, queueTime.toMillis());
                }
            }
        } finally {
            MDC.remove("requestId");
            event.clear();
        }
    }
}
