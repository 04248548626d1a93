package fr.lapetina.resilienthttp.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates dispatch events for the ring buffer.
 */
public final class DispatchEventFactory implements EventFactory<DispatchEvent> {

    @Override
    public DispatchEvent newInstance() {
        return new DispatchEvent();
    }
}
