package fr.lapetina.resilienthttp.retry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retry counts keyed by request id.
 *
 * Counters for different requests are independent; the map itself does not
 * enforce any maximum.
 */
public final class RetryState {

    private final Map<Long, AtomicInteger> counts = new ConcurrentHashMap<>();

    /**
     * Starts tracking a request with a count of 0. An existing count is kept.
     *
     * @return true if the request was not tracked before
     */
    public boolean track(long requestId) {
        return counts.putIfAbsent(requestId, new AtomicInteger()) == null;
    }

    public boolean isTracked(long requestId) {
        return counts.containsKey(requestId);
    }

    /**
     * @return the new count
     * @throws IllegalStateException if the request is not tracked
     */
    public int increment(long requestId) {
        AtomicInteger count = counts.get(requestId);
        if (count == null) {
            throw new IllegalStateException("Request not tracked: " + requestId);
        }
        return count.incrementAndGet();
    }

    /**
     * @return the current count, or 0 if the request is not tracked
     */
    public int count(long requestId) {
        AtomicInteger count = counts.get(requestId);
        return count == null ? 0 : count.get();
    }

    /**
     * Stops tracking a request.
     *
     * @return true if it was tracked
     */
    public boolean release(long requestId) {
        return counts.remove(requestId) != null;
    }

    public int size() {
        return counts.size();
    }
}
