package gk.core.algorithms.sliding_window;

import gk.core.clock.Clock;
import gk.core.model.Admission;
import gk.core.model.Limiter;

import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Exact sliding window (log):
 * keeps the timestamp of every admission; the deque is the ground truth.
 *
 * Pros: exact rolling count, no boundary burst.
 * Cons: O(maxRequests) memory per key.
 *
 * Eviction is a monotonic prefix walk: a timestamp at or before {@code now - window} leaves.
 *
 * Thread-safety: synchronized.
 */
public final class SlidingWindowCounter implements Limiter {
    private final Clock clock;
    private final long windowNanos;

    private int maxRequests;
    private long lastAccessNanos;
    private final ArrayDeque<Long> events = new ArrayDeque<>();

    public SlidingWindowCounter(Clock clock, long windowNanos, int maxRequests) {
        if (windowNanos <= 0) throw new IllegalArgumentException("window <= 0");
        if (maxRequests <= 0) throw new IllegalArgumentException("maxRequests <= 0");
        this.clock = clock;
        this.windowNanos = windowNanos;
        this.maxRequests = maxRequests;
        this.lastAccessNanos = clock.nowNanos();
    }

    public synchronized boolean tryAdmit() {
        long now = clock.nowNanos();
        lastAccessNanos = now;
        prune(now);

        if (events.size() < maxRequests) {
            events.addLast(now);
            return true;
        }
        return false;
    }

    public synchronized int remaining() {
        prune(clock.nowNanos());
        return Math.max(0, maxRequests - events.size());
    }

    /** Replaces the limit; used by the adaptive limiter before every admission. */
    public synchronized void setMaxRequests(int maxRequests) {
        if (maxRequests <= 0) throw new IllegalArgumentException("maxRequests <= 0");
        this.maxRequests = maxRequests;
    }

    public synchronized int maxRequests() {
        return maxRequests;
    }

    @Override
    public synchronized Admission tryAcquire(int permits, OptionalDouble observedLatencyMillis) {
        if (tryAdmit()) {
            return Admission.allow(maxRequests - events.size(), maxRequests, resetAfterNanos());
        }
        return Admission.reject(maxRequests, resetAfterNanos(), retryAfterNanos());
    }

    /** Time until the oldest admission leaves the window, freeing one slot. */
    public synchronized long retryAfterNanos() {
        Long oldest = events.peekFirst();
        if (oldest == null) return 0L;
        return (oldest + windowNanos) - clock.nowNanos();
    }

    /** Time until every current admission has left the window. */
    public synchronized long resetAfterNanos() {
        Long newest = events.peekLast();
        if (newest == null) return 0L;
        return (newest + windowNanos) - clock.nowNanos();
    }

    @Override
    public synchronized Map<String, Object> snapshot() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("remaining_requests", remaining());
        state.put("max_requests", maxRequests);
        state.put("window_seconds", windowNanos / 1_000_000_000L);
        return state;
    }

    @Override
    public synchronized long lastAccessNanos() {
        return lastAccessNanos;
    }

    @Override
    public long idleTimeoutNanos() {
        return 2 * windowNanos;
    }

    private void prune(long now) {
        long cutoff = now - windowNanos;
        while (!events.isEmpty() && events.peekFirst() <= cutoff) {
            events.removeFirst();
        }
    }
}
