package gk.core.algorithms.fixed_window;

import gk.core.clock.Clock;
import gk.core.model.Admission;
import gk.core.model.Limiter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Fixed Window:
 * counter reset at epoch-aligned boundaries ({@code floor(epoch / window) * window}).
 *
 * The epoch-to-monotonic offset is captured once at construction; window arithmetic stays on
 * {@link Clock#nowNanos()} after that.
 *
 * The reset happens inside the admitting call. A caller can get 2x maxRequests across a
 * boundary; that is the algorithm, not a bug.
 *
 * Thread-safety: synchronized.
 */
public final class FixedWindowCounter implements Limiter {
    private final Clock clock;
    private final long windowNanos;
    private final int maxRequests;
    private final long epochOffsetNanos;

    private long windowStart;
    private int count;
    private long lastAccessNanos;

    public FixedWindowCounter(Clock clock, long windowNanos, int maxRequests) {
        if (windowNanos <= 0) throw new IllegalArgumentException("window <= 0");
        if (maxRequests <= 0) throw new IllegalArgumentException("maxRequests <= 0");
        this.clock = clock;
        this.windowNanos = windowNanos;
        this.maxRequests = maxRequests;

        long now = clock.nowNanos();
        this.epochOffsetNanos = Math.multiplyExact(clock.epochMillis(), 1_000_000L) - now;
        this.windowStart = align(now);
        this.count = 0;
        this.lastAccessNanos = now;
    }

    public synchronized boolean tryAdmit() {
        long now = clock.nowNanos();
        lastAccessNanos = now;
        roll(now);

        if (count < maxRequests) {
            count++;
            return true;
        }
        return false;
    }

    public synchronized int remaining() {
        roll(clock.nowNanos());
        return Math.max(0, maxRequests - count);
    }

    @Override
    public synchronized Admission tryAcquire(int permits, OptionalDouble observedLatencyMillis) {
        if (tryAdmit()) {
            return Admission.allow(maxRequests - count, maxRequests, untilWindowEnd());
        }
        long untilReset = untilWindowEnd();
        return Admission.reject(maxRequests, untilReset, untilReset);
    }

    @Override
    public synchronized Map<String, Object> snapshot() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("remaining_requests", remaining());
        state.put("max_requests", maxRequests);
        state.put("window_reset_epoch_seconds", (clock.epochMillis() + untilWindowEnd() / 1_000_000L) / 1000L);
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

    private void roll(long now) {
        long start = align(now);
        if (start != windowStart) {
            windowStart = start;
            count = 0;
        }
    }

    private long untilWindowEnd() {
        return (windowStart + windowNanos) - clock.nowNanos();
    }

    private long align(long now) {
        return Math.floorDiv(now + epochOffsetNanos, windowNanos) * windowNanos - epochOffsetNanos;
    }
}
