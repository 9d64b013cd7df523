package gk.core.algorithms.token_bucket;

import gk.core.clock.Clock;
import gk.core.model.Admission;
import gk.core.model.Limiter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Token Bucket:
 * - capacity: tokens max (max_requests * burst_multiplier)
 * - refillTokensPerSecond: continuous refill, not discrete ticks
 *
 * A request may cost more than one token (weighted by size); heavier requests drain the
 * bucket faster. A failed consume leaves the bucket untouched.
 *
 * Thread-safety: synchronized.
 */
public final class TokenBucket implements Limiter {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final Clock clock;
    private final long capacity;
    private final double refillTokensPerSecond;
    private final long idleTimeoutNanos;

    private double tokens;
    private long lastNanos;
    private long lastAccessNanos;

    public TokenBucket(Clock clock, long capacity, double refillTokensPerSecond) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (refillTokensPerSecond <= 0) throw new IllegalArgumentException("refill <= 0");
        this.clock = clock;
        this.capacity = capacity;
        this.refillTokensPerSecond = refillTokensPerSecond;
        // idle for twice the time it takes to refill from empty
        this.idleTimeoutNanos = nanosToRefill(2.0 * capacity);
        this.tokens = capacity;
        this.lastNanos = clock.nowNanos();
        this.lastAccessNanos = lastNanos;
    }

    /**
     * Takes {@code n} tokens if they are all available.
     */
    public synchronized boolean consume(int n) {
        if (n <= 0) throw new IllegalArgumentException("tokens <= 0");
        refill();
        if (tokens >= n) {
            tokens -= n;
            return true;
        }
        return false;
    }

    public synchronized double remainingTokens() {
        refill();
        return tokens;
    }

    @Override
    public synchronized Admission tryAcquire(int permits, OptionalDouble observedLatencyMillis) {
        lastAccessNanos = clock.nowNanos();
        if (consume(permits)) {
            return Admission.allow((long) Math.floor(tokens), capacity, nanosToRefill(capacity - tokens));
        }
        return Admission.reject(capacity, nanosToRefill(capacity - tokens), nanosToRefill(permits - tokens));
    }

    @Override
    public synchronized Map<String, Object> snapshot() {
        refill();
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("remaining_tokens", Math.round(tokens * 100.0) / 100.0);
        state.put("capacity", capacity);
        state.put("refill_rate", refillTokensPerSecond);
        return state;
    }

    @Override
    public synchronized long lastAccessNanos() {
        return lastAccessNanos;
    }

    @Override
    public long idleTimeoutNanos() {
        return idleTimeoutNanos;
    }

    private void refill() {
        long now = clock.nowNanos();
        long elapsed = Math.max(0L, now - lastNanos);
        if (elapsed == 0) return;

        tokens = Math.min(capacity, tokens + (elapsed / NANOS_PER_SECOND) * refillTokensPerSecond);
        lastNanos = now;
    }

    private long nanosToRefill(double missingTokens) {
        if (missingTokens <= 0) return 0L;
        return (long) Math.ceil(missingTokens / refillTokensPerSecond * NANOS_PER_SECOND);
    }
}
