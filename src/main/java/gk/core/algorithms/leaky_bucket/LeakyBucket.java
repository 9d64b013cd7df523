package gk.core.algorithms.leaky_bucket;

import gk.core.clock.Clock;
import gk.core.model.Admission;
import gk.core.model.Limiter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Leaky Bucket:
 * a queue of {@code capacity} draining continuously at {@code leakPerSecond}.
 *
 * Unlike the token bucket it does not let a burst through at once; admissions above the leak
 * rate fill the bucket until it overflows.
 *
 * Thread-safety: synchronized.
 */
public final class LeakyBucket implements Limiter {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final Clock clock;
    private final long capacity;
    private final double leakPerSecond;
    private final long idleTimeoutNanos;

    private double waterLevel;
    private long lastLeakNanos;
    private long lastAccessNanos;

    public LeakyBucket(Clock clock, long capacity, double leakPerSecond) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (leakPerSecond <= 0) throw new IllegalArgumentException("leak <= 0");
        this.clock = clock;
        this.capacity = capacity;
        this.leakPerSecond = leakPerSecond;
        this.idleTimeoutNanos = nanosToDrain(2.0 * capacity);
        this.waterLevel = 0;
        this.lastLeakNanos = clock.nowNanos();
        this.lastAccessNanos = lastLeakNanos;
    }

    public synchronized boolean process() {
        lastAccessNanos = clock.nowNanos();
        leak();
        if (waterLevel < capacity) {
            waterLevel += 1;
            return true;
        }
        return false;
    }

    public synchronized double waterLevel() {
        leak();
        return waterLevel;
    }

    @Override
    public synchronized Admission tryAcquire(int permits, OptionalDouble observedLatencyMillis) {
        if (process()) {
            return Admission.allow((long) Math.floor(capacity - waterLevel), capacity, nanosToDrain(waterLevel));
        }
        // at least one nanosecond: the level has to drop strictly below capacity
        long retryAfter = Math.max(1L, nanosToDrain(waterLevel - capacity));
        return Admission.reject(capacity, nanosToDrain(waterLevel), retryAfter);
    }

    @Override
    public synchronized Map<String, Object> snapshot() {
        leak();
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("water_level", Math.round(waterLevel * 100.0) / 100.0);
        state.put("capacity", capacity);
        state.put("leak_rate", leakPerSecond);
        state.put("remaining_requests", (long) Math.floor(capacity - waterLevel));
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

    private void leak() {
        long now = clock.nowNanos();
        long elapsed = Math.max(0L, now - lastLeakNanos);
        if (elapsed == 0) return;

        waterLevel = Math.max(0, waterLevel - (elapsed / NANOS_PER_SECOND) * leakPerSecond);
        lastLeakNanos = now;
    }

    private long nanosToDrain(double water) {
        if (water <= 0) return 0L;
        return (long) Math.ceil(water / leakPerSecond * NANOS_PER_SECOND);
    }
}
