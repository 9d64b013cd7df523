package gk.core.clock;

/**
 * Deterministic clock for tests. The wall clock moves in lockstep with the monotonic one,
 * starting at {@code epochOffsetMillis}.
 */
public final class ManualClock implements Clock {
    private final long epochOffsetMillis;
    private volatile long now;

    public ManualClock(long startNanos) {
        this(startNanos, 0L);
    }

    public ManualClock(long startNanos, long epochOffsetMillis) {
        this.now = startNanos;
        this.epochOffsetMillis = epochOffsetMillis;
    }

    @Override
    public long nowNanos() {
        return now;
    }

    @Override
    public long epochMillis() {
        return epochOffsetMillis + now / 1_000_000L;
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void advanceSeconds(long seconds) {
        advanceNanos(seconds * 1_000_000_000L);
    }

    public void setNanos(long value) {
        now = value;
    }
}
