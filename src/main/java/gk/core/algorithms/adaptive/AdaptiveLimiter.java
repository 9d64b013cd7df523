package gk.core.algorithms.adaptive;

import gk.core.algorithms.sliding_window.SlidingWindowCounter;
import gk.core.clock.Clock;
import gk.core.model.Admission;
import gk.core.model.Limiter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Load-adaptive limiter:
 * a sliding window whose limit follows observed upstream latency.
 *
 * - latency is normalized to a load in [0, 1] (1000 ms = full load)
 * - systemLoad is an EMA of that load (factor {@code adaptationFactor}, default 0.1)
 * - performanceScore = max(0.1, 1 - systemLoad)
 * - currentLimit drifts towards base * performanceScore (factor 0.05), clamped to
 *   [0.1 * base, 2.0 * base]
 *
 * Thread-safety: synchronized.
 */
public final class AdaptiveLimiter implements Limiter {
    public static final double DEFAULT_ADAPTATION_FACTOR = 0.1;

    static final double LIMIT_SMOOTHING = 0.05;
    static final double MIN_LIMIT_FACTOR = 0.1;
    static final double MAX_LIMIT_FACTOR = 2.0;
    static final double MIN_PERFORMANCE_SCORE = 0.1;
    static final double FULL_LOAD_LATENCY_MILLIS = 1000.0;

    private final int baseMaxRequests;
    private final double adaptationFactor;
    private final SlidingWindowCounter window;

    private double currentLimit;
    private double systemLoad = 0.5;
    private double performanceScore = 1.0;

    public AdaptiveLimiter(Clock clock, long windowNanos, int baseMaxRequests) {
        this(clock, windowNanos, baseMaxRequests, DEFAULT_ADAPTATION_FACTOR);
    }

    public AdaptiveLimiter(Clock clock, long windowNanos, int baseMaxRequests, double adaptationFactor) {
        if (baseMaxRequests <= 0) throw new IllegalArgumentException("baseMaxRequests <= 0");
        if (!(adaptationFactor > 0 && adaptationFactor <= 1)) {
            throw new IllegalArgumentException("adaptationFactor must be in (0, 1]");
        }
        this.baseMaxRequests = baseMaxRequests;
        this.adaptationFactor = adaptationFactor;
        this.window = new SlidingWindowCounter(clock, windowNanos, baseMaxRequests);
        this.currentLimit = baseMaxRequests;
    }

    public boolean isAllowed() {
        return isAllowed(OptionalDouble.empty());
    }

    public synchronized boolean isAllowed(OptionalDouble observedLatencyMillis) {
        observedLatencyMillis.ifPresent(this::updateSystemLoad);
        adjustLimit();
        // the embedded window never goes to zero, even for tiny bases
        window.setMaxRequests(Math.max(1, (int) currentLimit));
        return window.tryAdmit();
    }

    @Override
    public synchronized Admission tryAcquire(int permits, OptionalDouble observedLatencyMillis) {
        if (isAllowed(observedLatencyMillis)) {
            return Admission.allow(window.remaining(), window.maxRequests(), window.resetAfterNanos());
        }
        return Admission.reject(window.maxRequests(), window.resetAfterNanos(), window.retryAfterNanos());
    }

    public synchronized double currentLimit() {
        return currentLimit;
    }

    public synchronized double systemLoad() {
        return systemLoad;
    }

    public synchronized double performanceScore() {
        return performanceScore;
    }

    @Override
    public synchronized Map<String, Object> snapshot() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("current_limit", Math.round(currentLimit * 100.0) / 100.0);
        state.put("system_load", Math.round(systemLoad * 1000.0) / 1000.0);
        state.put("performance_score", Math.round(performanceScore * 1000.0) / 1000.0);
        state.put("remaining_requests", window.remaining());
        return state;
    }

    @Override
    public long lastAccessNanos() {
        return window.lastAccessNanos();
    }

    @Override
    public long idleTimeoutNanos() {
        return window.idleTimeoutNanos();
    }

    private void updateSystemLoad(double latencyMillis) {
        if (Double.isNaN(latencyMillis)) throw new IllegalArgumentException("latency is NaN");
        double load = Math.min(1.0, Math.max(0.0, latencyMillis / FULL_LOAD_LATENCY_MILLIS));
        systemLoad += adaptationFactor * (load - systemLoad);
        performanceScore = Math.max(MIN_PERFORMANCE_SCORE, 1.0 - systemLoad);
    }

    private void adjustLimit() {
        double target = baseMaxRequests * performanceScore;
        // incremental form: exact once the limit sits on its target
        currentLimit += LIMIT_SMOOTHING * (target - currentLimit);
        currentLimit = Math.max(baseMaxRequests * MIN_LIMIT_FACTOR,
            Math.min(currentLimit, baseMaxRequests * MAX_LIMIT_FACTOR));
    }
}
