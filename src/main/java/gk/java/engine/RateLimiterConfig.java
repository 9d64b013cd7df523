package gk.java.engine;

import java.time.Duration;

/**
 * Engine-wide settings.
 *
 * @param defaultMaxRequests remaining quota reported when no rule applies
 * @param defaultWindowSeconds reset horizon reported when no rule applies
 * @param maxBurstMultiplier upper bound accepted for a rule's burst multiplier
 * @param bytesPerToken request size that costs one token bucket token
 * @param cleanupInterval period of the idle-state sweep
 * @param statsRetentionHours how long hourly usage counters are kept
 * @param eventQueueCapacity bound of the asynchronous event queue
 * @param mergeStrategy how remaining quota of several rules is reported
 */
public record RateLimiterConfig(
    int defaultMaxRequests,
    int defaultWindowSeconds,
    double maxBurstMultiplier,
    int bytesPerToken,
    Duration cleanupInterval,
    int statsRetentionHours,
    int eventQueueCapacity,
    MergeStrategy mergeStrategy
) {
    public RateLimiterConfig {
        if (defaultMaxRequests <= 0) throw new IllegalArgumentException("defaultMaxRequests must be > 0");
        if (defaultWindowSeconds <= 0) throw new IllegalArgumentException("defaultWindowSeconds must be > 0");
        if (maxBurstMultiplier < 1.0) throw new IllegalArgumentException("maxBurstMultiplier must be >= 1");
        if (bytesPerToken <= 0) throw new IllegalArgumentException("bytesPerToken must be > 0");
        if (cleanupInterval == null || cleanupInterval.isNegative() || cleanupInterval.isZero()) {
            throw new IllegalArgumentException("cleanupInterval must be > 0");
        }
        if (statsRetentionHours <= 0) throw new IllegalArgumentException("statsRetentionHours must be > 0");
        if (eventQueueCapacity <= 0) throw new IllegalArgumentException("eventQueueCapacity must be > 0");
        if (mergeStrategy == null) throw new IllegalArgumentException("mergeStrategy cannot be null");
    }

    public static RateLimiterConfig defaults() {
        return new RateLimiterConfig(100, 60, 5.0, 1024, Duration.ofHours(1), 24, 10_000,
            MergeStrategy.MOST_RESTRICTIVE);
    }

    public RateLimiterConfig withMergeStrategy(MergeStrategy strategy) {
        return new RateLimiterConfig(defaultMaxRequests, defaultWindowSeconds, maxBurstMultiplier, bytesPerToken,
            cleanupInterval, statsRetentionHours, eventQueueCapacity, strategy);
    }

    public RateLimiterConfig withCleanupInterval(Duration interval) {
        return new RateLimiterConfig(defaultMaxRequests, defaultWindowSeconds, maxBurstMultiplier, bytesPerToken,
            interval, statsRetentionHours, eventQueueCapacity, mergeStrategy);
    }

    public RateLimiterConfig withEventQueueCapacity(int capacity) {
        return new RateLimiterConfig(defaultMaxRequests, defaultWindowSeconds, maxBurstMultiplier, bytesPerToken,
            cleanupInterval, statsRetentionHours, capacity, mergeStrategy);
    }
}
