package gk.core.model;

/**
 * Supported rate limiting algorithms.
 *
 * - TOKEN_BUCKET: continuous refill, burst-friendly, O(1) memory
 * - SLIDING_WINDOW: exact rolling count from a timestamp log, O(limit) memory
 * - FIXED_WINDOW: counter reset at aligned boundaries, allows 2x at a boundary
 * - LEAKY_BUCKET: constant drain, smooths bursts into a steady rate
 * - ADAPTIVE: sliding window whose limit follows observed latency
 */
public enum RateLimitAlgorithm {
    TOKEN_BUCKET("token_bucket"),
    SLIDING_WINDOW("sliding_window"),
    FIXED_WINDOW("fixed_window"),
    LEAKY_BUCKET("leaky_bucket"),
    ADAPTIVE("adaptive");

    private final String wireName;

    RateLimitAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RateLimitAlgorithm fromWireName(String value) {
        return WireNames.parse(RateLimitAlgorithm.class, values(), RateLimitAlgorithm::wireName, value);
    }
}
