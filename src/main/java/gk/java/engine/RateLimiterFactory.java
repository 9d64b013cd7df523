package gk.java.engine;

import gk.core.algorithms.adaptive.AdaptiveLimiter;
import gk.core.algorithms.fixed_window.FixedWindowCounter;
import gk.core.algorithms.leaky_bucket.LeakyBucket;
import gk.core.algorithms.sliding_window.SlidingWindowCounter;
import gk.core.algorithms.token_bucket.TokenBucket;
import gk.core.clock.Clock;
import gk.core.model.Limiter;
import gk.core.model.RateLimitRule;

import java.util.function.Supplier;

/**
 * Standard factory: maps a rule's algorithm to the matching primitive.
 *
 * The algorithm switch runs once, when the rule is bound; the bound supplier carries the
 * derived parameters (capacity, refill/leak rate, window) and does no branching.
 *
 * Thread-safety: This class is stateless and thread-safe.
 */
public final class RateLimiterFactory implements LimiterFactory {

    private static final RateLimiterFactory STANDARD = new RateLimiterFactory();
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private RateLimiterFactory() {
    }

    public static LimiterFactory standard() {
        return STANDARD;
    }

    /**
     * Binds a rule to its algorithm.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param rule A validated rule
     * @return supplier of fresh state for one scope key
     */
    @Override
    public Supplier<Limiter> bind(Clock clock, RateLimitRule rule) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (rule == null) throw new IllegalArgumentException("rule cannot be null");

        long windowNanos = rule.windowSeconds() * NANOS_PER_SECOND;
        int maxRequests = rule.maxRequests();

        return switch (rule.algorithm()) {
            case TOKEN_BUCKET -> {
                long capacity = burstCapacity(rule);
                double refillPerSecond = (double) maxRequests / rule.windowSeconds();
                yield () -> new TokenBucket(clock, capacity, refillPerSecond);
            }
            case SLIDING_WINDOW -> () -> new SlidingWindowCounter(clock, windowNanos, maxRequests);
            case FIXED_WINDOW -> () -> new FixedWindowCounter(clock, windowNanos, maxRequests);
            case LEAKY_BUCKET -> {
                long capacity = burstCapacity(rule);
                double leakPerSecond = (double) maxRequests / rule.windowSeconds();
                yield () -> new LeakyBucket(clock, capacity, leakPerSecond);
            }
            case ADAPTIVE -> {
                double adaptationFactor = RuleValidator.adaptationFactor(rule);
                yield () -> new AdaptiveLimiter(clock, windowNanos, maxRequests, adaptationFactor);
            }
        };
    }

    static long burstCapacity(RateLimitRule rule) {
        return Math.max(1L, (long) Math.floor(rule.maxRequests() * rule.burstMultiplier()));
    }
}
