package gk.java.engine;

import gk.core.algorithms.adaptive.AdaptiveLimiter;
import gk.core.model.RateLimitAlgorithm;
import gk.core.model.RateLimitRule;

/**
 * Rejects malformed or contradictory rules before they become active.
 */
final class RuleValidator {

    static final String ADAPTATION_FACTOR = "adaptation_factor";

    /** Largest TTL whose nanosecond value fits in a long. */
    static final long MAX_TTL_SECONDS = Long.MAX_VALUE / 1_000_000_000L;

    private final double maxBurstMultiplier;

    RuleValidator(double maxBurstMultiplier) {
        this.maxBurstMultiplier = maxBurstMultiplier;
    }

    void validate(RateLimitRule rule) {
        if (rule == null) throw new InvalidRuleException("rule cannot be null");
        if (isBlank(rule.id())) throw new InvalidRuleException("rule id must not be blank");
        String prefix = "rule '" + rule.id() + "': ";

        if (isBlank(rule.name())) throw new InvalidRuleException(prefix + "name must not be blank");
        if (rule.algorithm() == null) throw new InvalidRuleException(prefix + "algorithm is required");
        if (rule.scope() == null) throw new InvalidRuleException(prefix + "scope is required");
        if (rule.action() == null) throw new InvalidRuleException(prefix + "action is required");
        if (isBlank(rule.scopeValue())) throw new InvalidRuleException(prefix + "scope value must not be blank");
        if (rule.maxRequests() <= 0) throw new InvalidRuleException(prefix + "max_requests must be > 0");
        if (rule.windowSeconds() <= 0) throw new InvalidRuleException(prefix + "window_seconds must be > 0");

        if (Double.isNaN(rule.burstMultiplier()) || rule.burstMultiplier() < 1.0) {
            throw new InvalidRuleException(prefix + "burst_multiplier must be >= 1.0");
        }
        if (rule.burstMultiplier() > maxBurstMultiplier) {
            throw new InvalidRuleException(prefix + "burst_multiplier exceeds " + maxBurstMultiplier);
        }
        if (rule.blockDurationSeconds() < 0) {
            throw new InvalidRuleException(prefix + "block_duration_seconds must be >= 0");
        }
        if (!Double.isFinite(rule.weight()) || rule.weight() < 0) {
            throw new InvalidRuleException(prefix + "weight must be a finite number >= 0");
        }
        if (rule.ttlSeconds() != null && rule.ttlSeconds() <= 0) {
            throw new InvalidRuleException(prefix + "ttl must be > 0 when set");
        }
        if (rule.ttlSeconds() != null && rule.ttlSeconds() > MAX_TTL_SECONDS) {
            throw new InvalidRuleException(prefix + "ttl must be <= " + MAX_TTL_SECONDS);
        }
        if (rule.algorithm() == RateLimitAlgorithm.ADAPTIVE) {
            adaptationFactor(rule);
        }
    }

    /** Reads the adaptive smoothing factor from the rule metadata. */
    static double adaptationFactor(RateLimitRule rule) {
        String raw = rule.metadata().get(ADAPTATION_FACTOR);
        if (raw == null) return AdaptiveLimiter.DEFAULT_ADAPTATION_FACTOR;
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRuleException("rule '" + rule.id() + "': adaptation_factor is not a number: " + raw, e);
        }
        if (!(value > 0 && value <= 1)) {
            throw new InvalidRuleException("rule '" + rule.id() + "': adaptation_factor must be in (0, 1]");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
