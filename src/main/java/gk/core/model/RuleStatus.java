package gk.core.model;

import java.util.Map;

/**
 * Per-rule view returned by status queries. {@code state} is empty while the caller has no state
 * for the rule yet.
 */
public record RuleStatus(
    String ruleId,
    String ruleName,
    RateLimitAlgorithm algorithm,
    int maxRequests,
    int windowSeconds,
    boolean enabled,
    boolean tracked,
    Map<String, Object> state
) {
    public RuleStatus {
        state = Map.copyOf(state);
    }
}
