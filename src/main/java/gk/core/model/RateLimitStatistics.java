package gk.core.model;

import java.util.Map;

/**
 * Aggregate counters since start-up.
 */
public record RateLimitStatistics(
    long totalChecks,
    long allowedRequests,
    long blockedRequests,
    double allowanceRatePercent,
    double blockRatePercent,
    Map<String, Long> ruleViolations,
    long evaluationErrors,
    long droppedEvents,
    int trackedStates,
    int activeRules,
    int totalRules,
    Map<RateLimitAlgorithm, Integer> algorithmBreakdown,
    Map<RateLimitScope, Integer> scopeBreakdown
) {
    public RateLimitStatistics {
        ruleViolations = Map.copyOf(ruleViolations);
        algorithmBreakdown = Map.copyOf(algorithmBreakdown);
        scopeBreakdown = Map.copyOf(scopeBreakdown);
    }
}
