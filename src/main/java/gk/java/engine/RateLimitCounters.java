package gk.java.engine;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Admission counters since start-up. Updates never block.
 */
final class RateLimitCounters {

    private final LongAdder totalChecks = new LongAdder();
    private final LongAdder allowed = new LongAdder();
    private final LongAdder blocked = new LongAdder();
    private final LongAdder evaluationErrors = new LongAdder();
    private final ConcurrentHashMap<String, LongAdder> violationsByRule = new ConcurrentHashMap<>();

    void recordCheck(boolean wasAllowed) {
        totalChecks.increment();
        (wasAllowed ? allowed : blocked).increment();
    }

    void recordViolation(String ruleId) {
        violationsByRule.computeIfAbsent(ruleId, id -> new LongAdder()).increment();
    }

    void recordEvaluationError() {
        evaluationErrors.increment();
    }

    long totalChecks() {
        return totalChecks.sum();
    }

    long allowed() {
        return allowed.sum();
    }

    long blocked() {
        return blocked.sum();
    }

    long evaluationErrors() {
        return evaluationErrors.sum();
    }

    Map<String, Long> violationsByRule() {
        Map<String, Long> copy = new TreeMap<>();
        violationsByRule.forEach((id, count) -> copy.put(id, count.sum()));
        return copy;
    }
}
