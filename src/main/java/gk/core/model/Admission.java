package gk.core.model;

/**
 * Outcome of asking one limiter for one admission.
 *
 * @param decision ALLOW or REJECT
 * @param remaining units still admissible right after this call
 * @param limit the quota the limiter currently enforces
 * @param resetAfterNanos time until the quota is fully available again
 * @param retryAfterNanos time until the next unit becomes admissible (0 when allowed)
 */
public record Admission(
    Decision decision,
    long remaining,
    long limit,
    long resetAfterNanos,
    long retryAfterNanos
) {
    public static Admission allow(long remaining, long limit, long resetAfterNanos) {
        return new Admission(Decision.ALLOW, Math.max(0L, remaining), limit, Math.max(0L, resetAfterNanos), 0L);
    }

    public static Admission reject(long limit, long resetAfterNanos, long retryAfterNanos) {
        return new Admission(Decision.REJECT, 0L, limit, Math.max(0L, resetAfterNanos), Math.max(0L, retryAfterNanos));
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }
}
