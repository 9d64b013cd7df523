package gk.java.engine;

import gk.core.model.Limiter;
import gk.core.model.RateLimitRule;

import java.util.List;
import java.util.function.Supplier;

/**
 * A rule as the engine holds it: compiled endpoint patterns, its bound state factory, and the
 * registration facts used for ordering and TTL.
 */
final class RegisteredRule {

    private final RateLimitRule rule;
    private final List<GlobPattern> patterns;
    private final Supplier<Limiter> stateFactory;
    private final long registeredAtNanos;
    private final long sequence;
    private final long generation;

    RegisteredRule(RateLimitRule rule, Supplier<Limiter> stateFactory, long registeredAtNanos, long sequence,
                   long generation) {
        this.rule = rule;
        this.patterns = rule.endpointPatterns().stream().map(GlobPattern::compile).toList();
        this.stateFactory = stateFactory;
        this.registeredAtNanos = registeredAtNanos;
        this.sequence = sequence;
        this.generation = generation;
    }

    /** Same registration, new rule body. Only for changes that leave the algorithm parameters alone. */
    RegisteredRule withRule(RateLimitRule replacement) {
        return new RegisteredRule(replacement, stateFactory, registeredAtNanos, sequence, generation);
    }

    RateLimitRule rule() {
        return rule;
    }

    String id() {
        return rule.id();
    }

    Supplier<Limiter> stateFactory() {
        return stateFactory;
    }

    long sequence() {
        return sequence;
    }

    /** Unique per add or update; state created under another generation is never read. */
    long generation() {
        return generation;
    }

    boolean isExpired(long nowNanos) {
        Long ttl = rule.ttlSeconds();
        return ttl != null && nowNanos - registeredAtNanos >= ttl * 1_000_000_000L;
    }

    boolean matchesEndpoint(String endpoint) {
        if (patterns.isEmpty()) return true;
        for (GlobPattern pattern : patterns) {
            if (pattern.matches(endpoint)) return true;
        }
        return false;
    }
}
