package gk.java.engine;

import gk.core.clock.Clock;
import gk.core.model.RateLimitRule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Priority-ordered rule set.
 *
 * Mutators are serialized and publish a fresh immutable list (copy-on-write); readers take the
 * current list without locking. Order is priority descending, ties by registration sequence.
 * An updated rule keeps its sequence, so it keeps its place among equal priorities.
 */
final class RuleRegistry {

    private static final Comparator<RegisteredRule> ORDER = Comparator
        .comparingInt((RegisteredRule r) -> r.rule().priority()).reversed()
        .thenComparingLong(RegisteredRule::sequence);

    private final Clock clock;
    private final RuleValidator validator;
    private final LimiterFactory limiterFactory;

    private volatile List<RegisteredRule> snapshot = List.of();
    private long nextSequence;
    private long nextGeneration;

    RuleRegistry(Clock clock, RuleValidator validator, LimiterFactory limiterFactory) {
        this.clock = clock;
        this.validator = validator;
        this.limiterFactory = limiterFactory;
    }

    synchronized void add(RateLimitRule rule) {
        validator.validate(rule);
        if (indexOf(rule.id()) >= 0) {
            throw new InvalidRuleException("rule '" + rule.id() + "' already exists");
        }
        List<RegisteredRule> next = new ArrayList<>(snapshot);
        next.add(register(rule, nextSequence++));
        publish(next);
    }

    /**
     * Replaces a rule by id.
     *
     * @return the replaced rule
     * @throws UnknownRuleException if no rule has this id
     */
    synchronized RateLimitRule update(RateLimitRule rule) {
        validator.validate(rule);
        int index = indexOf(rule.id());
        if (index < 0) {
            throw new UnknownRuleException(rule.id());
        }
        List<RegisteredRule> next = new ArrayList<>(snapshot);
        RegisteredRule previous = next.get(index);
        next.set(index, register(rule, previous.sequence()));
        publish(next);
        return previous.rule();
    }

    synchronized Optional<RateLimitRule> remove(String ruleId) {
        int index = indexOf(ruleId);
        if (index < 0) {
            return Optional.empty();
        }
        List<RegisteredRule> next = new ArrayList<>(snapshot);
        RegisteredRule removed = next.remove(index);
        publish(next);
        return Optional.of(removed.rule());
    }

    /**
     * Toggles a rule without touching its registration time or its state.
     *
     * @return false if no rule has this id
     */
    synchronized boolean setEnabled(String ruleId, boolean enabled) {
        int index = indexOf(ruleId);
        if (index < 0) {
            return false;
        }
        List<RegisteredRule> next = new ArrayList<>(snapshot);
        RegisteredRule current = next.get(index);
        next.set(index, current.withRule(current.rule().withEnabled(enabled)));
        publish(next);
        return true;
    }

    Optional<RateLimitRule> get(String ruleId) {
        for (RegisteredRule registered : snapshot) {
            if (registered.id().equals(ruleId)) {
                return Optional.of(registered.rule());
            }
        }
        return Optional.empty();
    }

    List<RegisteredRule> snapshot() {
        return snapshot;
    }

    List<RateLimitRule> rules() {
        return snapshot.stream().map(RegisteredRule::rule).toList();
    }

    private RegisteredRule register(RateLimitRule rule, long sequence) {
        return new RegisteredRule(rule, limiterFactory.bind(clock, rule), clock.nowNanos(), sequence, nextGeneration++);
    }

    private int indexOf(String ruleId) {
        List<RegisteredRule> current = snapshot;
        for (int i = 0; i < current.size(); i++) {
            if (current.get(i).id().equals(ruleId)) {
                return i;
            }
        }
        return -1;
    }

    private void publish(List<RegisteredRule> next) {
        next.sort(ORDER);
        snapshot = List.copyOf(next);
    }
}
