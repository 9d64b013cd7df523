package gk.java.engine;

import gk.core.model.RateLimitRule;
import gk.core.model.RateLimitScope;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects the rules that apply to one request, in evaluation order.
 */
final class RuleMatcher {

    private final RuleRegistry registry;

    RuleMatcher(RuleRegistry registry) {
        this.registry = registry;
    }

    List<RegisteredRule> findApplicable(String identifier, RateLimitScope scope, String endpoint, long nowNanos) {
        List<RegisteredRule> applicable = new ArrayList<>();
        for (RegisteredRule registered : registry.snapshot()) {
            RateLimitRule rule = registered.rule();
            if (!rule.enabled() || rule.scope() != scope) continue;
            if (!rule.matchesAnyIdentifier() && !rule.scopeValue().equals(identifier)) continue;
            if (!registered.matchesEndpoint(endpoint)) continue;
            if (registered.isExpired(nowNanos)) continue;
            applicable.add(registered);
        }
        return applicable;
    }
}
