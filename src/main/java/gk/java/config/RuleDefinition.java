package gk.java.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import gk.core.model.RateLimitAction;
import gk.core.model.RateLimitAlgorithm;
import gk.core.model.RateLimitRule;
import gk.core.model.RateLimitScope;
import gk.java.engine.InvalidRuleException;

import java.util.List;
import java.util.Map;

/**
 * JSON form of a rule. Absent fields take the rule defaults.
 *
 * <p>Enum fields use their lowercase wire names ({@code token_bucket}, {@code api_key},
 * {@code log_only}).
 */
public record RuleDefinition(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("scope") String scope,
    @JsonProperty("scope_value") String scopeValue,
    @JsonProperty("max_requests") Integer maxRequests,
    @JsonProperty("window_seconds") Integer windowSeconds,
    @JsonProperty("burst_multiplier") Double burstMultiplier,
    @JsonProperty("block_duration_seconds") Integer blockDurationSeconds,
    @JsonProperty("action") String action,
    @JsonProperty("endpoint_patterns") List<String> endpointPatterns,
    @JsonProperty("priority") Integer priority,
    @JsonProperty("weight") Double weight,
    @JsonProperty("ttl_seconds") @JsonAlias("ttl") Long ttlSeconds,
    @JsonProperty("enabled") Boolean enabled,
    @JsonProperty("metadata") Map<String, String> metadata
) {

    /**
     * Converts this definition to a rule. Field ranges are checked when the rule is registered.
     *
     * @throws InvalidRuleException if an enum value is unknown or a required field is missing
     */
    public RateLimitRule toModel() {
        if (id == null || id.isBlank()) {
            throw new InvalidRuleException("rule definition without id");
        }
        if (maxRequests == null || windowSeconds == null) {
            throw new InvalidRuleException("rule '" + id + "': max_requests and window_seconds are required");
        }
        RateLimitRule.Builder builder = RateLimitRule.builder(id)
            .name(name)
            .maxRequests(maxRequests)
            .windowSeconds(windowSeconds)
            .endpointPatterns(endpointPatterns)
            .ttlSeconds(ttlSeconds)
            .metadata(metadata);
        try {
            if (algorithm != null) builder.algorithm(RateLimitAlgorithm.fromWireName(algorithm));
            if (scope != null) builder.scope(RateLimitScope.fromWireName(scope));
            if (action != null) builder.action(RateLimitAction.fromWireName(action));
        } catch (IllegalArgumentException e) {
            throw new InvalidRuleException("rule '" + id + "': " + e.getMessage(), e);
        }
        if (scopeValue != null) builder.scopeValue(scopeValue);
        if (burstMultiplier != null) builder.burstMultiplier(burstMultiplier);
        if (blockDurationSeconds != null) builder.blockDurationSeconds(blockDurationSeconds);
        if (priority != null) builder.priority(priority);
        if (weight != null) builder.weight(weight);
        if (enabled != null) builder.enabled(enabled);
        return builder.build();
    }

    public static RuleDefinition fromModel(RateLimitRule rule) {
        return new RuleDefinition(
            rule.id(),
            rule.name(),
            rule.algorithm().wireName(),
            rule.scope().wireName(),
            rule.scopeValue(),
            rule.maxRequests(),
            rule.windowSeconds(),
            rule.burstMultiplier(),
            rule.blockDurationSeconds(),
            rule.action().wireName(),
            rule.endpointPatterns(),
            rule.priority(),
            rule.weight(),
            rule.ttlSeconds(),
            rule.enabled(),
            rule.metadata()
        );
    }
}
