package gk.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rate limit rule configuration. Immutable; changes go through the registry's update operations.
 *
 * @param id unique rule id
 * @param name human-readable name
 * @param algorithm the algorithm that enforces the quota
 * @param scope the dimension the quota is partitioned by
 * @param scopeValue exact identifier this rule applies to, or {@code *} for any
 * @param maxRequests quota per window
 * @param windowSeconds window length
 * @param burstMultiplier capacity multiplier for bucket algorithms (>= 1.0)
 * @param blockDurationSeconds penalty time after a BLOCK violation, 0 for none
 * @param action behaviour on violation
 * @param endpointPatterns glob patterns; empty matches every endpoint
 * @param priority higher is evaluated first
 * @param weight share in the weighted merge
 * @param ttlSeconds seconds after registration when the rule stops applying, null for never
 * @param enabled disabled rules are never matched
 * @param metadata algorithm tuning (e.g. {@code adaptation_factor})
 */
public record RateLimitRule(
    String id,
    String name,
    RateLimitAlgorithm algorithm,
    RateLimitScope scope,
    String scopeValue,
    int maxRequests,
    int windowSeconds,
    double burstMultiplier,
    int blockDurationSeconds,
    RateLimitAction action,
    List<String> endpointPatterns,
    int priority,
    double weight,
    Long ttlSeconds,
    boolean enabled,
    Map<String, String> metadata
) {
    public static final String WILDCARD = "*";

    public RateLimitRule {
        endpointPatterns = endpointPatterns == null ? List.of() : List.copyOf(endpointPatterns);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(id)
            .name(name)
            .algorithm(algorithm)
            .scope(scope)
            .scopeValue(scopeValue)
            .maxRequests(maxRequests)
            .windowSeconds(windowSeconds)
            .burstMultiplier(burstMultiplier)
            .blockDurationSeconds(blockDurationSeconds)
            .action(action)
            .endpointPatterns(endpointPatterns)
            .priority(priority)
            .weight(weight)
            .ttlSeconds(ttlSeconds)
            .enabled(enabled)
            .metadata(metadata);
    }

    public RateLimitRule withEnabled(boolean value) {
        return toBuilder().enabled(value).build();
    }

    public boolean matchesAnyIdentifier() {
        return WILDCARD.equals(scopeValue);
    }

    public static final class Builder {
        private final String id;
        private String name;
        private RateLimitAlgorithm algorithm = RateLimitAlgorithm.TOKEN_BUCKET;
        private RateLimitScope scope = RateLimitScope.GLOBAL;
        private String scopeValue = WILDCARD;
        private int maxRequests;
        private int windowSeconds;
        private double burstMultiplier = 1.0;
        private int blockDurationSeconds;
        private RateLimitAction action = RateLimitAction.BLOCK;
        private List<String> endpointPatterns = new ArrayList<>();
        private int priority;
        private double weight = 1.0;
        private Long ttlSeconds;
        private boolean enabled = true;
        private Map<String, String> metadata = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder algorithm(RateLimitAlgorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder scope(RateLimitScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder scopeValue(String scopeValue) {
            this.scopeValue = scopeValue;
            return this;
        }

        public Builder maxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
            return this;
        }

        public Builder windowSeconds(int windowSeconds) {
            this.windowSeconds = windowSeconds;
            return this;
        }

        public Builder burstMultiplier(double burstMultiplier) {
            this.burstMultiplier = burstMultiplier;
            return this;
        }

        public Builder blockDurationSeconds(int blockDurationSeconds) {
            this.blockDurationSeconds = blockDurationSeconds;
            return this;
        }

        public Builder action(RateLimitAction action) {
            this.action = action;
            return this;
        }

        public Builder endpointPatterns(List<String> patterns) {
            this.endpointPatterns = new ArrayList<>(Objects.requireNonNullElse(patterns, List.of()));
            return this;
        }

        public Builder endpointPattern(String pattern) {
            this.endpointPatterns.add(pattern);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder ttlSeconds(Long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = new LinkedHashMap<>(Objects.requireNonNullElse(metadata, Map.of()));
            return this;
        }

        public Builder metadata(String key, String value) {
            this.metadata.put(key, value);
            return this;
        }

        public RateLimitRule build() {
            return new RateLimitRule(
                id,
                name == null ? id : name,
                algorithm,
                scope,
                scopeValue,
                maxRequests,
                windowSeconds,
                burstMultiplier,
                blockDurationSeconds,
                action,
                endpointPatterns,
                priority,
                weight,
                ttlSeconds,
                enabled,
                metadata
            );
        }
    }
}
