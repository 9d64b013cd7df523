package gk.java.events;

import gk.core.model.RateLimitAlgorithm;
import gk.core.model.RateLimitScope;

import java.time.Instant;
import java.util.Map;

/**
 * Audit record of a rule change or of a request that hit a rule.
 *
 * @param identifier caller identifier; null for rule changes
 * @param scope null for rule changes
 * @param algorithm null when the event is not tied to one rule
 */
public record RateLimitEvent(
    RateLimitEventType type,
    String ruleId,
    String identifier,
    RateLimitScope scope,
    RateLimitAlgorithm algorithm,
    Instant timestamp,
    Map<String, String> attributes
) {
    public RateLimitEvent {
        if (type == null) throw new IllegalArgumentException("type cannot be null");
        if (timestamp == null) throw new IllegalArgumentException("timestamp cannot be null");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
