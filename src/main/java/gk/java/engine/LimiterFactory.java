package gk.java.engine;

import gk.core.clock.Clock;
import gk.core.model.Limiter;
import gk.core.model.RateLimitRule;

import java.util.function.Supplier;

/**
 * Decides, once per rule registration, how that rule's per-caller state is created.
 * The returned supplier is called on the first request of every new scope key.
 */
@FunctionalInterface
public interface LimiterFactory {
    Supplier<Limiter> bind(Clock clock, RateLimitRule rule);
}
