package gk.java.metrics;

import gk.java.engine.RateLimiter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Publishes the limiter's counters to a Micrometer registry.
 *
 * <p>Meters are sampled from {@link RateLimiter#getStatistics()} when the registry reads them;
 * nothing is recorded on the admission path.
 */
public final class RateLimiterMetrics implements MeterBinder {

    public static final String CHECKS = "gatekeeper.checks";
    public static final String EVALUATION_ERRORS = "gatekeeper.evaluation.errors";
    public static final String EVENTS_DROPPED = "gatekeeper.events.dropped";
    public static final String STATES_TRACKED = "gatekeeper.states.tracked";
    public static final String RULES_ACTIVE = "gatekeeper.rules.active";

    private final RateLimiter limiter;

    public RateLimiterMetrics(RateLimiter limiter) {
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        this.limiter = limiter;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        FunctionCounter.builder(CHECKS, limiter, l -> l.getStatistics().allowedRequests())
            .description("Admission checks")
            .tag("outcome", "allowed")
            .register(registry);
        FunctionCounter.builder(CHECKS, limiter, l -> l.getStatistics().blockedRequests())
            .description("Admission checks")
            .tag("outcome", "blocked")
            .register(registry);
        FunctionCounter.builder(EVALUATION_ERRORS, limiter, l -> l.getStatistics().evaluationErrors())
            .description("Rule evaluations that failed and were allowed through")
            .register(registry);
        FunctionCounter.builder(EVENTS_DROPPED, limiter, l -> l.getStatistics().droppedEvents())
            .description("Events dropped because the event queue was full")
            .register(registry);
        Gauge.builder(STATES_TRACKED, limiter, RateLimiter::trackedStates)
            .description("Per-caller algorithm states in memory")
            .register(registry);
        Gauge.builder(RULES_ACTIVE, limiter, l -> l.getStatistics().activeRules())
            .description("Enabled rules")
            .register(registry);
    }
}
