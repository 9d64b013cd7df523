package gk.java.engine;

import gk.core.clock.Clock;
import gk.core.model.Admission;
import gk.core.model.RateLimitAction;
import gk.core.model.RateLimitAlgorithm;
import gk.core.model.RateLimitHeaders;
import gk.core.model.RateLimitResult;
import gk.core.model.RateLimitRule;
import gk.core.model.RateLimitScope;
import gk.core.model.RateLimitStatistics;
import gk.core.model.RuleStatus;
import gk.core.model.UsageStatistics;
import gk.java.events.AsyncEventDispatcher;
import gk.java.events.RateLimitEvent;
import gk.java.events.RateLimitEventSink;
import gk.java.events.RateLimitEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe admission controller evaluating prioritized rules against per-caller state.
 *
 * Features:
 * - Rules matched by scope, scope value and endpoint glob, evaluated by priority
 * - One algorithm state per (rule, scope key), created lazily with an atomic get-or-create
 * - ReentrantLock per scope key; no global lock on the admission path
 * - Per-rule fail open: a rule that throws is logged, counted and left out of the merge
 * - Violation and rule-change events handed to a background dispatcher, never awaited
 * - Periodic sweep of idle state once {@link #start()} is called
 *
 * Usage example:
 * <pre>
 * RateLimiter limiter = new RateLimiter(SystemClock.instance(), RateLimiterConfig.defaults());
 * limiter.addRule(RateLimitRule.builder("per-ip")
 *     .scope(RateLimitScope.IP).maxRequests(100).windowSeconds(60).build());
 *
 * RateLimitResult result = limiter.checkRateLimit("10.0.0.1", RateLimitScope.IP, "/api/items");
 * if (!result.allowed()) {
 *     // Reject with result.headers(), including Retry-After
 * }
 * </pre>
 */
public final class RateLimiter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final Clock clock;
    private final RateLimiterConfig config;
    private final RuleRegistry registry;
    private final RuleMatcher matcher;
    private final ScopedStateStore states = new ScopedStateStore();
    private final RateLimitCounters counters = new RateLimitCounters();
    private final UsageTracker usage;
    private final AsyncEventDispatcher events;

    private ScheduledExecutorService sweeper;

    public RateLimiter(Clock clock, RateLimiterConfig config) {
        this(clock, config, RateLimitEventSink.noop(), RateLimiterFactory.standard());
    }

    public RateLimiter(Clock clock, RateLimiterConfig config, RateLimitEventSink eventSink) {
        this(clock, config, eventSink, RateLimiterFactory.standard());
    }

    /**
     * Creates a rate limiter.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param config Engine-wide settings
     * @param eventSink Receiver of violation and rule-change events, called off the request path
     * @param limiterFactory Binds each registered rule to its algorithm
     * @throws IllegalArgumentException if any parameter is null
     */
    public RateLimiter(Clock clock, RateLimiterConfig config, RateLimitEventSink eventSink,
                       LimiterFactory limiterFactory) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (eventSink == null) {
            throw new IllegalArgumentException("eventSink cannot be null");
        }
        if (limiterFactory == null) {
            throw new IllegalArgumentException("limiterFactory cannot be null");
        }
        this.clock = clock;
        this.config = config;
        this.registry = new RuleRegistry(clock, new RuleValidator(config.maxBurstMultiplier()), limiterFactory);
        this.matcher = new RuleMatcher(registry);
        this.usage = new UsageTracker(config.statsRetentionHours());
        this.events = new AsyncEventDispatcher(eventSink, config.eventQueueCapacity());
    }

    // ---------------------------------------------------------------- admission

    public RateLimitResult checkRateLimit(String identifier, RateLimitScope scope, String endpoint) {
        return checkRateLimit(identifier, scope, endpoint, OptionalDouble.empty(), 0L);
    }

    /**
     * Decides whether one request may proceed.
     *
     * Rules are evaluated in priority order. The first BLOCK rule that denies stops the evaluation
     * and decides the response; THROTTLE and WARN rules that deny only flag the result.
     *
     * @param identifier caller identity within the scope (IP, user id, api key...)
     * @param scope the dimension the identifier belongs to
     * @param endpoint request path, matched against rule endpoint patterns
     * @param observedLatencyMillis latest upstream latency, read by adaptive rules
     * @param requestSize request size in bytes; token bucket rules charge one token per
     *                    {@code bytesPerToken}, at least one
     * @return merged verdict with standard rate limit headers
     * @throws IllegalArgumentException if identifier or scope is null, requestSize is negative or
     *                                  the latency is not a finite number
     */
    public RateLimitResult checkRateLimit(String identifier, RateLimitScope scope, String endpoint,
                                          OptionalDouble observedLatencyMillis, long requestSize) {
        if (identifier == null) {
            throw new IllegalArgumentException("identifier cannot be null");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (requestSize < 0) {
            throw new IllegalArgumentException("requestSize must be >= 0");
        }
        if (observedLatencyMillis == null) {
            throw new IllegalArgumentException("observedLatencyMillis cannot be null, use OptionalDouble.empty()");
        }
        if (observedLatencyMillis.isPresent() && !Double.isFinite(observedLatencyMillis.getAsDouble())) {
            throw new IllegalArgumentException("observedLatencyMillis must be finite");
        }
        String path = endpoint == null ? "" : endpoint;

        long nowNanos = clock.nowNanos();
        long epochMillis = clock.epochMillis();
        int tokens = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, requestSize / config.bytesPerToken()));

        List<Evaluation> evaluated = new ArrayList<>();
        List<String> warnedRules = new ArrayList<>();
        Evaluation blocking = null;
        long throttleDelayNanos = -1L;
        int flagged = 0;

        for (RegisteredRule registered : matcher.findApplicable(identifier, scope, path, nowNanos)) {
            RateLimitRule rule = registered.rule();
            Admission admission;
            try {
                admission = admit(registered, identifier, nowNanos, tokens, observedLatencyMillis);
            } catch (RuntimeException e) {
                failOpen(rule, identifier, scope, e);
                continue;
            }

            Evaluation evaluation = new Evaluation(rule, admission);
            evaluated.add(evaluation);
            if (admission.allowed()) {
                continue;
            }

            counters.recordViolation(rule.id());
            switch (rule.action()) {
                case BLOCK -> blocking = evaluation;
                case THROTTLE -> throttleDelayNanos = Math.max(throttleDelayNanos, admission.retryAfterNanos());
                case WARN -> warnedRules.add(rule.id());
                case LOG_ONLY -> log.info("Rate limit exceeded (log only): rule={} identifier={} scope={} endpoint={}",
                    rule.id(), identifier, scope.wireName(), path);
            }
            if (rule.action() != RateLimitAction.LOG_ONLY) {
                flagged++;
                publishViolation(rule, identifier, scope, path, admission, epochMillis);
            }
            if (blocking != null) {
                break;
            }
        }

        RateLimitResult result = merge(evaluated, blocking, warnedRules, throttleDelayNanos, flagged, epochMillis);
        counters.recordCheck(result.allowed());
        usage.record(identifier, scope, !result.allowed(), epochMillis);
        return result;
    }

    /**
     * Asks one rule's state for an admission, serialized by the scope key's lock.
     * An entry retired by a concurrent sweep or reset is replaced and the call retried.
     */
    private Admission admit(RegisteredRule registered, String identifier, long nowNanos, int tokens,
                            OptionalDouble observedLatencyMillis) {
        RateLimitRule rule = registered.rule();
        ScopeKey key = ScopeKey.of(registered, identifier);
        int permits = rule.algorithm() == RateLimitAlgorithm.TOKEN_BUCKET ? tokens : 1;

        while (true) {
            LimiterEntry entry = states.getOrCreate(key, registered.stateFactory());
            ReentrantLock lock = entry.getLock();
            lock.lock();
            try {
                if (entry.isRetired()) {
                    continue;
                }
                if (entry.isBlocked(nowNanos)) {
                    long penaltyLeft = entry.blockedUntilNanos() - nowNanos;
                    return Admission.reject(entry.penaltyLimit(), penaltyLeft, penaltyLeft);
                }
                Admission admission = entry.getLimiter().tryAcquire(permits, observedLatencyMillis);
                if (!admission.allowed() && rule.action() == RateLimitAction.BLOCK && rule.blockDurationSeconds() > 0) {
                    long penalty = rule.blockDurationSeconds() * NANOS_PER_SECOND;
                    entry.blockUntil(nowNanos + penalty, admission.limit());
                    return Admission.reject(admission.limit(), Math.max(admission.resetAfterNanos(), penalty), penalty);
                }
                return admission;
            } finally {
                lock.unlock();
            }
        }
    }

    private RateLimitResult merge(List<Evaluation> evaluated, Evaluation blocking, List<String> warnedRules,
                                  long throttleDelayNanos, int flagged, long epochMillis) {
        boolean allowed = blocking == null;
        Evaluation binding = allowed ? mostRestrictive(evaluated) : blocking;

        long limit;
        long remaining;
        long resetAfterNanos;
        if (binding == null) {
            limit = config.defaultMaxRequests();
            remaining = config.defaultMaxRequests();
            resetAfterNanos = config.defaultWindowSeconds() * NANOS_PER_SECOND;
        } else {
            limit = binding.admission().limit();
            remaining = !allowed ? 0L
                : config.mergeStrategy() == MergeStrategy.WEIGHTED ? weightedRemaining(evaluated)
                : binding.admission().remaining();
            resetAfterNanos = binding.admission().resetAfterNanos();
        }
        Instant resetTime = Instant.ofEpochMilli(epochMillis).plusNanos(resetAfterNanos);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(RateLimitHeaders.LIMIT, Long.toString(limit));
        headers.put(RateLimitHeaders.REMAINING, Long.toString(remaining));
        headers.put(RateLimitHeaders.RESET, Long.toString(resetTime.getEpochSecond()));

        OptionalLong retryAfter = OptionalLong.empty();
        if (!allowed) {
            long seconds = Math.max(1L, ceilSeconds(blocking.admission().retryAfterNanos()));
            retryAfter = OptionalLong.of(seconds);
            headers.put(RateLimitHeaders.RETRY_AFTER, Long.toString(seconds));
        }
        boolean violation = flagged > 0;
        if (violation) {
            headers.put(RateLimitHeaders.VIOLATION, "true");
            headers.put(RateLimitHeaders.COUNT, Integer.toString(flagged));
        }
        if (!warnedRules.isEmpty()) {
            headers.put(RateLimitHeaders.WARNING, String.join(",", warnedRules));
        }
        OptionalLong throttleDelay = OptionalLong.empty();
        if (throttleDelayNanos >= 0) {
            long seconds = Math.max(1L, ceilSeconds(throttleDelayNanos));
            throttleDelay = OptionalLong.of(seconds);
            headers.put(RateLimitHeaders.THROTTLE_DELAY, Long.toString(seconds));
        }

        return new RateLimitResult(allowed, remaining, resetTime, headers, retryAfter, violation, flagged, throttleDelay);
    }

    /** Lowest remaining wins; on ties the higher-priority rule, which was evaluated first. */
    private static Evaluation mostRestrictive(List<Evaluation> evaluated) {
        Evaluation binding = null;
        for (Evaluation evaluation : evaluated) {
            if (binding == null || evaluation.admission().remaining() < binding.admission().remaining()) {
                binding = evaluation;
            }
        }
        return binding;
    }

    private static long weightedRemaining(List<Evaluation> evaluated) {
        double weightSum = 0;
        double weighted = 0;
        long minimum = Long.MAX_VALUE;
        for (Evaluation evaluation : evaluated) {
            long remaining = evaluation.admission().remaining();
            minimum = Math.min(minimum, remaining);
            double weight = evaluation.rule().weight();
            if (weight > 0) {
                weightSum += weight;
                weighted += weight * remaining;
            }
        }
        return weightSum > 0 ? (long) Math.floor(weighted / weightSum) : minimum;
    }

    private void failOpen(RateLimitRule rule, String identifier, RateLimitScope scope, RuntimeException e) {
        counters.recordEvaluationError();
        log.warn("Rule {} failed for identifier {}, allowing request", rule.id(), identifier, e);
        events.publish(new RateLimitEvent(RateLimitEventType.EVALUATION_ERROR, rule.id(), identifier, scope,
            rule.algorithm(), Instant.ofEpochMilli(clock.epochMillis()),
            Map.of("error", String.valueOf(e.getMessage()), "exception", e.getClass().getName())));
    }

    private void publishViolation(RateLimitRule rule, String identifier, RateLimitScope scope, String endpoint,
                                  Admission admission, long epochMillis) {
        log.debug("Rate limit exceeded: rule={} action={} identifier={} endpoint={}",
            rule.id(), rule.action().wireName(), identifier, endpoint);
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("action", rule.action().wireName());
        attributes.put("endpoint", endpoint);
        attributes.put("limit", Long.toString(admission.limit()));
        attributes.put("retry_after_seconds", Long.toString(Math.max(1L, ceilSeconds(admission.retryAfterNanos()))));
        events.publish(new RateLimitEvent(RateLimitEventType.VIOLATION, rule.id(), identifier, scope,
            rule.algorithm(), Instant.ofEpochMilli(epochMillis), attributes));
    }

    static long ceilSeconds(long nanos) {
        if (nanos <= 0) return 0L;
        return (nanos + NANOS_PER_SECOND - 1) / NANOS_PER_SECOND;
    }

    // ---------------------------------------------------------------- rules

    /**
     * Registers a rule. It applies from the next request on.
     *
     * @throws InvalidRuleException if the rule is malformed or its id is taken
     */
    public void addRule(RateLimitRule rule) {
        registry.add(rule);
        log.info("Added rate limit rule {} ({} {}/{}s, scope {}={}, priority {})", rule.id(),
            rule.algorithm().wireName(), rule.maxRequests(), rule.windowSeconds(),
            rule.scope().wireName(), rule.scopeValue(), rule.priority());
        publishRuleEvent(RateLimitEventType.RULE_ADDED, rule);
    }

    /**
     * Replaces the rule with the same id. All state of the old rule is discarded; state that an
     * in-flight request creates for the old rule afterwards is keyed to the old registration and
     * left to the idle sweep.
     *
     * @return the replaced rule
     * @throws UnknownRuleException if no rule has this id
     * @throws InvalidRuleException if the rule is malformed
     */
    public RateLimitRule updateRule(RateLimitRule rule) {
        RateLimitRule previous = registry.update(rule);
        int discarded = states.removeRule(rule.id());
        log.info("Updated rate limit rule {}, discarded {} states", rule.id(), discarded);
        publishRuleEvent(RateLimitEventType.RULE_UPDATED, rule);
        return previous;
    }

    public boolean removeRule(String ruleId) {
        Optional<RateLimitRule> removed = registry.remove(ruleId);
        if (removed.isEmpty()) {
            return false;
        }
        int discarded = states.removeRule(ruleId);
        log.info("Removed rate limit rule {}, discarded {} states", ruleId, discarded);
        publishRuleEvent(RateLimitEventType.RULE_REMOVED, removed.get());
        return true;
    }

    public boolean setRuleEnabled(String ruleId, boolean enabled) {
        boolean changed = registry.setEnabled(ruleId, enabled);
        if (changed) {
            log.info("{} rate limit rule {}", enabled ? "Enabled" : "Disabled", ruleId);
            registry.get(ruleId).ifPresent(rule -> publishRuleEvent(RateLimitEventType.RULE_UPDATED, rule));
        }
        return changed;
    }

    public Optional<RateLimitRule> getRule(String ruleId) {
        return registry.get(ruleId);
    }

    /** All rules in evaluation order, including disabled and expired ones. */
    public List<RateLimitRule> listRules() {
        return registry.rules();
    }

    private void publishRuleEvent(RateLimitEventType type, RateLimitRule rule) {
        events.publish(new RateLimitEvent(type, rule.id(), null, rule.scope(), rule.algorithm(),
            Instant.ofEpochMilli(clock.epochMillis()),
            Map.of("name", rule.name(), "max_requests", Integer.toString(rule.maxRequests()),
                "window_seconds", Integer.toString(rule.windowSeconds()))));
    }

    // ---------------------------------------------------------------- inspection

    /**
     * Reports, for every rule that applies to the request, the rule figures and the caller's
     * current state. Does not consume quota.
     */
    public List<RuleStatus> getStatus(String identifier, RateLimitScope scope, String endpoint) {
        if (identifier == null) {
            throw new IllegalArgumentException("identifier cannot be null");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        long nowNanos = clock.nowNanos();
        List<RuleStatus> statuses = new ArrayList<>();
        for (RegisteredRule registered : matcher.findApplicable(identifier, scope, endpoint == null ? "" : endpoint, nowNanos)) {
            RateLimitRule rule = registered.rule();
            Optional<LimiterEntry> entry = states.find(ScopeKey.of(registered, identifier));
            Map<String, Object> state = entry.map(e -> stateOf(e, nowNanos)).orElse(Map.of());
            statuses.add(new RuleStatus(rule.id(), rule.name(), rule.algorithm(), rule.maxRequests(),
                rule.windowSeconds(), rule.enabled(), entry.isPresent(), state));
        }
        return statuses;
    }

    private static Map<String, Object> stateOf(LimiterEntry entry, long nowNanos) {
        ReentrantLock lock = entry.getLock();
        lock.lock();
        try {
            Map<String, Object> state = new LinkedHashMap<>(entry.getLimiter().snapshot());
            if (entry.isBlocked(nowNanos)) {
                state.put("blocked_for_seconds", ceilSeconds(entry.blockedUntilNanos() - nowNanos));
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the caller's state for every rule that applies to the request.
     *
     * @return true if any state was cleared
     */
    public boolean reset(String identifier, RateLimitScope scope, String endpoint) {
        if (identifier == null) {
            throw new IllegalArgumentException("identifier cannot be null");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        int cleared = 0;
        for (RegisteredRule registered : matcher.findApplicable(identifier, scope, endpoint == null ? "" : endpoint,
                clock.nowNanos())) {
            if (states.remove(ScopeKey.of(registered, identifier))) {
                cleared++;
            }
        }
        log.info("Reset rate limits for {} {} on {}: {} states cleared", scope.wireName(), identifier, endpoint, cleared);
        events.publish(new RateLimitEvent(RateLimitEventType.RESET, null, identifier, scope, null,
            Instant.ofEpochMilli(clock.epochMillis()), Map.of("cleared", Integer.toString(cleared))));
        return cleared > 0;
    }

    public RateLimitStatistics getStatistics() {
        long total = counters.totalChecks();
        long allowed = counters.allowed();
        long blocked = counters.blocked();

        List<RateLimitRule> rules = registry.rules();
        Map<RateLimitAlgorithm, Integer> byAlgorithm = new EnumMap<>(RateLimitAlgorithm.class);
        Map<RateLimitScope, Integer> byScope = new EnumMap<>(RateLimitScope.class);
        int active = 0;
        for (RateLimitRule rule : rules) {
            if (!rule.enabled()) continue;
            active++;
            byAlgorithm.merge(rule.algorithm(), 1, Integer::sum);
            byScope.merge(rule.scope(), 1, Integer::sum);
        }

        return new RateLimitStatistics(
            total,
            allowed,
            blocked,
            percent(allowed, total),
            percent(blocked, total),
            counters.violationsByRule(),
            counters.evaluationErrors(),
            events.droppedCount(),
            states.size(),
            active,
            rules.size(),
            byAlgorithm,
            byScope
        );
    }

    public UsageStatistics getUsageStatistics(String identifier, RateLimitScope scope, int hoursBack) {
        if (identifier == null) {
            throw new IllegalArgumentException("identifier cannot be null");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        return usage.statistics(identifier, scope, hoursBack, clock.epochMillis());
    }

    public int trackedStates() {
        return states.size();
    }

    private static double percent(long part, long total) {
        if (total == 0) return 0.0;
        return Math.round(part * 10_000.0 / total) / 100.0;
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Removes idle algorithm states and usage counters past retention.
     *
     * @return number of entries removed
     */
    public int cleanupExpiredData() {
        int states = this.states.sweepIdle(clock.nowNanos());
        int buckets = usage.evictExpired(clock.epochMillis());
        if (states + buckets > 0) {
            log.debug("Cleanup removed {} idle states and {} usage buckets", states, buckets);
        }
        return states + buckets;
    }

    /**
     * Starts the periodic cleanup on a single daemon thread. Calling it twice has no effect.
     */
    public synchronized void start() {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "gatekeeper-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long periodMillis = config.cleanupInterval().toMillis();
        sweeper.scheduleAtFixedRate(this::sweep, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("Started idle state cleanup every {}", config.cleanupInterval());
    }

    private void sweep() {
        try {
            cleanupExpiredData();
        } catch (RuntimeException e) {
            // a failed run must not cancel the schedule
            log.warn("Idle state cleanup failed", e);
        }
    }

    /**
     * Waits until every event published so far has reached the sink.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitEvents(long timeout, TimeUnit unit) throws InterruptedException {
        return events.flush(timeout, unit);
    }

    public RateLimiterConfig config() {
        return config;
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
        events.close();
    }

    private record Evaluation(RateLimitRule rule, Admission admission) {
    }
}
