package gk.core.model;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Pure core contract: one instance holds the state of one quota for one caller.
 * No I/O, no threads. Implementations are internally synchronized.
 */
public interface Limiter {

    /**
     * Asks for one admission.
     *
     * @param permits units to take; only weighted algorithms (token bucket) honour more than one
     * @param observedLatencyMillis latest upstream latency, read by load-adaptive algorithms
     */
    Admission tryAcquire(int permits, OptionalDouble observedLatencyMillis);

    /** Algorithm-specific figures for status reporting. Does not consume. */
    Map<String, Object> snapshot();

    long lastAccessNanos();

    /** How long the state may stay untouched before it is safe to discard. */
    long idleTimeoutNanos();
}
