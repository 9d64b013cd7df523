package gk.java.engine;

import gk.core.model.Limiter;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry holding one quota's limiter with its associated lock.
 *
 * This class encapsulates:
 * - The limiter instance
 * - A ReentrantLock serializing admissions for this scope key
 * - The penalty deadline set by a BLOCK rule with a block duration
 * - The retired flag set when the idle sweep or a reset discards the entry
 *
 * Thread-safety:
 * - The lock must be held to read or write {@code blockedUntilNanos} and to retire the entry
 * - A caller that finds the entry retired after locking must look up a fresh one
 */
final class LimiterEntry {

    private final Limiter limiter;
    private final ReentrantLock lock;

    private long blockedUntilNanos = Long.MIN_VALUE;
    private long penaltyLimit;
    private volatile boolean retired;

    LimiterEntry(Limiter limiter) {
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        this.limiter = limiter;
        this.lock = new ReentrantLock(); // Non-fair for better throughput
    }

    Limiter getLimiter() {
        return limiter;
    }

    ReentrantLock getLock() {
        return lock;
    }

    /** MUST be called while holding the lock. */
    boolean isBlocked(long nowNanos) {
        return nowNanos < blockedUntilNanos;
    }

    /** MUST be called while holding the lock. */
    long blockedUntilNanos() {
        return blockedUntilNanos;
    }

    /**
     * MUST be called while holding the lock.
     *
     * @param limit the limiter's quota when the penalty started, reported while it lasts
     */
    void blockUntil(long deadlineNanos, long limit) {
        blockedUntilNanos = deadlineNanos;
        penaltyLimit = limit;
    }

    /** MUST be called while holding the lock. */
    long penaltyLimit() {
        return penaltyLimit;
    }

    boolean isRetired() {
        return retired;
    }

    /** MUST be called while holding the lock. */
    void retire() {
        retired = true;
    }

    /** Idle when untouched past the limiter's timeout and not serving a penalty. */
    boolean isIdle(long nowNanos) {
        return !isBlocked(nowNanos) && nowNanos - limiter.lastAccessNanos() >= limiter.idleTimeoutNanos();
    }
}
