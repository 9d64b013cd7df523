package gk.java.engine;

import gk.core.model.Limiter;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * All per-caller algorithm state, one {@link LimiterEntry} per {@link ScopeKey}.
 *
 * Creation is an atomic get-or-create on a {@link ConcurrentHashMap}, so a race on a new key
 * yields exactly one entry. Removal always retires the entry under its own lock first; an
 * admission that locked a retired entry retries and gets a fresh one.
 */
final class ScopedStateStore {

    private final ConcurrentHashMap<ScopeKey, LimiterEntry> states = new ConcurrentHashMap<>();

    LimiterEntry getOrCreate(ScopeKey key, Supplier<Limiter> factory) {
        LimiterEntry entry = states.get(key);
        if (entry != null) {
            return entry;
        }
        return states.computeIfAbsent(key, k -> new LimiterEntry(factory.get()));
    }

    Optional<LimiterEntry> find(ScopeKey key) {
        return Optional.ofNullable(states.get(key));
    }

    /**
     * Discards the state of one scope key.
     *
     * @return true if state existed
     */
    boolean remove(ScopeKey key) {
        LimiterEntry entry = states.get(key);
        return entry != null && retireAndRemove(key, entry);
    }

    /** Discards every state owned by a rule id, across all its registrations. */
    int removeRule(String ruleId) {
        int removed = 0;
        for (Map.Entry<ScopeKey, LimiterEntry> e : states.entrySet()) {
            if (e.getKey().ruleId().equals(ruleId) && retireAndRemove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Removes entries idle past their limiter's timeout. Entries whose lock is busy are in use
     * and skipped, so the sweep never waits on an admission.
     */
    int sweepIdle(long nowNanos) {
        int removed = 0;
        for (Map.Entry<ScopeKey, LimiterEntry> e : states.entrySet()) {
            LimiterEntry entry = e.getValue();
            ReentrantLock lock = entry.getLock();
            if (!lock.tryLock()) {
                continue;
            }
            try {
                if (!entry.isRetired() && entry.isIdle(nowNanos)) {
                    entry.retire();
                    if (states.remove(e.getKey(), entry)) {
                        removed++;
                    }
                }
            } finally {
                lock.unlock();
            }
        }
        return removed;
    }

    int size() {
        return states.size();
    }

    private boolean retireAndRemove(ScopeKey key, LimiterEntry entry) {
        ReentrantLock lock = entry.getLock();
        lock.lock();
        try {
            entry.retire();
        } finally {
            lock.unlock();
        }
        return states.remove(key, entry);
    }
}
