package gk.java.engine;

import gk.core.model.RateLimitScope;
import gk.core.model.UsageStatistics;
import gk.core.model.UsageStatistics.HourlyUsage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Hourly request and blocked counts per (identifier, scope), kept for a retention period.
 */
final class UsageTracker {

    static final String NO_DATA = "no_data";
    static final String CONSISTENT = "consistent";
    static final String VARIABLE = "variable";
    static final String SPIKY = "spiky";

    private static final long MILLIS_PER_HOUR = 3_600_000L;

    private record UsageKey(String identifier, RateLimitScope scope) {
    }

    private static final class HourCounters {
        final LongAdder requests = new LongAdder();
        final LongAdder blocked = new LongAdder();
    }

    private final int retentionHours;
    private final ConcurrentHashMap<UsageKey, ConcurrentNavigableMap<Long, HourCounters>> usage =
        new ConcurrentHashMap<>();

    UsageTracker(int retentionHours) {
        this.retentionHours = retentionHours;
    }

    void record(String identifier, RateLimitScope scope, boolean wasBlocked, long epochMillis) {
        long hour = hourOf(epochMillis);
        // compute keeps recording and eviction of the same key from interleaving
        usage.compute(new UsageKey(identifier, scope), (key, hours) -> {
            ConcurrentNavigableMap<Long, HourCounters> target = hours != null ? hours : new ConcurrentSkipListMap<>();
            HourCounters counters = target.computeIfAbsent(hour, h -> new HourCounters());
            counters.requests.increment();
            if (wasBlocked) counters.blocked.increment();
            return target;
        });
    }

    UsageStatistics statistics(String identifier, RateLimitScope scope, int hoursBack, long epochMillis) {
        if (hoursBack <= 0) throw new IllegalArgumentException("hoursBack must be > 0");
        long currentHour = hourOf(epochMillis);
        long firstHour = currentHour - (hoursBack - 1) * MILLIS_PER_HOUR;

        List<HourlyUsage> breakdown = new ArrayList<>();
        ConcurrentNavigableMap<Long, HourCounters> hours = usage.get(new UsageKey(identifier, scope));
        if (hours != null) {
            for (Map.Entry<Long, HourCounters> e : hours.subMap(firstHour, true, currentHour, true).entrySet()) {
                breakdown.add(new HourlyUsage(Instant.ofEpochMilli(e.getKey()),
                    e.getValue().requests.sum(), e.getValue().blocked.sum()));
            }
        }

        long totalRequests = 0;
        long totalBlocked = 0;
        HourlyUsage peak = null;
        for (HourlyUsage hour : breakdown) {
            totalRequests += hour.requests();
            totalBlocked += hour.blocked();
            if (peak == null || hour.requests() > peak.requests()) {
                peak = hour;
            }
        }

        double blockRate = totalRequests > 0 ? round2(totalBlocked * 100.0 / totalRequests) : 0.0;
        if (peak == null) {
            return new UsageStatistics(identifier, scope, hoursBack, 0, 0, 0.0, breakdown,
                Optional.empty(), NO_DATA, 0.0, 0, 0.0);
        }

        double average = (double) totalRequests / breakdown.size();
        double peakRatio = peak.requests() / Math.max(1.0, average);
        return new UsageStatistics(identifier, scope, hoursBack, totalRequests, totalBlocked, blockRate, breakdown,
            Optional.of(peak.hour()), pattern(peakRatio), round2(average), peak.requests(), round2(peakRatio));
    }

    /**
     * Drops hour buckets older than the retention period.
     *
     * @return number of buckets dropped
     */
    int evictExpired(long epochMillis) {
        long oldestKept = hourOf(epochMillis) - (retentionHours - 1L) * MILLIS_PER_HOUR;
        int[] removed = {0};
        for (UsageKey key : usage.keySet()) {
            usage.computeIfPresent(key, (k, hours) -> {
                Map<Long, HourCounters> expired = hours.headMap(oldestKept);
                removed[0] += expired.size();
                expired.clear();
                return hours.isEmpty() ? null : hours;
            });
        }
        return removed[0];
    }

    static String pattern(double peakToAverageRatio) {
        if (peakToAverageRatio > 3.0) return SPIKY;
        if (peakToAverageRatio > 1.5) return VARIABLE;
        return CONSISTENT;
    }

    private static long hourOf(long epochMillis) {
        return Math.floorDiv(epochMillis, MILLIS_PER_HOUR) * MILLIS_PER_HOUR;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
