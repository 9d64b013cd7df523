package gk.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Hourly usage of one identifier in one scope.
 *
 * @param pattern one of {@code no_data}, {@code consistent}, {@code variable}, {@code spiky}
 */
public record UsageStatistics(
    String identifier,
    RateLimitScope scope,
    int periodHours,
    long totalRequests,
    long totalBlocked,
    double blockRatePercent,
    List<HourlyUsage> hourlyBreakdown,
    Optional<Instant> peakUsageHour,
    String pattern,
    double averageRequestsPerHour,
    long peakHourlyRequests,
    double peakToAverageRatio
) {
    public UsageStatistics {
        hourlyBreakdown = List.copyOf(hourlyBreakdown);
    }

    public record HourlyUsage(Instant hour, long requests, long blocked) {
    }
}
