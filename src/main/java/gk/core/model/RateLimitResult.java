package gk.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Merged verdict of all rules that apply to one request.
 *
 * @param allowed whether the request may proceed
 * @param remainingRequests binding remaining quota (0 when rejected)
 * @param resetTime when the binding quota is fully available again
 * @param headers standard rate limit response headers
 * @param retryAfterSeconds present only when rejected
 * @param violationDetected whether any rule was exceeded (including non-blocking actions)
 * @param rateLimitedCount how many rules flagged the request
 * @param throttleDelaySeconds suggested delay when a THROTTLE rule was exceeded
 */
public record RateLimitResult(
    boolean allowed,
    long remainingRequests,
    Instant resetTime,
    Map<String, String> headers,
    OptionalLong retryAfterSeconds,
    boolean violationDetected,
    int rateLimitedCount,
    OptionalLong throttleDelaySeconds
) {
    public RateLimitResult {
        headers = Map.copyOf(headers);
    }

    public long resetEpochSeconds() {
        return resetTime.getEpochSecond();
    }
}
