package gk.core.model;

public final class RateLimitHeaders {
    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";
    public static final String VIOLATION = "X-RateLimit-Violation";
    public static final String COUNT = "X-RateLimit-Count";
    public static final String WARNING = "X-RateLimit-Warning";
    public static final String THROTTLE_DELAY = "X-RateLimit-Throttle-Delay";

    private RateLimitHeaders() {
    }
}
