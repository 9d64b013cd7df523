package gk.core.model;

/**
 * What happens when a rule's quota is exceeded.
 *
 * <ul>
 *   <li>BLOCK: reject, stop evaluating, optionally hold the caller in a penalty box</li>
 *   <li>THROTTLE: admit, but flag the violation and suggest a delay</li>
 *   <li>WARN: admit, flag the violation and emit a violation event</li>
 *   <li>LOG_ONLY: admit, only log and count</li>
 * </ul>
 */
public enum RateLimitAction {
    BLOCK("block"),
    THROTTLE("throttle"),
    WARN("warn"),
    LOG_ONLY("log_only");

    private final String wireName;

    RateLimitAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RateLimitAction fromWireName(String value) {
        return WireNames.parse(RateLimitAction.class, values(), RateLimitAction::wireName, value);
    }
}
