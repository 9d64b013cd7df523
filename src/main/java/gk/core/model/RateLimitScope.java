package gk.core.model;

/**
 * Dimension along which a quota is partitioned.
 */
public enum RateLimitScope {
    GLOBAL("global"),
    IP("ip"),
    USER("user"),
    ORGANIZATION("organization"),
    ENDPOINT("endpoint"),
    API_KEY("api_key");

    private final String wireName;

    RateLimitScope(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RateLimitScope fromWireName(String value) {
        return WireNames.parse(RateLimitScope.class, values(), RateLimitScope::wireName, value);
    }
}
