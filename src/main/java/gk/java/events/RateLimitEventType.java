package gk.java.events;

public enum RateLimitEventType {
    RULE_ADDED,
    RULE_UPDATED,
    RULE_REMOVED,
    VIOLATION,
    RESET,
    EVALUATION_ERROR
}
