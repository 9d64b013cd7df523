package gk.java.events;

/**
 * Receiver of violation and rule-change events.
 */
@FunctionalInterface
public interface RateLimitEventSink {

    void publish(RateLimitEvent event);

    static RateLimitEventSink noop() {
        return event -> { };
    }
}
