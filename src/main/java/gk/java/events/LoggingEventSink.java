package gk.java.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to the {@code gk.events} logger. Violations are DEBUG, the rest INFO.
 */
public final class LoggingEventSink implements RateLimitEventSink {

    private static final Logger log = LoggerFactory.getLogger("gk.events");

    @Override
    public void publish(RateLimitEvent event) {
        switch (event.type()) {
            case VIOLATION -> log.debug("{} rule={} identifier={} scope={} algorithm={} {}",
                event.type(), event.ruleId(), event.identifier(), event.scope(), event.algorithm(),
                event.attributes());
            case EVALUATION_ERROR -> log.warn("{} rule={} identifier={} {}",
                event.type(), event.ruleId(), event.identifier(), event.attributes());
            default -> log.info("{} rule={} {}", event.type(), event.ruleId(), event.attributes());
        }
    }
}
