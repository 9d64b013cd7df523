package gk.core.algorithms.adaptive;

import gk.core.clock.ManualClock;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

public class AdaptiveLimiterTest {

    private static final long MINUTE = 60_000_000_000L;

    @Test
    void currentLimit_staysWithinBounds_underExtremeLatency() {
        ManualClock clock = new ManualClock(0);
        AdaptiveLimiter limiter = new AdaptiveLimiter(clock, MINUTE, 100);

        double[] latencies = {1e9, 0, -1e9, Double.POSITIVE_INFINITY, 5_000, Double.NEGATIVE_INFINITY};
        for (int i = 0; i < 10_000; i++) {
            limiter.isAllowed(OptionalDouble.of(latencies[i % latencies.length]));
            clock.advanceNanos(1_000_000L);
            double limit = limiter.currentLimit();
            assertTrue(limit >= 10.0 && limit <= 200.0, "limit out of bounds: " + limit);
        }
    }

    @Test
    void contracts_underSustainedLoad() {
        ManualClock clock = new ManualClock(0);
        AdaptiveLimiter limiter = new AdaptiveLimiter(clock, MINUTE, 100);

        for (int i = 0; i < 500; i++) {
            limiter.isAllowed(OptionalDouble.of(1_000));
        }

        assertTrue(limiter.systemLoad() > 0.9, "load " + limiter.systemLoad());
        assertTrue(limiter.currentLimit() < 30, "limit " + limiter.currentLimit());
        assertEquals(10.0, limiter.currentLimit(), 5.0);
    }

    @Test
    void relaxes_whenLatencyDrops() {
        ManualClock clock = new ManualClock(0);
        AdaptiveLimiter limiter = new AdaptiveLimiter(clock, MINUTE, 100);

        for (int i = 0; i < 500; i++) limiter.isAllowed(OptionalDouble.of(1_000));
        double contracted = limiter.currentLimit();
        for (int i = 0; i < 500; i++) limiter.isAllowed(OptionalDouble.of(0));

        assertTrue(limiter.currentLimit() > contracted);
    }

    @Test
    void withoutLatency_limitStaysAtBase() {
        ManualClock clock = new ManualClock(0);
        AdaptiveLimiter limiter = new AdaptiveLimiter(clock, MINUTE, 100);

        for (int i = 0; i < 50; i++) limiter.isAllowed();

        assertEquals(100.0, limiter.currentLimit(), 1e-9);
        assertEquals(0.5, limiter.systemLoad(), 1e-12);
        assertEquals(1.0, limiter.performanceScore(), 1e-12);
    }

    @Test
    void enforcesEmbeddedWindow() {
        ManualClock clock = new ManualClock(0);
        AdaptiveLimiter limiter = new AdaptiveLimiter(clock, MINUTE, 3);

        assertTrue(limiter.isAllowed());
        assertTrue(limiter.isAllowed());
        assertTrue(limiter.isAllowed());
        assertFalse(limiter.isAllowed());

        clock.advanceNanos(MINUTE);
        assertTrue(limiter.isAllowed());
    }

    @Test
    void embeddedWindow_neverDropsBelowOne() {
        ManualClock clock = new ManualClock(0);
        AdaptiveLimiter limiter = new AdaptiveLimiter(clock, MINUTE, 1);

        for (int i = 0; i < 200; i++) {
            limiter.isAllowed(OptionalDouble.of(10_000));
            clock.advanceNanos(MINUTE);
        }
        assertTrue(limiter.currentLimit() < 1.0);
        assertTrue(limiter.isAllowed(OptionalDouble.of(10_000)));
    }

    @Test
    void testRejectsNaNLatency() {
        AdaptiveLimiter limiter = new AdaptiveLimiter(new ManualClock(0), MINUTE, 10);
        assertThrows(IllegalArgumentException.class, () -> limiter.isAllowed(OptionalDouble.of(Double.NaN)));
    }

    @Test
    void testConstructor_validatesAdaptationFactor() {
        ManualClock clock = new ManualClock(0);
        assertThrows(IllegalArgumentException.class, () -> new AdaptiveLimiter(clock, MINUTE, 10, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new AdaptiveLimiter(clock, MINUTE, 10, 1.5));
        assertDoesNotThrow(() -> new AdaptiveLimiter(clock, MINUTE, 10, 1.0));
    }
}
