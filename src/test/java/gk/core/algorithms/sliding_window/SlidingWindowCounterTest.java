package gk.core.algorithms.sliding_window;

import gk.core.clock.ManualClock;
import gk.core.model.Admission;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

public class SlidingWindowCounterTest {

    private static final long SECOND = 1_000_000_000L;

    @Test
    void deniesNPlusOne_withinWindow() {
        ManualClock clock = new ManualClock(0);
        SlidingWindowCounter window = new SlidingWindowCounter(clock, 10 * SECOND, 3);

        assertTrue(window.tryAdmit());
        assertTrue(window.tryAdmit());
        assertTrue(window.tryAdmit());
        assertFalse(window.tryAdmit());
    }

    @Test
    void freesOneSlot_whenOldestLeaves() {
        ManualClock clock = new ManualClock(0);
        SlidingWindowCounter window = new SlidingWindowCounter(clock, 10 * SECOND, 3);

        window.tryAdmit(); // t=0
        clock.advanceSeconds(1);
        window.tryAdmit(); // t=1
        clock.advanceSeconds(1);
        window.tryAdmit(); // t=2
        assertFalse(window.tryAdmit());

        clock.setNanos(10 * SECOND); // oldest (t=0) leaves
        assertTrue(window.tryAdmit(), "one slot freed");
        assertFalse(window.tryAdmit(), "not the whole quota");
    }

    @Test
    void testRetryAfter_isTimeUntilOldestLeaves() {
        ManualClock clock = new ManualClock(0);
        SlidingWindowCounter window = new SlidingWindowCounter(clock, 10 * SECOND, 2);

        window.tryAcquire(1, OptionalDouble.empty());
        clock.advanceSeconds(2);
        window.tryAcquire(1, OptionalDouble.empty());

        Admission rejected = window.tryAcquire(1, OptionalDouble.empty());
        assertFalse(rejected.allowed());
        assertEquals(0L, rejected.remaining());
        assertEquals(8 * SECOND, rejected.retryAfterNanos());
        assertEquals(10 * SECOND, rejected.resetAfterNanos());
    }

    @Test
    void testRemaining_countsDown() {
        ManualClock clock = new ManualClock(0);
        SlidingWindowCounter window = new SlidingWindowCounter(clock, 60 * SECOND, 5);

        assertEquals(4L, window.tryAcquire(1, OptionalDouble.empty()).remaining());
        assertEquals(3L, window.tryAcquire(1, OptionalDouble.empty()).remaining());
        assertEquals(3, window.remaining());
    }

    @Test
    void testSetMaxRequests_appliesToNextAdmission() {
        ManualClock clock = new ManualClock(0);
        SlidingWindowCounter window = new SlidingWindowCounter(clock, 60 * SECOND, 5);

        window.tryAdmit();
        window.tryAdmit();
        window.setMaxRequests(2);

        assertFalse(window.tryAdmit());
        assertEquals(0, window.remaining());
    }
}
