package gk.core.algorithms.fixed_window;

import gk.core.clock.ManualClock;
import gk.core.model.Admission;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

public class FixedWindowCounterTest {

    private static final long SECOND = 1_000_000_000L;

    @Test
    void fiveAdmitted_sixthRejected_nextWindowResets() {
        ManualClock clock = new ManualClock(0);
        FixedWindowCounter counter = new FixedWindowCounter(clock, 60 * SECOND, 5);

        for (int i = 0; i < 5; i++) {
            assertTrue(counter.tryAcquire(1, OptionalDouble.empty()).allowed(), "request " + i);
        }
        Admission sixth = counter.tryAcquire(1, OptionalDouble.empty());
        assertFalse(sixth.allowed());
        assertEquals(0L, sixth.remaining());

        clock.advanceSeconds(60);
        Admission nextWindow = counter.tryAcquire(1, OptionalDouble.empty());
        assertTrue(nextWindow.allowed());
        assertEquals(4L, nextWindow.remaining());
    }

    @Test
    void allowsTwiceTheQuota_acrossBoundary() {
        ManualClock clock = new ManualClock(0);
        FixedWindowCounter counter = new FixedWindowCounter(clock, 60 * SECOND, 5);

        clock.setNanos(60 * SECOND - 1_000_000L); // 1ms before the boundary
        for (int i = 0; i < 5; i++) assertTrue(counter.tryAdmit());

        clock.advanceNanos(2_000_000L); // 1ms after
        for (int i = 0; i < 5; i++) assertTrue(counter.tryAdmit());

        assertFalse(counter.tryAdmit());
    }

    @Test
    void testRetryAfter_isTimeUntilWindowEnd() {
        ManualClock clock = new ManualClock(0);
        FixedWindowCounter counter = new FixedWindowCounter(clock, 60 * SECOND, 1);

        clock.advanceSeconds(10);
        counter.tryAdmit();
        Admission rejected = counter.tryAcquire(1, OptionalDouble.empty());

        assertEquals(50 * SECOND, rejected.retryAfterNanos());
        assertEquals(50 * SECOND, rejected.resetAfterNanos());
    }

    @Test
    void testWindowsAlignToMultiplesOfLength() {
        ManualClock clock = new ManualClock(25 * SECOND);
        FixedWindowCounter counter = new FixedWindowCounter(clock, 60 * SECOND, 1);

        assertTrue(counter.tryAdmit());
        clock.setNanos(59 * SECOND);
        assertFalse(counter.tryAdmit(), "same aligned window [0, 60)");
        clock.setNanos(60 * SECOND);
        assertTrue(counter.tryAdmit());
    }

    @Test
    void testWindowsAlignToEpochNotMonotonicOrigin() {
        // epoch 1_700_000_000 s is 20 s into its minute
        ManualClock clock = new ManualClock(5 * SECOND, 1_700_000_000_000L - 5_000L);
        FixedWindowCounter counter = new FixedWindowCounter(clock, 60 * SECOND, 1);

        Admission first = counter.tryAcquire(1, OptionalDouble.empty());
        assertTrue(first.allowed());
        assertEquals(40 * SECOND, first.resetAfterNanos());
        assertEquals(1_700_000_040L, counter.snapshot().get("window_reset_epoch_seconds"));

        clock.advanceSeconds(39);
        assertFalse(counter.tryAdmit(), "still in the window ending at epoch 1_700_000_040");
        clock.advanceSeconds(1);
        assertTrue(counter.tryAdmit(), "new minute on the wall clock");
    }
}
