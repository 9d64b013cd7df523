package gk.core.clock;

/**
 * Time source for every limiter.
 *
 * Algorithms do their arithmetic on {@link #nowNanos()} (monotonic). The wall clock is only
 * read to render reset timestamps for clients.
 */
public interface Clock {
    long nowNanos();

    long epochMillis();
}
