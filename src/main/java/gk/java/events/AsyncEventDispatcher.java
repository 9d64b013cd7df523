package gk.java.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Hands events to a downstream sink on a single background thread.
 *
 * {@link #publish} never blocks: when the bounded queue is full the event is dropped and
 * counted. A downstream failure is logged and the worker moves on to the next event.
 */
public final class AsyncEventDispatcher implements RateLimitEventSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncEventDispatcher.class);

    private final RateLimitEventSink downstream;
    private final ThreadPoolExecutor executor;
    private final LongAdder dropped = new LongAdder();
    private final AtomicLong pending = new AtomicLong();
    private final Object idle = new Object();

    public AsyncEventDispatcher(RateLimitEventSink downstream, int queueCapacity) {
        if (downstream == null) throw new IllegalArgumentException("downstream cannot be null");
        if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be > 0");
        this.downstream = downstream;
        this.executor = new ThreadPoolExecutor(
            1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            runnable -> {
                Thread thread = new Thread(runnable, "gatekeeper-events");
                thread.setDaemon(true);
                return thread;
            },
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Override
    public void publish(RateLimitEvent event) {
        pending.incrementAndGet();
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            dropped.increment();
            done();
            log.warn("Dropped {} event for rule {}: queue full or dispatcher closed", event.type(), event.ruleId());
        }
    }

    public long droppedCount() {
        return dropped.sum();
    }

    /**
     * Waits until every accepted event has been delivered.
     *
     * @return false if the timeout elapsed first
     */
    public boolean flush(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        synchronized (idle) {
            while (pending.get() > 0) {
                long left = deadline - System.nanoTime();
                if (left <= 0) return false;
                TimeUnit.NANOSECONDS.timedWait(idle, left);
            }
        }
        return true;
    }

    /**
     * Stops accepting events and drains what is queued, waiting at most {@code timeout}.
     */
    public void close(long timeout, TimeUnit unit) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout, unit)) {
                int abandoned = executor.shutdownNow().size();
                log.warn("Event dispatcher closed with {} undelivered events", abandoned);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        close(5, TimeUnit.SECONDS);
    }

    private void deliver(RateLimitEvent event) {
        try {
            downstream.publish(event);
        } catch (RuntimeException e) {
            log.warn("Event sink failed on {} event for rule {}", event.type(), event.ruleId(), e);
        } finally {
            done();
        }
    }

    private void done() {
        if (pending.decrementAndGet() == 0) {
            synchronized (idle) {
                idle.notifyAll();
            }
        }
    }
}
