package com.skyshield.shared.util;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAccumulator;

/**
 * Lightweight in-process metrics for SkyShield workers.
 *
 * Counters are monotonically increasing; timers keep a running total, the
 * number of samples and the maximum sample in milliseconds. Everything is
 * thread-safe so a collector can be read from a different thread than the
 * one driving the loop.
 */
public class MetricsCollector {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    /**
     * Starts a timed span. Use it with try-with-resources so the sample is
     * recorded on every exit path.
     *
     * @param name the timer name (e.g. "cycle")
     * @return a span that records its duration when closed
     */
    public Span startSpan(String name) {
        long startNanos = System.nanoTime();
        return () -> recordDuration(name, (System.nanoTime() - startNanos) / 1_000_000L);
    }

    /**
     * Records a duration sample in milliseconds.
     */
    public void recordDuration(String name, long millis) {
        timers.computeIfAbsent(name, k -> new Timer()).record(millis);
    }

    /**
     * Increments a named counter by 1.
     */
    public void incrementCounter(String name) {
        incrementCounter(name, 1);
    }

    /**
     * Increments a named counter by {@code delta}.
     */
    public void incrementCounter(String name, long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("Counters only increase, got delta " + delta);
        }
        counters.computeIfAbsent(name, k -> new AtomicLong()).addAndGet(delta);
    }

    /**
     * Gets the current value of a counter, or 0 if it was never incremented.
     */
    public long getCounter(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0L;
    }

    /**
     * Gets the number of samples recorded for a timer.
     */
    public long getTimerCount(String name) {
        Timer timer = timers.get(name);
        return timer != null ? timer.count.get() : 0L;
    }

    /**
     * Gets the sum of all samples recorded for a timer, in milliseconds.
     */
    public long getTimerTotalMillis(String name) {
        Timer timer = timers.get(name);
        return timer != null ? timer.totalMillis.get() : 0L;
    }

    /**
     * Gets the largest sample recorded for a timer, in milliseconds.
     */
    public long getTimerMaxMillis(String name) {
        Timer timer = timers.get(name);
        return timer != null ? timer.max.get() : 0L;
    }

    /**
     * Returns a sorted snapshot of all counters.
     */
    public Map<String, Long> snapshotCounters() {
        Map<String, Long> result = new TreeMap<>();
        counters.forEach((k, v) -> result.put(k, v.get()));
        return result;
    }

    /**
     * Resets all counters and timers. Used in testing.
     */
    public void reset() {
        counters.clear();
        timers.clear();
    }

    /**
     * A running timed section; closing it records the elapsed time.
     */
    @FunctionalInterface
    public interface Span extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Timer {
        private final AtomicLong count = new AtomicLong();
        private final AtomicLong totalMillis = new AtomicLong();
        private final LongAccumulator max = new LongAccumulator(Math::max, 0L);

        void record(long millis) {
            count.incrementAndGet();
            totalMillis.addAndGet(millis);
            max.accumulate(millis);
        }
    }
}
