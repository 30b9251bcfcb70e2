package com.skyshield.evaluator.unit;

import com.skyshield.evaluator.loop.FixedIntervalTicker;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class FixedIntervalTickerTest {

    @Test
    void test_first_tick_is_immediate() {
        FixedIntervalTicker ticker = new FixedIntervalTicker(Duration.ofHours(1));
        long start = System.nanoTime();
        assertTrue(ticker.awaitNextTick());
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(1));
    }

    @Test
    void test_following_ticks_wait_the_interval() {
        FixedIntervalTicker ticker = new FixedIntervalTicker(Duration.ofMillis(50));
        assertTrue(ticker.awaitNextTick());
        long start = System.nanoTime();
        assertTrue(ticker.awaitNextTick());
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(45));
    }

    @Test
    void test_stop_wakes_a_waiting_thread() throws Exception {
        FixedIntervalTicker ticker = new FixedIntervalTicker(Duration.ofHours(1));
        assertTrue(ticker.awaitNextTick());

        AtomicBoolean result = new AtomicBoolean(true);
        CountDownLatch done = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            result.set(ticker.awaitNextTick());
            done.countDown();
        });
        waiter.start();

        ticker.stop();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertFalse(result.get());
        assertTrue(ticker.isStopped());
    }

    @Test
    void test_stopped_ticker_never_ticks() {
        FixedIntervalTicker ticker = new FixedIntervalTicker(Duration.ofMillis(10));
        ticker.stop();
        assertFalse(ticker.awaitNextTick());
    }

    @Test
    void test_interrupt_ends_ticking() {
        FixedIntervalTicker ticker = new FixedIntervalTicker(Duration.ofHours(1));
        assertTrue(ticker.awaitNextTick());
        Thread.currentThread().interrupt();
        try {
            assertFalse(ticker.awaitNextTick());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void test_non_positive_interval_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new FixedIntervalTicker(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new FixedIntervalTicker(Duration.ofMillis(-5)));
    }
}
