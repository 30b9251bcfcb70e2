package com.skyshield.evaluator.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fires the first tick immediately and every following tick one fixed
 * interval after the previous {@link #awaitNextTick()} call returned.
 * There is no backoff: a slow cycle simply delays the next one.
 */
public class FixedIntervalTicker implements Ticker {

    private static final Logger log = LoggerFactory.getLogger(FixedIntervalTicker.class);

    private final Duration interval;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean first = new AtomicBoolean(true);

    public FixedIntervalTicker(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Tick interval must be positive: " + interval);
        }
        this.interval = interval;
    }

    @Override
    public boolean awaitNextTick() {
        if (isStopped()) {
            return false;
        }
        if (first.getAndSet(false)) {
            return true;
        }
        try {
            return !stopSignal.await(interval.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            log.info("Ticker interrupted, no further cycles");
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void stop() {
        stopSignal.countDown();
    }

    public boolean isStopped() {
        return stopSignal.getCount() == 0;
    }

    public Duration getInterval() {
        return interval;
    }
}
