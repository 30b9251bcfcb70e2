package com.skyshield.evaluator.loop;

/**
 * Drives discrete evaluation cycles.
 */
public interface Ticker {

    /**
     * Blocks until the next cycle is due.
     *
     * @return false once no further cycles should run
     */
    boolean awaitNextTick();

    /**
     * Cancels the ticker. Any thread blocked in {@link #awaitNextTick()} wakes up and gets false.
     */
    void stop();
}
