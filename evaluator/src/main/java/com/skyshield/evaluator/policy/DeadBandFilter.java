package com.skyshield.evaluator.policy;

/**
 * Suppresses score writes that stay within noise of the stored value.
 */
public final class DeadBandFilter {

    private final int threshold;

    public DeadBandFilter(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Dead-band threshold must not be negative: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * A new score is written only when it moved strictly more than the
     * threshold away from the stored score.
     */
    public boolean shouldPersist(int storedScore, int newScore) {
        return Math.abs(newScore - storedScore) > threshold;
    }

    public int getThreshold() {
        return threshold;
    }
}
