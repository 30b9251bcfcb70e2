package com.skyshield.evaluator.scoring;

/**
 * Relative weights of the speed, proximity and identification risks.
 * They must each lie in [0, 1] and sum to 1.
 */
public record ScoringWeights(double speed, double proximity, double identification) {

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.3, 0.4, 0.3);

    private static final double SUM_TOLERANCE = 1e-6;

    public ScoringWeights {
        for (double w : new double[] {speed, proximity, identification}) {
            if (!(w >= 0 && w <= 1)) {
                throw new IllegalArgumentException("Weight out of [0, 1]: " + w);
            }
        }
        double sum = speed + proximity + identification;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }
}
