package com.skyshield.evaluator.scoring;

/**
 * Result of scoring one track: the sub-scores that went into it and the final score.
 *
 * @param score integer threat score in [0, 100]
 */
public record ThreatAssessment(
    double speedRisk,
    double proximityRisk,
    double identificationRisk,
    double distance,
    int score
) {
}
