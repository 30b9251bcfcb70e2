package com.skyshield.evaluator.scoring;

import com.skyshield.evaluator.model.Identification;
import com.skyshield.evaluator.model.Position;
import com.skyshield.evaluator.model.TrackSnapshot;

/**
 * Combines the risk factors into one weighted threat score.
 *
 * The weighted sum is clamped to [0, 100] and truncated toward zero. The
 * scorer holds no mutable state, so identical inputs always produce the
 * identical score.
 */
public final class ThreatScorer {

    static final int MIN_SCORE = 0;
    static final int MAX_SCORE = 100;

    private final RiskFactors riskFactors;
    private final ScoringWeights weights;

    public ThreatScorer(RiskFactors riskFactors, ScoringWeights weights) {
        this.riskFactors = riskFactors;
        this.weights = weights;
    }

    public ThreatAssessment assess(TrackSnapshot track) {
        return assess(track.speed(), track.position(), track.identification());
    }

    public ThreatAssessment assess(double speed, Position position, Identification identification) {
        double speedRisk = riskFactors.speedRisk(speed);
        double distance = riskFactors.distanceToProtectedPoint(position);
        double proximityRisk = riskFactors.proximityRisk(distance);
        double identificationRisk = riskFactors.identificationRisk(identification);

        double raw = speedRisk * weights.speed()
            + proximityRisk * weights.proximity()
            + identificationRisk * weights.identification();

        return new ThreatAssessment(speedRisk, proximityRisk, identificationRisk, distance, toScore(raw));
    }

    static int toScore(double raw) {
        if (Double.isNaN(raw)) {
            throw new IllegalArgumentException("Raw threat score is NaN");
        }
        double clamped = Math.max(MIN_SCORE, Math.min(MAX_SCORE, raw));
        return (int) clamped;
    }
}
