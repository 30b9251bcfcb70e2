package com.skyshield.evaluator.scoring;

import com.skyshield.evaluator.model.Identification;
import com.skyshield.evaluator.model.Position;

/**
 * The three independent risk sub-scores, each in [0, 100].
 */
public final class RiskFactors {

    static final double MAX_RISK = 100.0;
    static final double INNER_ZONE_RISK = 100.0;
    static final double OUTER_ZONE_RISK = 50.0;

    private final double speedCeiling;
    private final double innerRadius;
    private final double outerRadius;
    private final Position protectedPoint;

    public RiskFactors(double speedCeiling, double innerRadius, double outerRadius, Position protectedPoint) {
        if (!(speedCeiling > 0)) {
            throw new IllegalArgumentException("speedCeiling must be positive: " + speedCeiling);
        }
        if (!(innerRadius > 0) || !(outerRadius > innerRadius)) {
            throw new IllegalArgumentException("Radii must satisfy 0 < inner < outer: " + innerRadius + ", " + outerRadius);
        }
        this.speedCeiling = speedCeiling;
        this.innerRadius = innerRadius;
        this.outerRadius = outerRadius;
        this.protectedPoint = protectedPoint;
    }

    /**
     * Linear ramp from 0 at standstill to 100 at the speed ceiling, capped at 100.
     */
    public double speedRisk(double speed) {
        return Math.min(MAX_RISK, (speed / speedCeiling) * MAX_RISK);
    }

    /**
     * Step function of the distance to the protected point: 100 strictly inside
     * the inner radius, 50 from the inner radius up to (excluding) the outer
     * radius, 0 from the outer radius on.
     */
    public double proximityRisk(double distance) {
        if (distance < innerRadius) {
            return INNER_ZONE_RISK;
        }
        if (distance < outerRadius) {
            return OUTER_ZONE_RISK;
        }
        return 0.0;
    }

    public double proximityRisk(Position position) {
        return proximityRisk(distanceToProtectedPoint(position));
    }

    public double identificationRisk(Identification identification) {
        return identification.risk();
    }

    public double distanceToProtectedPoint(Position position) {
        return position.distanceTo(protectedPoint);
    }

    public Position getProtectedPoint() {
        return protectedPoint;
    }
}
