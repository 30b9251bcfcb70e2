package com.skyshield.evaluator.config;

import com.skyshield.evaluator.exception.EvaluatorConfigurationException;
import com.skyshield.evaluator.model.Position;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tuning knobs of the threat evaluator, bound from {@code skyshield.evaluator.*}.
 *
 * Defaults: 500ms polling, speed ceiling 1500, radii 100/300 around the
 * centre of the 800x600 map, weights 0.3/0.4/0.3, dead-band 2 and
 * auto-engage above 90.
 */
@ConfigurationProperties(prefix = "skyshield.evaluator")
public class EvaluatorProperties implements InitializingBean {

    static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    private Duration pollInterval = Duration.ofMillis(500);
    private double speedCeiling = 1500;
    private double innerRadius = 100;
    private double outerRadius = 300;
    private int deadBandThreshold = 2;
    private int escalationThreshold = 90;
    private Weights weights = new Weights();
    private ProtectedPoint protectedPoint = new ProtectedPoint();

    public static class Weights {
        private double speed = 0.3;
        private double proximity = 0.4;
        private double identification = 0.3;

        public double getSpeed() { return speed; }
        public void setSpeed(double speed) { this.speed = speed; }
        public double getProximity() { return proximity; }
        public void setProximity(double proximity) { this.proximity = proximity; }
        public double getIdentification() { return identification; }
        public void setIdentification(double identification) { this.identification = identification; }

        public double sum() {
            return speed + proximity + identification;
        }
    }

    public static class ProtectedPoint {
        private double x = 400;
        private double y = 300;

        public double getX() { return x; }
        public void setX(double x) { this.x = x; }
        public double getY() { return y; }
        public void setY(double y) { this.y = y; }
    }

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    /**
     * Checks every rule and reports all violations at once.
     *
     * @throws EvaluatorConfigurationException if any rule is broken
     */
    public void validate() {
        List<String> violations = new ArrayList<>();

        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            violations.add("poll-interval must be positive, was " + pollInterval);
        }
        if (!(speedCeiling > 0) || Double.isInfinite(speedCeiling)) {
            violations.add("speed-ceiling must be positive and finite, was " + speedCeiling);
        }
        if (!(innerRadius > 0)) {
            violations.add("inner-radius must be positive, was " + innerRadius);
        }
        if (!(outerRadius > innerRadius) || Double.isInfinite(outerRadius)) {
            violations.add("outer-radius must be finite and greater than inner-radius ("
                + innerRadius + "), was " + outerRadius);
        }
        if (deadBandThreshold < 0) {
            violations.add("dead-band-threshold must not be negative, was " + deadBandThreshold);
        }
        if (escalationThreshold < 0 || escalationThreshold > 100) {
            violations.add("escalation-threshold must be within [0, 100], was " + escalationThreshold);
        }
        if (weights == null) {
            violations.add("weights must be set");
        } else {
            checkWeight(violations, "weights.speed", weights.getSpeed());
            checkWeight(violations, "weights.proximity", weights.getProximity());
            checkWeight(violations, "weights.identification", weights.getIdentification());
            if (Math.abs(weights.sum() - 1.0) > WEIGHT_SUM_TOLERANCE) {
                violations.add("weights must sum to 1.0, sum was " + weights.sum());
            }
        }
        if (protectedPoint == null
            || !Double.isFinite(protectedPoint.getX())
            || !Double.isFinite(protectedPoint.getY())) {
            violations.add("protected-point must have finite x and y");
        }

        if (!violations.isEmpty()) {
            throw new EvaluatorConfigurationException(violations);
        }
    }

    private static void checkWeight(List<String> violations, String name, double value) {
        if (!(value >= 0 && value <= 1)) {
            violations.add(name + " must be within [0, 1], was " + value);
        }
    }

    public Position protectedPosition() {
        return new Position(protectedPoint.getX(), protectedPoint.getY());
    }

    // Getters and setters
    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public double getSpeedCeiling() { return speedCeiling; }
    public void setSpeedCeiling(double speedCeiling) { this.speedCeiling = speedCeiling; }
    public double getInnerRadius() { return innerRadius; }
    public void setInnerRadius(double innerRadius) { this.innerRadius = innerRadius; }
    public double getOuterRadius() { return outerRadius; }
    public void setOuterRadius(double outerRadius) { this.outerRadius = outerRadius; }
    public int getDeadBandThreshold() { return deadBandThreshold; }
    public void setDeadBandThreshold(int deadBandThreshold) { this.deadBandThreshold = deadBandThreshold; }
    public int getEscalationThreshold() { return escalationThreshold; }
    public void setEscalationThreshold(int escalationThreshold) { this.escalationThreshold = escalationThreshold; }
    public Weights getWeights() { return weights; }
    public void setWeights(Weights weights) { this.weights = weights; }
    public ProtectedPoint getProtectedPoint() { return protectedPoint; }
    public void setProtectedPoint(ProtectedPoint protectedPoint) { this.protectedPoint = protectedPoint; }
}
