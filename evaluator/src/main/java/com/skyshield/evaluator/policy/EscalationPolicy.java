package com.skyshield.evaluator.policy;

import com.skyshield.evaluator.model.LifecycleState;

/**
 * Auto-engage rule: a LIVE track whose freshly computed score exceeds the
 * critical threshold becomes ENGAGED. ENGAGED never goes back to LIVE here.
 */
public final class EscalationPolicy {

    private final int threshold;

    public EscalationPolicy(int threshold) {
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("Escalation threshold must be within [0, 100]: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * Returns the state the track should be in after this cycle.
     *
     * @param score   the score computed this cycle, regardless of whether it is persisted
     * @param current the track's current state
     */
    public LifecycleState nextState(int score, LifecycleState current) {
        if (current.isTerminal()) {
            return current;
        }
        return score > threshold ? LifecycleState.ENGAGED : current;
    }

    public boolean shouldEngage(int score, LifecycleState current) {
        return nextState(score, current) != current;
    }

    public int getThreshold() {
        return threshold;
    }
}
