package com.skyshield.evaluator.model;

/**
 * Lifecycle of a track as far as the evaluator is concerned.
 *
 * LIVE tracks are scored every cycle; ENGAGED is terminal and such tracks
 * are never fetched or written again by the evaluator.
 */
public enum LifecycleState {
    LIVE,
    ENGAGED;

    public boolean isTerminal() {
        return this == ENGAGED;
    }
}
