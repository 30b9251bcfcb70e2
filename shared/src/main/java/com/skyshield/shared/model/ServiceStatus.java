package com.skyshield.shared.model;

/**
 * Lifecycle of a long-running SkyShield worker such as the threat evaluator loop.
 *
 * A worker starts in STARTING, moves to RUNNING once its first cycle is
 * scheduled and ends in STOPPED, either because it was cancelled or because
 * it hit a fatal error. STOPPED is terminal.
 */
public enum ServiceStatus {
    STARTING,
    RUNNING,
    STOPPED;

    /**
     * Returns true if the worker is executing cycles.
     */
    public boolean isRunning() {
        return this == RUNNING;
    }

    /**
     * Returns true if the worker has terminated.
     */
    public boolean isDown() {
        return this == STOPPED;
    }

    /**
     * Returns true if a transition from this status to {@code next} is allowed.
     */
    public boolean canTransitionTo(ServiceStatus next) {
        return switch (this) {
            case STARTING -> next == RUNNING || next == STOPPED;
            case RUNNING -> next == STOPPED;
            case STOPPED -> false;
        };
    }
}
