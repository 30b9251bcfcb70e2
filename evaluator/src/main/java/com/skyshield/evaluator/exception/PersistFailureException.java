package com.skyshield.evaluator.exception;

/**
 * A score or status write, or the cycle commit, failed. Scores are
 * recomputed from scratch every cycle so the next cycle retries naturally.
 */
public class PersistFailureException extends EvaluatorException {

    public PersistFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
