package com.skyshield.evaluator.exception;

/**
 * Root of the threat evaluator's error taxonomy.
 *
 * Subclasses of {@link FatalEvaluatorException} stop the loop and terminate
 * the process with a non-zero exit code. Every other subclass is
 * recoverable: it is logged and the loop carries on.
 */
public abstract class EvaluatorException extends RuntimeException {

    protected EvaluatorException(String message) {
        super(message);
    }

    protected EvaluatorException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns true if this error must stop the evaluator.
     */
    public boolean isFatal() {
        return false;
    }
}
