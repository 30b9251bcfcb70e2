package com.skyshield.evaluator.exception;

/**
 * The track store cannot be reached at all.
 */
public class StoreConnectionException extends FatalEvaluatorException {

    public static final int EXIT_CODE = 2;

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
