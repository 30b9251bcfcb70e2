package com.skyshield.evaluator.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * An error the evaluator cannot recover from. Spring Boot turns the exit
 * code into the process exit status when this escapes a runner.
 */
public abstract class FatalEvaluatorException extends EvaluatorException implements ExitCodeGenerator {

    protected FatalEvaluatorException(String message) {
        super(message);
    }

    protected FatalEvaluatorException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public final boolean isFatal() {
        return true;
    }
}
