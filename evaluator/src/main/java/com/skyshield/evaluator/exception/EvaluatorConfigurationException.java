package com.skyshield.evaluator.exception;

import java.util.List;

/**
 * The evaluator configuration is invalid. Carries every violation found,
 * not only the first one.
 */
public class EvaluatorConfigurationException extends FatalEvaluatorException {

    public static final int EXIT_CODE = 3;

    private final List<String> violations;

    public EvaluatorConfigurationException(List<String> violations) {
        super("Invalid threat evaluator configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
