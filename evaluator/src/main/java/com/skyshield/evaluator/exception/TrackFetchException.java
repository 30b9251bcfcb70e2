package com.skyshield.evaluator.exception;

/**
 * Reading the LIVE tracks failed; the current cycle is skipped.
 */
public class TrackFetchException extends EvaluatorException {

    public TrackFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
