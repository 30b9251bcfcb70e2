package com.skyshield.evaluator.exception;

/**
 * A single track record is malformed; only that track is skipped.
 */
public class TrackDataException extends EvaluatorException {

    public TrackDataException(String message) {
        super(message);
    }

    public TrackDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
