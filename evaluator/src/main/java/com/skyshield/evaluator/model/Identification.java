package com.skyshield.evaluator.model;

import com.skyshield.evaluator.exception.TrackDataException;

/**
 * IFF classification of a track, with the identification risk it contributes.
 */
public enum Identification {
    FRIENDLY(0),
    UNKNOWN(40),
    HOSTILE(100);

    private final int risk;

    Identification(int risk) {
        this.risk = risk;
    }

    /**
     * Risk sub-score in [0, 100] for this classification.
     */
    public int risk() {
        return risk;
    }

    /**
     * Parses a stored IFF value. Matching is exact: values such as
     * {@code "BOGEY"}, {@code "hostile"} or null are data errors.
     *
     * @throws TrackDataException if the value is not one of the known classifications
     */
    public static Identification parse(String raw) {
        if (raw != null) {
            for (Identification candidate : values()) {
                if (candidate.name().equals(raw)) {
                    return candidate;
                }
            }
        }
        throw new TrackDataException("Unknown identification value: " + raw);
    }
}
