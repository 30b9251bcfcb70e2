package com.skyshield.evaluator.model;

import com.skyshield.evaluator.exception.TrackDataException;

/**
 * Validated, immutable view of a LIVE track taken at the start of a cycle.
 *
 * @param id          store identifier
 * @param externalRef external track reference (UUID string)
 * @param position    current position
 * @param speed       non-negative speed magnitude
 * @param identification parsed IFF classification
 * @param storedScore score currently persisted for the track; a missing score reads as 0
 */
public record TrackSnapshot(
    long id,
    String externalRef,
    Position position,
    double speed,
    Identification identification,
    int storedScore
) {

    /**
     * Builds a snapshot from a stored track.
     *
     * @throws TrackDataException if the row has a missing or malformed position, speed or identification
     */
    public static TrackSnapshot of(Track track) {
        if (track.getId() == null) {
            throw new TrackDataException("Track has no id: " + track.getExternalRef());
        }
        String ref = track.getExternalRef() != null ? track.getExternalRef() : "#" + track.getId();

        Double x = track.getX();
        Double y = track.getY();
        if (x == null || y == null || !Double.isFinite(x) || !Double.isFinite(y)) {
            throw new TrackDataException("Track " + ref + " has malformed position (" + x + ", " + y + ")");
        }

        Double speed = track.getSpeed();
        if (speed == null || !Double.isFinite(speed) || speed < 0) {
            throw new TrackDataException("Track " + ref + " has malformed speed " + speed);
        }

        Identification identification;
        try {
            identification = Identification.parse(track.getIdentification());
        } catch (TrackDataException e) {
            throw new TrackDataException("Track " + ref + ": " + e.getMessage(), e);
        }

        int stored = track.getThreatScore() != null ? track.getThreatScore() : 0;
        return new TrackSnapshot(track.getId(), ref, new Position(x, y), speed, identification, stored);
    }
}
