package com.skyshield.evaluator;

import com.skyshield.evaluator.model.LifecycleState;
import com.skyshield.evaluator.model.Track;

import java.util.UUID;

/**
 * Track records for tests. The protected point used throughout is (400, 300).
 */
public final class TrackFixtures {

    public static final double CENTER_X = 400;
    public static final double CENTER_Y = 300;

    private TrackFixtures() {
    }

    /**
     * A LIVE track {@code distance} units east of the protected point.
     */
    public static Track liveTrack(Long id, double distance, double speed, String iff, Integer storedScore) {
        Track track = new Track();
        track.setId(id);
        track.setExternalRef(UUID.randomUUID().toString());
        track.setX(CENTER_X + distance);
        track.setY(CENTER_Y);
        track.setSpeed(speed);
        track.setIdentification(iff);
        track.setThreatScore(storedScore);
        track.setStatus(LifecycleState.LIVE.name());
        return track;
    }

    public static Track newLiveTrack(double distance, double speed, String iff, Integer storedScore) {
        return liveTrack(null, distance, speed, iff, storedScore);
    }
}
