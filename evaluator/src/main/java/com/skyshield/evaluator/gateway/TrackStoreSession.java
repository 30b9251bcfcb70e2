package com.skyshield.evaluator.gateway;

import com.skyshield.evaluator.exception.PersistFailureException;
import com.skyshield.evaluator.exception.TrackFetchException;
import com.skyshield.evaluator.model.LifecycleState;
import com.skyshield.evaluator.model.Track;

import java.util.List;

/**
 * One evaluation cycle's view of the track store.
 *
 * A session holds a single connection for the duration of the cycle. Writes
 * become visible on {@link #commit()}; {@link #close()} always releases the
 * connection and discards anything not committed.
 */
public interface TrackStoreSession extends AutoCloseable {

    /**
     * Returns the current snapshot of all tracks in state LIVE.
     *
     * @throws TrackFetchException if the read fails
     */
    List<Track> fetchLiveTracks();

    /**
     * Writes a new threat score. Writing the same score twice has no further effect.
     *
     * @return true if a LIVE row was updated
     * @throws PersistFailureException if the write fails
     */
    boolean persistScore(long trackId, int score);

    /**
     * Writes a new lifecycle state. A regression from ENGAGED to LIVE is refused.
     *
     * @return true if the row changed state
     * @throws PersistFailureException if the write fails
     */
    boolean persistStatus(long trackId, LifecycleState status);

    /**
     * Commits every write made in this session.
     *
     * @throws PersistFailureException if the commit fails; the cycle's writes are lost
     */
    void commit();

    @Override
    void close();
}
