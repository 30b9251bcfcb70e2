package com.skyshield.evaluator.integration;

import com.skyshield.evaluator.TrackFixtures;
import com.skyshield.evaluator.gateway.JpaTrackStoreGateway;
import com.skyshield.evaluator.gateway.TrackStoreSession;
import com.skyshield.evaluator.model.LifecycleState;
import com.skyshield.evaluator.model.Track;
import com.skyshield.evaluator.repository.TrackRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sessions open their own transactions, so these tests run outside the
 * usual test transaction and clean up after themselves.
 */
@DataJpaTest
@ActiveProfiles("test")
@Import(JpaTrackStoreGateway.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Tag("integration")
public class JpaTrackStoreGatewayTest {

    @Autowired
    private JpaTrackStoreGateway gateway;

    @Autowired
    private TrackRepository trackRepository;

    @BeforeEach
    void setUp() {
        trackRepository.deleteAll();
    }

    @Test
    void test_connectivity_check_passes_on_reachable_store() {
        assertDoesNotThrow(() -> gateway.verifyConnectivity());
    }

    @Test
    void test_fetch_live_tracks_excludes_engaged() {
        Track live = trackRepository.save(TrackFixtures.newLiveTrack(50, 100, "UNKNOWN", 0));
        Track engaged = TrackFixtures.newLiveTrack(0, 1500, "HOSTILE", 100);
        engaged.setStatus(LifecycleState.ENGAGED.name());
        trackRepository.save(engaged);

        try (TrackStoreSession session = gateway.openSession()) {
            List<Track> tracks = session.fetchLiveTracks();
            assertEquals(1, tracks.size());
            assertEquals(live.getId(), tracks.get(0).getId());
        }
    }

    @Test
    void test_committed_writes_are_visible() {
        Track track = trackRepository.save(TrackFixtures.newLiveTrack(0, 1500, "HOSTILE", 0));

        try (TrackStoreSession session = gateway.openSession()) {
            assertTrue(session.persistScore(track.getId(), 100));
            assertTrue(session.persistStatus(track.getId(), LifecycleState.ENGAGED));
            session.commit();
        }

        Track reloaded = trackRepository.findById(track.getId()).orElseThrow();
        assertEquals(100, reloaded.getThreatScore());
        assertEquals(LifecycleState.ENGAGED.name(), reloaded.getStatus());
    }

    @Test
    void test_uncommitted_writes_are_rolled_back_on_close() {
        Track track = trackRepository.save(TrackFixtures.newLiveTrack(0, 0, "HOSTILE", 0));

        try (TrackStoreSession session = gateway.openSession()) {
            session.persistScore(track.getId(), 70);
        }

        assertEquals(0, trackRepository.findById(track.getId()).orElseThrow().getThreatScore());
    }

    @Test
    void test_repeated_score_write_is_idempotent() {
        Track track = trackRepository.save(TrackFixtures.newLiveTrack(0, 0, "HOSTILE", 0));

        try (TrackStoreSession session = gateway.openSession()) {
            session.persistScore(track.getId(), 70);
            session.persistScore(track.getId(), 70);
            session.commit();
        }

        assertEquals(70, trackRepository.findById(track.getId()).orElseThrow().getThreatScore());
    }

    @Test
    void test_regression_to_live_is_refused() {
        Track track = TrackFixtures.newLiveTrack(0, 1500, "HOSTILE", 100);
        track.setStatus(LifecycleState.ENGAGED.name());
        track = trackRepository.save(track);

        try (TrackStoreSession session = gateway.openSession()) {
            assertFalse(session.persistStatus(track.getId(), LifecycleState.LIVE));
            session.commit();
        }

        assertEquals(LifecycleState.ENGAGED.name(),
            trackRepository.findById(track.getId()).orElseThrow().getStatus());
    }

    @Test
    void test_commit_twice_is_harmless() {
        try (TrackStoreSession session = gateway.openSession()) {
            session.commit();
            assertDoesNotThrow(session::commit);
        }
    }
}
