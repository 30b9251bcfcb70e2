package com.skyshield.evaluator.loop;

import com.skyshield.evaluator.exception.FatalEvaluatorException;
import com.skyshield.evaluator.exception.PersistFailureException;
import com.skyshield.evaluator.exception.TrackDataException;
import com.skyshield.evaluator.exception.TrackFetchException;
import com.skyshield.evaluator.gateway.TrackStoreGateway;
import com.skyshield.evaluator.gateway.TrackStoreSession;
import com.skyshield.evaluator.model.LifecycleState;
import com.skyshield.evaluator.model.Track;
import com.skyshield.evaluator.model.TrackSnapshot;
import com.skyshield.evaluator.policy.DeadBandFilter;
import com.skyshield.evaluator.policy.EscalationPolicy;
import com.skyshield.evaluator.scoring.ThreatAssessment;
import com.skyshield.evaluator.scoring.ThreatScorer;
import com.skyshield.shared.model.ServiceStatus;
import com.skyshield.shared.util.MdcPropagator;
import com.skyshield.shared.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The threat evaluation control loop.
 *
 * Each cycle opens a store session, scores every LIVE track, writes scores
 * that moved beyond the dead-band, engages tracks above the critical
 * threshold, commits, and releases the session. Cycles never overlap; the
 * loop keeps no state between them beyond counters.
 *
 * Recoverable errors (fetch, data, persist) are logged and absorbed here.
 * Fatal errors propagate out of {@link #run(Ticker)} and leave the loop
 * STOPPED; any other runtime failure costs one cycle.
 */
public class EvaluatorLoop {

    private static final Logger log = LoggerFactory.getLogger(EvaluatorLoop.class);

    public static final String METRIC_CYCLES = "evaluator.cycles";
    public static final String METRIC_CYCLE_FAILURES = "evaluator.cycles.failed";
    public static final String METRIC_CYCLES_SKIPPED = "evaluator.cycles.skipped";
    public static final String METRIC_TRACKS_EVALUATED = "evaluator.tracks.evaluated";
    public static final String METRIC_DATA_ERRORS = "evaluator.tracks.data_errors";
    public static final String METRIC_SCORES_WRITTEN = "evaluator.scores.written";
    public static final String METRIC_SCORES_SUPPRESSED = "evaluator.scores.suppressed";
    public static final String METRIC_ESCALATIONS = "evaluator.escalations";
    public static final String METRIC_PERSIST_FAILURES = "evaluator.persist.failures";
    public static final String TIMER_CYCLE = "evaluator.cycle";

    private final TrackStoreGateway gateway;
    private final ThreatScorer scorer;
    private final DeadBandFilter deadBand;
    private final EscalationPolicy escalationPolicy;
    private final MetricsCollector metrics;

    private volatile ServiceStatus status = ServiceStatus.STARTING;

    public EvaluatorLoop(TrackStoreGateway gateway,
                         ThreatScorer scorer,
                         DeadBandFilter deadBand,
                         EscalationPolicy escalationPolicy,
                         MetricsCollector metrics) {
        this.gateway = gateway;
        this.scorer = scorer;
        this.deadBand = deadBand;
        this.escalationPolicy = escalationPolicy;
        this.metrics = metrics;
    }

    /**
     * Runs cycles until the ticker stops or a fatal error escapes a cycle.
     */
    public void run(Ticker ticker) {
        transitionTo(ServiceStatus.RUNNING);
        try {
            while (ticker.awaitNextTick()) {
                try {
                    runCycle();
                } catch (FatalEvaluatorException e) {
                    log.error("Fatal error, stopping threat evaluator: {}", e.getMessage(), e);
                    throw e;
                } catch (RuntimeException e) {
                    log.error("Unexpected failure in evaluation cycle, continuing", e);
                    metrics.incrementCounter(METRIC_CYCLE_FAILURES);
                }
            }
            log.info("Threat evaluator loop finished after {} cycles", metrics.getCounter(METRIC_CYCLES));
        } finally {
            transitionTo(ServiceStatus.STOPPED);
        }
    }

    /**
     * Runs exactly one cycle.
     */
    public CycleReport runCycle() {
        metrics.incrementCounter(METRIC_CYCLES);
        try (MdcPropagator.Scope cycle = MdcPropagator.openCycle();
             MetricsCollector.Span span = metrics.startSpan(TIMER_CYCLE);
             TrackStoreSession session = gateway.openSession()) {

            List<Track> tracks;
            try {
                tracks = session.fetchLiveTracks();
            } catch (TrackFetchException e) {
                log.error("Skipping cycle: {}", e.getMessage(), e);
                metrics.incrementCounter(METRIC_CYCLES_SKIPPED);
                return CycleReport.skippedCycle();
            }

            Tally tally = new Tally(tracks.size());
            for (Track track : tracks) {
                evaluate(session, track, tally);
            }

            try {
                session.commit();
                tally.committed = true;
            } catch (PersistFailureException e) {
                log.error("Cycle writes were not committed: {}", e.getMessage(), e);
                metrics.incrementCounter(METRIC_PERSIST_FAILURES);
                tally.persistFailures++;
            }

            CycleReport report = tally.toReport();
            log.debug("Cycle done: {}", report);
            return report;
        }
    }

    private void evaluate(TrackStoreSession session, Track track, Tally tally) {
        try (MdcPropagator.Scope trackScope = MdcPropagator.forTrack(track.getExternalRef())) {
            TrackSnapshot snapshot;
            try {
                snapshot = toLiveSnapshot(track);
            } catch (TrackDataException e) {
                log.warn("Skipping track: {}", e.getMessage());
                metrics.incrementCounter(METRIC_DATA_ERRORS);
                tally.dataErrors++;
                return;
            }

            ThreatAssessment assessment = scorer.assess(snapshot);
            int score = assessment.score();
            tally.evaluated++;
            metrics.incrementCounter(METRIC_TRACKS_EVALUATED);

            if (deadBand.shouldPersist(snapshot.storedScore(), score)) {
                log.info("[EVAL] {}: Speed:{} Dist:{} -> Score: {}",
                    snapshot.externalRef(), snapshot.speed(), (int) assessment.distance(), score);
                if (write(() -> session.persistScore(snapshot.id(), score), tally)) {
                    tally.scoresWritten++;
                    metrics.incrementCounter(METRIC_SCORES_WRITTEN);
                }
            } else {
                log.debug("Score {} within dead-band of stored {}, not persisted", score, snapshot.storedScore());
                tally.scoresSuppressed++;
                metrics.incrementCounter(METRIC_SCORES_SUPPRESSED);
            }

            // Escalation looks at the computed score even when the dead-band held the write back.
            if (escalationPolicy.shouldEngage(score, LifecycleState.LIVE)) {
                log.warn("RED ALERT: auto-engaging {} {} (score {} > {})",
                    snapshot.identification(), snapshot.externalRef(), score, escalationPolicy.getThreshold());
                if (write(() -> session.persistStatus(snapshot.id(), LifecycleState.ENGAGED), tally)) {
                    tally.escalations++;
                    metrics.incrementCounter(METRIC_ESCALATIONS);
                }
            }
        }
    }

    private static TrackSnapshot toLiveSnapshot(Track track) {
        if (!LifecycleState.LIVE.name().equals(track.getStatus())) {
            throw new TrackDataException("Track " + track.getExternalRef()
                + " is not LIVE (" + track.getStatus() + ")");
        }
        return TrackSnapshot.of(track);
    }

    private boolean write(Write write, Tally tally) {
        try {
            return write.apply();
        } catch (PersistFailureException e) {
            log.error("{}", e.getMessage(), e);
            metrics.incrementCounter(METRIC_PERSIST_FAILURES);
            tally.persistFailures++;
            return false;
        }
    }

    private void transitionTo(ServiceStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Evaluator loop cannot go from " + status + " to " + next);
        }
        log.info("Threat evaluator loop {} -> {}", status, next);
        status = next;
    }

    public ServiceStatus getStatus() {
        return status;
    }

    @FunctionalInterface
    private interface Write {
        boolean apply();
    }

    private static final class Tally {
        private final int fetched;
        private int evaluated;
        private int dataErrors;
        private int scoresWritten;
        private int scoresSuppressed;
        private int escalations;
        private int persistFailures;
        private boolean committed;

        private Tally(int fetched) {
            this.fetched = fetched;
        }

        private CycleReport toReport() {
            return new CycleReport(fetched, evaluated, dataErrors, scoresWritten, scoresSuppressed,
                escalations, persistFailures, false, committed);
        }
    }
}
