package com.skyshield.evaluator.gateway;

import com.skyshield.evaluator.exception.PersistFailureException;
import com.skyshield.evaluator.exception.StoreConnectionException;
import com.skyshield.evaluator.exception.TrackFetchException;
import com.skyshield.evaluator.model.LifecycleState;
import com.skyshield.evaluator.model.Track;
import com.skyshield.evaluator.repository.TrackRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Track store backed by Spring Data JPA. Each session is one Spring-managed
 * transaction bound to the calling thread.
 */
@Component
public class JpaTrackStoreGateway implements TrackStoreGateway {

    private static final Logger log = LoggerFactory.getLogger(JpaTrackStoreGateway.class);

    static final String CYCLE_TRANSACTION_NAME = "threat-evaluation-cycle";

    private final TrackRepository trackRepository;
    private final PlatformTransactionManager transactionManager;
    private final DataSource dataSource;
    private final int validationTimeoutSeconds;

    public JpaTrackStoreGateway(TrackRepository trackRepository,
                                PlatformTransactionManager transactionManager,
                                DataSource dataSource,
                                @Value("${skyshield.store.validation-timeout-seconds:5}") int validationTimeoutSeconds) {
        this.trackRepository = trackRepository;
        this.transactionManager = transactionManager;
        this.dataSource = dataSource;
        this.validationTimeoutSeconds = validationTimeoutSeconds;
    }

    @Override
    public void verifyConnectivity() {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(validationTimeoutSeconds)) {
                throw new StoreConnectionException("Track store connection is not valid", null);
            }
            log.info("Track store reachable ({})", connection.getMetaData().getDatabaseProductName());
        } catch (SQLException e) {
            throw new StoreConnectionException("Cannot reach track store: " + e.getMessage(), e);
        }
    }

    @Override
    public TrackStoreSession openSession() {
        DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
        definition.setName(CYCLE_TRANSACTION_NAME);
        try {
            return new JpaSession(transactionManager.getTransaction(definition));
        } catch (TransactionException e) {
            throw new StoreConnectionException("Cannot open track store session: " + e.getMessage(), e);
        }
    }

    private final class JpaSession implements TrackStoreSession {

        private final TransactionStatus transaction;

        private JpaSession(TransactionStatus transaction) {
            this.transaction = transaction;
        }

        @Override
        public List<Track> fetchLiveTracks() {
            try {
                return trackRepository.findByStatus(LifecycleState.LIVE.name());
            } catch (DataAccessException e) {
                throw new TrackFetchException("Failed to fetch live tracks: " + e.getMessage(), e);
            }
        }

        @Override
        public boolean persistScore(long trackId, int score) {
            try {
                return trackRepository.updateThreatScore(trackId, score) > 0;
            } catch (DataAccessException e) {
                throw new PersistFailureException("Failed to persist score " + score + " for track " + trackId, e);
            }
        }

        @Override
        public boolean persistStatus(long trackId, LifecycleState status) {
            if (status == LifecycleState.LIVE) {
                log.warn("Refusing to move track {} back to {}", trackId, status);
                return false;
            }
            try {
                return trackRepository.updateStatus(trackId, status.name()) > 0;
            } catch (DataAccessException e) {
                throw new PersistFailureException("Failed to persist status " + status + " for track " + trackId, e);
            }
        }

        @Override
        public void commit() {
            if (transaction.isCompleted()) {
                return;
            }
            try {
                transactionManager.commit(transaction);
            } catch (TransactionException | DataAccessException e) {
                throw new PersistFailureException("Failed to commit cycle writes: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            if (transaction.isCompleted()) {
                return;
            }
            try {
                transactionManager.rollback(transaction);
            } catch (TransactionException e) {
                log.warn("Rollback of uncommitted cycle failed: {}", e.getMessage(), e);
            }
        }
    }
}
