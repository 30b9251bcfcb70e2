package com.skyshield.evaluator.repository;

import com.skyshield.evaluator.model.Track;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Access to the shared {@code tracks} table.
 *
 * Writes are targeted JPQL updates so the evaluator never overwrites the
 * producer's position, speed or identification columns.
 */
@Repository
public interface TrackRepository extends JpaRepository<Track, Long> {

    List<Track> findByStatus(String status);

    Optional<Track> findByExternalRef(String externalRef);

    // Only LIVE rows take a score; an operator may have engaged the track since the fetch.
    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("UPDATE Track t SET t.threatScore = :score WHERE t.id = :id AND t.status = 'LIVE'")
    int updateThreatScore(@Param("id") Long id, @Param("score") int score);

    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("UPDATE Track t SET t.status = :status WHERE t.id = :id AND t.status <> 'ENGAGED'")
    int updateStatus(@Param("id") Long id, @Param("status") String status);
}
