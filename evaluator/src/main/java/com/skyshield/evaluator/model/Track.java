package com.skyshield.evaluator.model;

import jakarta.persistence.*;

import java.util.Objects;

/**
 * A tracked object as stored in the shared {@code tracks} table.
 *
 * Rows are created and moved by the external track producer. The evaluator
 * only reads position, speed and identification and only writes
 * {@code threat_score} and {@code status}. Identification and status are
 * kept as raw text so a malformed row surfaces as a per-track data error
 * instead of failing the whole fetch.
 */
@Entity
@Table(name = "tracks")
public class Track {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "track_uuid", nullable = false, updatable = false, length = 64)
    private String externalRef;

    @Column(name = "x_pos")
    private Double x;

    @Column(name = "y_pos")
    private Double y;

    @Column(name = "speed_knots")
    private Double speed;

    @Column(name = "iff_status", length = 32)
    private String identification;

    @Column(name = "threat_score")
    private Integer threatScore = 0;

    @Column(name = "status", nullable = false, length = 32)
    private String status = LifecycleState.LIVE.name();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Track track = (Track) o;
        return id != null && Objects.equals(id, track.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Track{id=" + id + ", ref=" + externalRef + ", status=" + status + "}";
    }

    // Getters and setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getExternalRef() { return externalRef; }
    public void setExternalRef(String externalRef) { this.externalRef = externalRef; }
    public Double getX() { return x; }
    public void setX(Double x) { this.x = x; }
    public Double getY() { return y; }
    public void setY(Double y) { this.y = y; }
    public Double getSpeed() { return speed; }
    public void setSpeed(Double speed) { this.speed = speed; }
    public String getIdentification() { return identification; }
    public void setIdentification(String identification) { this.identification = identification; }
    public Integer getThreatScore() { return threatScore; }
    public void setThreatScore(Integer threatScore) { this.threatScore = threatScore; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
}
