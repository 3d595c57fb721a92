package kr.hhplus.be.reconciliation.infrastructure.persistence.venue.jpa.entity;

import jakarta.persistence.*;
import kr.hhplus.be.reconciliation.domain.seat.NumberingScheme;

import java.time.LocalDateTime;

@Entity
@Table(name = "venue_seat_structure")
public class VenueSeatStructureJpaEntity {

    @Id
    @Column(name = "venue_id", length = 100)
    private String venueId;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_scheme", nullable = false, length = 20)
    private NumberingScheme currentScheme;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_scheme", length = 20)
    private NumberingScheme previousScheme;

    @Column(name = "last_detected_at")
    private LocalDateTime lastDetectedAt;

    @Column(name = "last_changed_at")
    private LocalDateTime lastChangedAt;

    @Version
    private Long version;

    protected VenueSeatStructureJpaEntity() {}

    public VenueSeatStructureJpaEntity(String venueId) {
        this.venueId = venueId;
    }

    public void update(NumberingScheme currentScheme, NumberingScheme previousScheme,
                       LocalDateTime lastDetectedAt, LocalDateTime lastChangedAt) {
        this.currentScheme = currentScheme;
        this.previousScheme = previousScheme;
        this.lastDetectedAt = lastDetectedAt;
        this.lastChangedAt = lastChangedAt;
    }

    public String getVenueId() { return venueId; }
    public NumberingScheme getCurrentScheme() { return currentScheme; }
    public NumberingScheme getPreviousScheme() { return previousScheme; }
    public LocalDateTime getLastDetectedAt() { return lastDetectedAt; }
    public LocalDateTime getLastChangedAt() { return lastChangedAt; }
    public Long getVersion() { return version; }
}
