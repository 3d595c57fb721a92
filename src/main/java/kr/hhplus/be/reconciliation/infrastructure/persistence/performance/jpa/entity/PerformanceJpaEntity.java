package kr.hhplus.be.reconciliation.infrastructure.persistence.performance.jpa.entity;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "performance",
        indexes = {
                @Index(name = "idx_performance_venue", columnList = "venue_id")
        }
)
public class PerformanceJpaEntity {

    @Id
    @Column(name = "performance_id", length = 100)
    private String performanceId;

    @Column(name = "venue_id", nullable = false, length = 100)
    private String venueId;

    @Column(name = "event_name")
    private String eventName;

    @Column(name = "event_date")
    private LocalDateTime eventDate;

    @Column(name = "event_date_confirmed", nullable = false)
    private boolean eventDateConfirmed;

    @Column(name = "venue_name")
    private String venueName;

    @Column(name = "city", length = 100)
    private String city;

    @Column(name = "state_province", length = 100)
    private String stateProvince;

    @Column(name = "country_code", length = 10)
    private String countryCode;

    @Column(name = "pos_enabled", nullable = false)
    private boolean posEnabled;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    protected PerformanceJpaEntity() {}

    public PerformanceJpaEntity(String performanceId, String venueId) {
        this.performanceId = performanceId;
        this.venueId = venueId;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public void update(String eventName, LocalDateTime eventDate, boolean eventDateConfirmed, String venueName,
                       String city, String stateProvince, String countryCode, boolean posEnabled) {
        this.eventName = eventName;
        this.eventDate = eventDate;
        this.eventDateConfirmed = eventDateConfirmed;
        this.venueName = venueName;
        this.city = city;
        this.stateProvince = stateProvince;
        this.countryCode = countryCode;
        this.posEnabled = posEnabled;
    }

    // Getters
    public String getPerformanceId() { return performanceId; }
    public String getVenueId() { return venueId; }
    public String getEventName() { return eventName; }
    public LocalDateTime getEventDate() { return eventDate; }
    public boolean isEventDateConfirmed() { return eventDateConfirmed; }
    public String getVenueName() { return venueName; }
    public String getCity() { return city; }
    public String getStateProvince() { return stateProvince; }
    public String getCountryCode() { return countryCode; }
    public boolean isPosEnabled() { return posEnabled; }
    public Long getVersion() { return version; }
}
