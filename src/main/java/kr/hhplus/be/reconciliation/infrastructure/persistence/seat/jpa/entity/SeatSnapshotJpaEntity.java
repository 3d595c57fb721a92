package kr.hhplus.be.reconciliation.infrastructure.persistence.seat.jpa.entity;

import jakarta.persistence.*;
import kr.hhplus.be.reconciliation.domain.seat.PriceMarkup;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "performance_seat_snapshot")
public class SeatSnapshotJpaEntity {

    @Id
    @Column(name = "performance_id", length = 100)
    private String performanceId;

    @Column(name = "source", length = 50)
    private String source;

    @ElementCollection
    @CollectionTable(name = "performance_seat_snapshot_seat",
            joinColumns = @JoinColumn(name = "performance_id"))
    @OrderColumn(name = "seat_order")
    private List<ScrapedSeatEmbeddable> seats = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "performance_seat_snapshot_section_scheme",
            joinColumns = @JoinColumn(name = "performance_id"))
    @MapKeyColumn(name = "section_id", length = 100)
    @Column(name = "scheme", length = 20)
    private Map<String, String> sectionSchemes = new HashMap<>();

    @Column(name = "min_pack_size")
    private Integer minPackSize;

    @Column(name = "packing_strategy", length = 20)
    private String packingStrategy;

    @Enumerated(EnumType.STRING)
    @Column(name = "markup_type", length = 20)
    private PriceMarkup.MarkupType markupType;

    @Column(name = "markup_value", precision = 12, scale = 4)
    private BigDecimal markupValue;

    @Column(name = "captured_at", nullable = false)
    private LocalDateTime capturedAt;

    @Version
    private Long version;

    protected SeatSnapshotJpaEntity() {}

    public SeatSnapshotJpaEntity(String performanceId) {
        this.performanceId = performanceId;
    }

    public void replace(String source, List<ScrapedSeatEmbeddable> seats, Map<String, String> sectionSchemes,
                        Integer minPackSize, String packingStrategy, PriceMarkup.MarkupType markupType,
                        BigDecimal markupValue, LocalDateTime capturedAt) {
        this.source = source;
        this.seats.clear();
        this.seats.addAll(seats);
        this.sectionSchemes.clear();
        this.sectionSchemes.putAll(sectionSchemes);
        this.minPackSize = minPackSize;
        this.packingStrategy = packingStrategy;
        this.markupType = markupType;
        this.markupValue = markupValue;
        this.capturedAt = capturedAt;
    }

    public String getPerformanceId() { return performanceId; }
    public String getSource() { return source; }
    public List<ScrapedSeatEmbeddable> getSeats() { return seats; }
    public Map<String, String> getSectionSchemes() { return sectionSchemes; }
    public Integer getMinPackSize() { return minPackSize; }
    public String getPackingStrategy() { return packingStrategy; }
    public PriceMarkup.MarkupType getMarkupType() { return markupType; }
    public BigDecimal getMarkupValue() { return markupValue; }
    public LocalDateTime getCapturedAt() { return capturedAt; }
    public Long getVersion() { return version; }
}
