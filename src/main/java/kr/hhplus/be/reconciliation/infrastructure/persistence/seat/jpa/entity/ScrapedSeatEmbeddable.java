package kr.hhplus.be.reconciliation.infrastructure.persistence.seat.jpa.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.math.BigDecimal;

@Embeddable
public class ScrapedSeatEmbeddable {

    @Column(name = "seat_id", nullable = false, length = 100)
    private String seatId;

    @Column(name = "level_id", length = 100)
    private String levelId;

    @Column(name = "zone_id", nullable = false, length = 100)
    private String zoneId;

    @Column(name = "section_id", length = 100)
    private String sectionId;

    @Column(name = "section_name", length = 200)
    private String sectionName;

    @Column(name = "row_label", nullable = false, length = 20)
    private String rowLabel;

    @Column(name = "seat_label", nullable = false, length = 20)
    private String seatLabel;

    @Column(name = "available", nullable = false)
    private boolean available;

    @Column(name = "price", precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "wheelchair_accessible", nullable = false)
    private boolean wheelchairAccessible;

    protected ScrapedSeatEmbeddable() {}

    public ScrapedSeatEmbeddable(String seatId, String levelId, String zoneId, String sectionId,
                                 String sectionName, String rowLabel, String seatLabel, boolean available,
                                 BigDecimal price, boolean wheelchairAccessible) {
        this.seatId = seatId;
        this.levelId = levelId;
        this.zoneId = zoneId;
        this.sectionId = sectionId;
        this.sectionName = sectionName;
        this.rowLabel = rowLabel;
        this.seatLabel = seatLabel;
        this.available = available;
        this.price = price;
        this.wheelchairAccessible = wheelchairAccessible;
    }

    public String getSeatId() { return seatId; }
    public String getLevelId() { return levelId; }
    public String getZoneId() { return zoneId; }
    public String getSectionId() { return sectionId; }
    public String getSectionName() { return sectionName; }
    public String getRowLabel() { return rowLabel; }
    public String getSeatLabel() { return seatLabel; }
    public boolean isAvailable() { return available; }
    public BigDecimal getPrice() { return price; }
    public boolean isWheelchairAccessible() { return wheelchairAccessible; }
}
