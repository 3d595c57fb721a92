package kr.hhplus.be.reconciliation.infrastructure.persistence.seatpack.jpa.entity;

import jakarta.persistence.*;
import kr.hhplus.be.reconciliation.domain.seatpack.DelistReason;
import kr.hhplus.be.reconciliation.domain.seatpack.PackState;
import kr.hhplus.be.reconciliation.domain.seatpack.PackStatus;
import kr.hhplus.be.reconciliation.domain.seatpack.PosOperationStatus;
import kr.hhplus.be.reconciliation.domain.seatpack.PosStatus;
import org.hibernate.annotations.DynamicUpdate;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 좌석 팩 계보 테이블 (물리 삭제 없음)
 *
 * 리스 컬럼은 조건부 UPDATE 로만 바뀌므로 변경 컬럼만 쓰도록 @DynamicUpdate
 */
@Entity
@DynamicUpdate
@Table(
        name = "seat_pack",
        indexes = {
                @Index(name = "idx_seat_pack_performance_status", columnList = "performance_id, pack_status"),
                @Index(name = "idx_seat_pack_sync_queue", columnList = "synced_to_pos, pos_sync_attempts, created_at"),
                @Index(name = "idx_seat_pack_locked_by", columnList = "locked_by")
        }
)
public class SeatPackJpaEntity {

    @Id
    @Column(name = "pack_id", length = 100)
    private String id;

    @Column(name = "source", length = 50)
    private String source;

    @Column(name = "performance_id", nullable = false, length = 100)
    private String performanceId;

    @Column(name = "level_id", length = 100)
    private String levelId;

    @Column(name = "zone_id", length = 100)
    private String zoneId;

    @Column(name = "section_id", length = 100)
    private String sectionId;

    @Column(name = "section_name")
    private String sectionName;

    @Column(name = "row_label", length = 50)
    private String rowLabel;

    // 좌석 ID 목록 (쉼표 구분, 순서 유지)
    @Column(name = "seat_ids", nullable = false, length = 4000)
    private String seatIds;

    @Column(name = "start_seat", length = 50)
    private String startSeat;

    @Column(name = "end_seat", length = 50)
    private String endSeat;

    @Column(name = "pack_size", nullable = false)
    private Integer packSize;

    @Column(name = "wheelchair_accessible", nullable = false)
    private boolean wheelchairAccessible;

    @Column(name = "seat_price", precision = 12, scale = 2)
    private BigDecimal seatPrice;

    @Column(name = "total_price", precision = 12, scale = 2)
    private BigDecimal totalPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "pack_status", nullable = false, length = 20)
    private PackStatus packStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "pos_status", nullable = false, length = 20)
    private PosStatus posStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "pack_state", nullable = false, length = 20)
    private PackState packState;

    @Enumerated(EnumType.STRING)
    @Column(name = "delist_reason", length = 30)
    private DelistReason delistReason;

    @Column(name = "source_pack_ids", length = 4000)
    private String sourcePackIds;

    @Column(name = "synced_to_pos", nullable = false)
    private boolean syncedToPos;

    @Column(name = "pos_sync_attempts", nullable = false)
    private int posSyncAttempts;

    @Column(name = "last_pos_sync_attempt")
    private LocalDateTime lastPosSyncAttempt;

    @Column(name = "pos_sync_error", length = 1000)
    private String posSyncError;

    @Column(name = "pos_listing_id", length = 100)
    private String posListingId;

    @Column(name = "pos_operation_id", length = 100)
    private String posOperationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "pos_operation_status", length = 20)
    private PosOperationStatus posOperationStatus;

    @Column(name = "manually_delisted", nullable = false)
    private boolean manuallyDelisted;

    @Column(name = "manually_delisted_by", length = 100)
    private String manuallyDelistedBy;

    @Column(name = "manually_delisted_at")
    private LocalDateTime manuallyDelistedAt;

    @Column(name = "manually_delisted_reason", length = 500)
    private String manuallyDelistedReason;

    @Column(name = "manually_enabled_by", length = 100)
    private String manuallyEnabledBy;

    @Column(name = "manually_enabled_at")
    private LocalDateTime manuallyEnabledAt;

    @Column(name = "locked_by", length = 100)
    private String lockedBy;

    @Column(name = "locked_at")
    private LocalDateTime lockedAt;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    protected SeatPackJpaEntity() {}

    /**
     * 신규 팩 (버전은 JPA 가 부여)
     */
    public SeatPackJpaEntity(String id, String source, String performanceId, String levelId, String zoneId,
                             String sectionId, String sectionName, String rowLabel, String seatIds,
                             String startSeat, String endSeat, int packSize, boolean wheelchairAccessible,
                             LocalDateTime createdAt) {
        this.id = id;
        this.source = source;
        this.performanceId = performanceId;
        this.levelId = levelId;
        this.zoneId = zoneId;
        this.sectionId = sectionId;
        this.sectionName = sectionName;
        this.rowLabel = rowLabel;
        this.seatIds = seatIds;
        this.startSeat = startSeat;
        this.endSeat = endSeat;
        this.packSize = packSize;
        this.wheelchairAccessible = wheelchairAccessible;
        this.createdAt = createdAt == null ? LocalDateTime.now() : createdAt;
        this.updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    void preUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    // Getters
    public String getId() { return id; }
    public String getSource() { return source; }
    public String getPerformanceId() { return performanceId; }
    public String getLevelId() { return levelId; }
    public String getZoneId() { return zoneId; }
    public String getSectionId() { return sectionId; }
    public String getSectionName() { return sectionName; }
    public String getRowLabel() { return rowLabel; }
    public String getSeatIds() { return seatIds; }
    public String getStartSeat() { return startSeat; }
    public String getEndSeat() { return endSeat; }
    public Integer getPackSize() { return packSize; }
    public boolean isWheelchairAccessible() { return wheelchairAccessible; }
    public BigDecimal getSeatPrice() { return seatPrice; }
    public BigDecimal getTotalPrice() { return totalPrice; }
    public PackStatus getPackStatus() { return packStatus; }
    public PosStatus getPosStatus() { return posStatus; }
    public PackState getPackState() { return packState; }
    public DelistReason getDelistReason() { return delistReason; }
    public String getSourcePackIds() { return sourcePackIds; }
    public boolean isSyncedToPos() { return syncedToPos; }
    public int getPosSyncAttempts() { return posSyncAttempts; }
    public LocalDateTime getLastPosSyncAttempt() { return lastPosSyncAttempt; }
    public String getPosSyncError() { return posSyncError; }
    public String getPosListingId() { return posListingId; }
    public String getPosOperationId() { return posOperationId; }
    public PosOperationStatus getPosOperationStatus() { return posOperationStatus; }
    public boolean isManuallyDelisted() { return manuallyDelisted; }
    public String getManuallyDelistedBy() { return manuallyDelistedBy; }
    public LocalDateTime getManuallyDelistedAt() { return manuallyDelistedAt; }
    public String getManuallyDelistedReason() { return manuallyDelistedReason; }
    public String getManuallyEnabledBy() { return manuallyEnabledBy; }
    public LocalDateTime getManuallyEnabledAt() { return manuallyEnabledAt; }
    public String getLockedBy() { return lockedBy; }
    public LocalDateTime getLockedAt() { return lockedAt; }
    public Long getVersion() { return version; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    // Setters (좌석 구성과 리스 컬럼은 변경하지 않음)
    public void setSeatPrice(BigDecimal seatPrice) { this.seatPrice = seatPrice; }
    public void setTotalPrice(BigDecimal totalPrice) { this.totalPrice = totalPrice; }
    public void setPackStatus(PackStatus packStatus) { this.packStatus = packStatus; }
    public void setPosStatus(PosStatus posStatus) { this.posStatus = posStatus; }
    public void setPackState(PackState packState) { this.packState = packState; }
    public void setDelistReason(DelistReason delistReason) { this.delistReason = delistReason; }
    public void setSourcePackIds(String sourcePackIds) { this.sourcePackIds = sourcePackIds; }
    public void setSyncedToPos(boolean syncedToPos) { this.syncedToPos = syncedToPos; }
    public void setPosSyncAttempts(int posSyncAttempts) { this.posSyncAttempts = posSyncAttempts; }
    public void setLastPosSyncAttempt(LocalDateTime lastPosSyncAttempt) { this.lastPosSyncAttempt = lastPosSyncAttempt; }
    public void setPosSyncError(String posSyncError) { this.posSyncError = posSyncError; }
    public void setPosListingId(String posListingId) { this.posListingId = posListingId; }
    public void setPosOperationId(String posOperationId) { this.posOperationId = posOperationId; }
    public void setPosOperationStatus(PosOperationStatus posOperationStatus) { this.posOperationStatus = posOperationStatus; }
    public void setManuallyDelisted(boolean manuallyDelisted) { this.manuallyDelisted = manuallyDelisted; }
    public void setManuallyDelistedBy(String manuallyDelistedBy) { this.manuallyDelistedBy = manuallyDelistedBy; }
    public void setManuallyDelistedAt(LocalDateTime manuallyDelistedAt) { this.manuallyDelistedAt = manuallyDelistedAt; }
    public void setManuallyDelistedReason(String manuallyDelistedReason) { this.manuallyDelistedReason = manuallyDelistedReason; }
    public void setManuallyEnabledBy(String manuallyEnabledBy) { this.manuallyEnabledBy = manuallyEnabledBy; }
    public void setManuallyEnabledAt(LocalDateTime manuallyEnabledAt) { this.manuallyEnabledAt = manuallyEnabledAt; }
}
