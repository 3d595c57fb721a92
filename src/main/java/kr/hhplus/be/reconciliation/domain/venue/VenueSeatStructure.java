package kr.hhplus.be.reconciliation.domain.venue;

import kr.hhplus.be.reconciliation.domain.seat.NumberingScheme;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * 공연장별로 마지막으로 기록된 좌석 번호 체계
 */
public class VenueSeatStructure {

    private final String venueId;
    private NumberingScheme currentScheme;
    private NumberingScheme previousScheme;
    private LocalDateTime lastDetectedAt;
    private LocalDateTime lastChangedAt;

    private VenueSeatStructure(String venueId, NumberingScheme currentScheme, NumberingScheme previousScheme,
                               LocalDateTime lastDetectedAt, LocalDateTime lastChangedAt) {
        this.venueId = Objects.requireNonNull(venueId, "공연장 ID는 필수입니다");
        this.currentScheme = Objects.requireNonNull(currentScheme, "번호 체계는 필수입니다");
        this.previousScheme = previousScheme;
        this.lastDetectedAt = lastDetectedAt;
        this.lastChangedAt = lastChangedAt;
    }

    public static VenueSeatStructure first(String venueId, NumberingScheme scheme, LocalDateTime now) {
        return new VenueSeatStructure(venueId, scheme, null, now, null);
    }

    public static VenueSeatStructure restore(String venueId, NumberingScheme currentScheme,
                                             NumberingScheme previousScheme, LocalDateTime lastDetectedAt,
                                             LocalDateTime lastChangedAt) {
        return new VenueSeatStructure(venueId, currentScheme, previousScheme, lastDetectedAt, lastChangedAt);
    }

    /**
     * 새로 판별한 번호 체계를 기록하고, 바뀌었으면 변경 내역을 돌려준다
     */
    public Optional<VenueStructureChange> record(NumberingScheme detected, LocalDateTime now) {
        this.lastDetectedAt = now;
        if (detected == currentScheme) {
            return Optional.empty();
        }
        VenueStructureChange change = new VenueStructureChange(venueId, currentScheme, detected, now);
        this.previousScheme = currentScheme;
        this.currentScheme = detected;
        this.lastChangedAt = now;
        return Optional.of(change);
    }

    public String getVenueId() { return venueId; }
    public NumberingScheme getCurrentScheme() { return currentScheme; }
    public NumberingScheme getPreviousScheme() { return previousScheme; }
    public LocalDateTime getLastDetectedAt() { return lastDetectedAt; }
    public LocalDateTime getLastChangedAt() { return lastChangedAt; }
}
