package kr.hhplus.be.reconciliation.application.port.in;

import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 팩 조회 결과
 */
public record SeatPackView(
        String packId,
        String performanceId,
        String zoneId,
        String sectionName,
        String rowLabel,
        String startSeat,
        String endSeat,
        int packSize,
        BigDecimal totalPrice,
        String packStatus,
        String posStatus,
        String packState,
        String delistReason,
        List<String> sourcePackIds,
        boolean syncedToPos,
        int posSyncAttempts,
        String posSyncError,
        String posListingId,
        String manuallyDelistedBy,
        LocalDateTime manuallyDelistedAt,
        String manuallyDelistedReason
) {

    public static SeatPackView from(SeatPack pack) {
        return new SeatPackView(
                pack.getId().value(),
                pack.getPerformanceId(),
                pack.getLocation().zoneId(),
                pack.getLocation().sectionName(),
                pack.getLocation().rowLabel(),
                pack.getStartSeat(),
                pack.getEndSeat(),
                pack.getPackSize(),
                pack.getTotalPrice() == null ? null : pack.getTotalPrice().amount(),
                pack.getPackStatus().name(),
                pack.getPosStatus().name(),
                pack.getPackState().name(),
                pack.getDelistReason() == null ? null : pack.getDelistReason().name(),
                pack.getSourcePackIds(),
                pack.isSyncedToPos(),
                pack.getPosSyncAttempts(),
                pack.getPosSyncError(),
                pack.getPosListingId(),
                pack.getManuallyDelistedBy(),
                pack.getManuallyDelistedAt(),
                pack.getManuallyDelistedReason()
        );
    }
}
