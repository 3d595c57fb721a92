package kr.hhplus.be.reconciliation.domain.seatpack;

import kr.hhplus.be.reconciliation.domain.common.Money;

import java.util.List;
import java.util.Objects;

/**
 * 팩 생성기가 만든 후보 팩 (아직 저장되지 않은 불변 값)
 */
public record CandidatePack(
        SeatPackId id,
        String source,
        PackLocation location,
        List<String> seatIds,
        String startSeat,
        String endSeat,
        Money seatPrice,
        Money totalPrice,
        boolean wheelchairAccessible
) {

    public CandidatePack {
        Objects.requireNonNull(id, "팩 ID는 필수입니다");
        Objects.requireNonNull(location, "팩 위치는 필수입니다");
        if (seatIds == null || seatIds.isEmpty()) {
            throw new IllegalArgumentException("팩에는 최소 1개의 좌석이 필요합니다");
        }
        seatIds = List.copyOf(seatIds);
    }

    public int packSize() {
        return seatIds.size();
    }

    public boolean hasSamePrice(SeatPack pack) {
        return Objects.equals(seatPrice, pack.getSeatPrice())
                && Objects.equals(totalPrice, pack.getTotalPrice());
    }
}
