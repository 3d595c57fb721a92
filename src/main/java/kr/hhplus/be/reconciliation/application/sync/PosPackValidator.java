package kr.hhplus.be.reconciliation.application.sync;

import kr.hhplus.be.reconciliation.domain.performance.Performance;
import kr.hhplus.be.reconciliation.domain.seatpack.PackStatus;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * POS 전송 전 팩 검증 (유령 팩 차단)
 */
@Component
public class PosPackValidator {

    /**
     * @return 검증 실패 사유 목록 (비어 있으면 전송 가능)
     */
    public List<String> validate(SeatPack pack, Performance performance) {
        List<String> reasons = new ArrayList<>();

        if (pack.getPackStatus() != PackStatus.ACTIVE) {
            reasons.add("inactive pack");
        }
        if (pack.getTotalPrice() == null || !pack.getTotalPrice().isPositive()) {
            reasons.add("price must be positive");
        }
        if (pack.getPackSize() <= 0 || pack.getSeatIds().isEmpty()) {
            reasons.add("pack has no seats");
        }
        if (!pack.getLocation().isResolvable()) {
            reasons.add("unresolvable zone/section/row");
        }
        if (pack.isOperatorHeld()) {
            reasons.add("pack is under manual hold");
        }
        if (performance == null) {
            reasons.add("unknown performance");
        } else if (performance.getEventDate() == null || performance.getVenueName() == null) {
            reasons.add("missing event date or venue");
        }
        return reasons;
    }
}
