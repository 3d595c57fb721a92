package kr.hhplus.be.reconciliation.domain.seatpack.exception;

import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackId;

import java.util.List;

/**
 * POS 에 보낼 수 없는 팩 (가격/크기/위치 정보 누락 등)
 */
public class PackValidationException extends RuntimeException {

    private final SeatPackId packId;
    private final List<String> reasons;

    public PackValidationException(SeatPackId packId, List<String> reasons) {
        super("Validation failed: " + String.join(", ", reasons));
        this.packId = packId;
        this.reasons = List.copyOf(reasons);
    }

    public SeatPackId getPackId() {
        return packId;
    }

    public List<String> getReasons() {
        return reasons;
    }
}
