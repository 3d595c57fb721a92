package kr.hhplus.be.reconciliation.domain.seatpack.exception;

import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackId;

/**
 * 허용되지 않는 팩 상태 전환 시도
 */
public class InvalidPackTransitionException extends RuntimeException {

    private final SeatPackId packId;

    public InvalidPackTransitionException(SeatPackId packId, String message) {
        super(String.format("[%s] %s", packId, message));
        this.packId = packId;
    }

    public SeatPackId getPackId() {
        return packId;
    }
}
