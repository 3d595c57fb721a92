package kr.hhplus.be.reconciliation.domain.seatpack.exception;

public class SeatPackNotFoundException extends RuntimeException {

    public SeatPackNotFoundException(String packId) {
        super("좌석 팩을 찾을 수 없습니다: " + packId);
    }
}
