package kr.hhplus.be.reconciliation.application.port.out;

public record PosHoldResult(boolean success, Integer httpStatus, String errorMessage) {

    public static PosHoldResult held() {
        return new PosHoldResult(true, null, null);
    }

    public static PosHoldResult failed(Integer httpStatus, String errorMessage) {
        return new PosHoldResult(false, httpStatus, errorMessage);
    }
}
