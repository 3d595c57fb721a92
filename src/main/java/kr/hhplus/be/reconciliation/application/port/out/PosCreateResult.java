package kr.hhplus.be.reconciliation.application.port.out;

/**
 * 리스팅 생성 결과
 */
public record PosCreateResult(boolean success, String listingId, Integer httpStatus, String errorMessage) {

    public static PosCreateResult created(String listingId) {
        return new PosCreateResult(true, listingId, null, null);
    }

    public static PosCreateResult failed(Integer httpStatus, String errorMessage) {
        return new PosCreateResult(false, null, httpStatus, errorMessage);
    }
}
