package kr.hhplus.be.reconciliation.application.port.out;

/**
 * 리스팅 삭제 결과
 * - DELETED: 삭제됨
 * - NOT_FOUND: POS 에 이미 없음 (성공으로 취급)
 * - FAILED: 재시도 대상
 */
public record PosDeleteResult(Outcome outcome, Integer httpStatus, String errorMessage) {

    public enum Outcome {
        DELETED,
        NOT_FOUND,
        FAILED
    }

    public static PosDeleteResult deleted() {
        return new PosDeleteResult(Outcome.DELETED, null, null);
    }

    public static PosDeleteResult notFound() {
        return new PosDeleteResult(Outcome.NOT_FOUND, 404, null);
    }

    public static PosDeleteResult failed(Integer httpStatus, String errorMessage) {
        return new PosDeleteResult(Outcome.FAILED, httpStatus, errorMessage);
    }

    public boolean isSuccess() {
        return outcome != Outcome.FAILED;
    }
}
