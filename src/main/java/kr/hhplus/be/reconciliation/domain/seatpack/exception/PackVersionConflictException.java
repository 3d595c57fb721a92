package kr.hhplus.be.reconciliation.domain.seatpack.exception;

/**
 * 낙관적 락 재시도를 모두 소진한 경우
 */
public class PackVersionConflictException extends RuntimeException {

    public PackVersionConflictException(String packId, int attempts, Throwable cause) {
        super(String.format("팩 버전 충돌: packId = %s, %d회 재시도 후 실패", packId, attempts), cause);
    }
}
