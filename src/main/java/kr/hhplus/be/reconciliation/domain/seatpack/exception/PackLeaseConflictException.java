package kr.hhplus.be.reconciliation.domain.seatpack.exception;

/**
 * 다른 프로세스가 팩 리스를 보유 중일 때
 */
public class PackLeaseConflictException extends RuntimeException {

    public PackLeaseConflictException(String packId, String holderId) {
        super(String.format("팩 리스 획득 실패: packId = %s, 요청자 = %s (다른 프로세스가 보유 중)", packId, holderId));
    }
}
