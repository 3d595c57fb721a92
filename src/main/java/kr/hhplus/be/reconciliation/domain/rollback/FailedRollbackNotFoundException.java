package kr.hhplus.be.reconciliation.domain.rollback;

public class FailedRollbackNotFoundException extends RuntimeException {

    public FailedRollbackNotFoundException(Long id) {
        super("롤백 실패 기록을 찾을 수 없습니다: " + id);
    }
}
