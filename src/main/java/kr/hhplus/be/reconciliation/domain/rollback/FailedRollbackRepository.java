package kr.hhplus.be.reconciliation.domain.rollback;

import java.util.List;
import java.util.Optional;

/**
 * 롤백 실패 로그 (추가 전용, 처리 여부만 갱신)
 */
public interface FailedRollbackRepository {

    FailedRollback append(FailedRollback failedRollback);

    FailedRollback markResolved(FailedRollback failedRollback);

    Optional<FailedRollback> findById(Long id);

    List<FailedRollback> findUnresolved();

    long countUnresolved();
}
