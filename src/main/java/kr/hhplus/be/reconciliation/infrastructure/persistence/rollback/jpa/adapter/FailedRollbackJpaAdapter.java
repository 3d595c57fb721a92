package kr.hhplus.be.reconciliation.infrastructure.persistence.rollback.jpa.adapter;

import kr.hhplus.be.reconciliation.domain.rollback.FailedRollback;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollbackNotFoundException;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollbackRepository;
import kr.hhplus.be.reconciliation.infrastructure.persistence.rollback.jpa.entity.FailedRollbackJpaEntity;
import kr.hhplus.be.reconciliation.infrastructure.persistence.rollback.jpa.repository.FailedRollbackJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class FailedRollbackJpaAdapter implements FailedRollbackRepository {

    private final FailedRollbackJpaRepository jpaRepository;

    /**
     * 호출한 작업이 롤백되더라도 기록은 남아야 하므로 별도 트랜잭션
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FailedRollback append(FailedRollback failedRollback) {
        FailedRollbackJpaEntity entity = new FailedRollbackJpaEntity(
                failedRollback.getOperationId(),
                failedRollback.getPackId(),
                failedRollback.getActionType(),
                failedRollback.getActionData(),
                failedRollback.getErrorMessage(),
                failedRollback.getCreatedAt()
        );
        return toDomain(jpaRepository.save(entity));
    }

    @Override
    @Transactional
    public FailedRollback markResolved(FailedRollback failedRollback) {
        FailedRollbackJpaEntity entity = jpaRepository.findById(failedRollback.getId())
                .orElseThrow(() -> new FailedRollbackNotFoundException(failedRollback.getId()));
        entity.resolve(failedRollback.getResolvedAt(), failedRollback.getResolvedBy(),
                failedRollback.getResolutionNotes());
        return toDomain(jpaRepository.save(entity));
    }

    @Override
    public Optional<FailedRollback> findById(Long id) {
        return jpaRepository.findById(id).map(this::toDomain);
    }

    @Override
    public List<FailedRollback> findUnresolved() {
        return jpaRepository.findByResolvedAtIsNullOrderByCreatedAtAsc()
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    public long countUnresolved() {
        return jpaRepository.countByResolvedAtIsNull();
    }

    private FailedRollback toDomain(FailedRollbackJpaEntity entity) {
        return FailedRollback.restore(
                entity.getId(),
                entity.getOperationId(),
                entity.getPackId(),
                entity.getActionType(),
                entity.getActionData(),
                entity.getErrorMessage(),
                entity.getCreatedAt(),
                entity.getResolvedAt(),
                entity.getResolvedBy(),
                entity.getResolutionNotes()
        );
    }
}
