package kr.hhplus.be.reconciliation.infrastructure.persistence.rollback.jpa.repository;

import kr.hhplus.be.reconciliation.infrastructure.persistence.rollback.jpa.entity.FailedRollbackJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FailedRollbackJpaRepository extends JpaRepository<FailedRollbackJpaEntity, Long> {

    List<FailedRollbackJpaEntity> findByResolvedAtIsNullOrderByCreatedAtAsc();

    long countByResolvedAtIsNull();
}
