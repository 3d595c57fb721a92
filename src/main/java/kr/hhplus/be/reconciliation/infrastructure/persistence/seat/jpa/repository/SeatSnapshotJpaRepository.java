package kr.hhplus.be.reconciliation.infrastructure.persistence.seat.jpa.repository;

import kr.hhplus.be.reconciliation.infrastructure.persistence.seat.jpa.entity.SeatSnapshotJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SeatSnapshotJpaRepository extends JpaRepository<SeatSnapshotJpaEntity, String> {
}
