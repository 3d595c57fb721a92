package kr.hhplus.be.reconciliation.infrastructure.persistence.venue.jpa.repository;

import kr.hhplus.be.reconciliation.infrastructure.persistence.venue.jpa.entity.VenueSeatStructureJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VenueSeatStructureJpaRepository extends JpaRepository<VenueSeatStructureJpaEntity, String> {
}
