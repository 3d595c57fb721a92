package kr.hhplus.be.reconciliation.infrastructure.persistence.performance.jpa.repository;

import kr.hhplus.be.reconciliation.infrastructure.persistence.performance.jpa.entity.PerformanceJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PerformanceJpaRepository extends JpaRepository<PerformanceJpaEntity, String> {

    List<PerformanceJpaEntity> findByVenueId(String venueId);
}
