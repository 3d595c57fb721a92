package kr.hhplus.be.reconciliation.infrastructure.persistence.performance.jpa.adapter;

import jakarta.persistence.OptimisticLockException;
import kr.hhplus.be.reconciliation.domain.performance.Performance;
import kr.hhplus.be.reconciliation.domain.performance.PerformanceRepository;
import kr.hhplus.be.reconciliation.infrastructure.persistence.performance.jpa.entity.PerformanceJpaEntity;
import kr.hhplus.be.reconciliation.infrastructure.persistence.performance.jpa.repository.PerformanceJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class PerformanceJpaAdapter implements PerformanceRepository {

    private final PerformanceJpaRepository jpaRepository;

    @Override
    public Performance save(Performance performance) {
        PerformanceJpaEntity entity = jpaRepository.findById(performance.getPerformanceId())
                .map(existing -> {
                    // version 체크 (낙관적 락)
                    if (performance.getVersion() != null && !Objects.equals(existing.getVersion(), performance.getVersion())) {
                        throw new OptimisticLockException("공연 정보가 다른 작업에 의해 수정되었습니다");
                    }
                    return existing;
                })
                .orElseGet(() -> new PerformanceJpaEntity(performance.getPerformanceId(), performance.getVenueId()));

        entity.update(
                performance.getEventName(),
                performance.getEventDate(),
                performance.isEventDateConfirmed(),
                performance.getVenueName(),
                performance.getCity(),
                performance.getStateProvince(),
                performance.getCountryCode(),
                performance.isPosEnabled()
        );
        return toDomain(jpaRepository.saveAndFlush(entity));
    }

    @Override
    public Optional<Performance> findById(String performanceId) {
        return jpaRepository.findById(performanceId).map(this::toDomain);
    }

    @Override
    public List<Performance> findAllById(Collection<String> performanceIds) {
        if (performanceIds.isEmpty()) {
            return List.of();
        }
        return jpaRepository.findAllById(performanceIds)
                .stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    public List<Performance> findByVenueId(String venueId) {
        return jpaRepository.findByVenueId(venueId)
                .stream()
                .map(this::toDomain)
                .toList();
    }

    private Performance toDomain(PerformanceJpaEntity entity) {
        return Performance.restore(
                entity.getPerformanceId(),
                entity.getVenueId(),
                entity.getEventName(),
                entity.getEventDate(),
                entity.isEventDateConfirmed(),
                entity.getVenueName(),
                entity.getCity(),
                entity.getStateProvince(),
                entity.getCountryCode(),
                entity.isPosEnabled(),
                entity.getVersion()
        );
    }
}
