package kr.hhplus.be.reconciliation.infrastructure.persistence.venue.jpa.adapter;

import kr.hhplus.be.reconciliation.domain.venue.VenueSeatStructure;
import kr.hhplus.be.reconciliation.domain.venue.VenueSeatStructureRepository;
import kr.hhplus.be.reconciliation.infrastructure.persistence.venue.jpa.entity.VenueSeatStructureJpaEntity;
import kr.hhplus.be.reconciliation.infrastructure.persistence.venue.jpa.repository.VenueSeatStructureJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class VenueSeatStructureJpaAdapter implements VenueSeatStructureRepository {

    private final VenueSeatStructureJpaRepository jpaRepository;

    @Override
    public VenueSeatStructure save(VenueSeatStructure structure) {
        VenueSeatStructureJpaEntity entity = jpaRepository.findById(structure.getVenueId())
                .orElseGet(() -> new VenueSeatStructureJpaEntity(structure.getVenueId()));
        entity.update(structure.getCurrentScheme(), structure.getPreviousScheme(),
                structure.getLastDetectedAt(), structure.getLastChangedAt());
        return toDomain(jpaRepository.saveAndFlush(entity));
    }

    @Override
    public Optional<VenueSeatStructure> findByVenueId(String venueId) {
        return jpaRepository.findById(venueId).map(this::toDomain);
    }

    private VenueSeatStructure toDomain(VenueSeatStructureJpaEntity entity) {
        return VenueSeatStructure.restore(
                entity.getVenueId(),
                entity.getCurrentScheme(),
                entity.getPreviousScheme(),
                entity.getLastDetectedAt(),
                entity.getLastChangedAt()
        );
    }
}
