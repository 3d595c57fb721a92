package kr.hhplus.be.reconciliation.domain.venue;

import java.util.Optional;

public interface VenueSeatStructureRepository {

    VenueSeatStructure save(VenueSeatStructure structure);

    Optional<VenueSeatStructure> findByVenueId(String venueId);
}
