package kr.hhplus.be.reconciliation.domain.performance;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PerformanceRepository {

    Performance save(Performance performance);

    Optional<Performance> findById(String performanceId);

    List<Performance> findAllById(Collection<String> performanceIds);

    List<Performance> findByVenueId(String venueId);
}
