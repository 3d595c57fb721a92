package kr.hhplus.be.reconciliation.domain.seat;

import java.util.Optional;

public interface SeatSnapshotRepository {

    /**
     * 공연의 이전 스냅샷을 통째로 교체한다
     */
    SeatSnapshot save(SeatSnapshot snapshot);

    Optional<SeatSnapshot> findByPerformanceId(String performanceId);
}
