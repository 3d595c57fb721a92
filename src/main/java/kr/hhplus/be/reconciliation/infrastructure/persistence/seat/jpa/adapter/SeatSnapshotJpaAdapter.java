package kr.hhplus.be.reconciliation.infrastructure.persistence.seat.jpa.adapter;

import kr.hhplus.be.reconciliation.domain.common.Money;
import kr.hhplus.be.reconciliation.domain.seat.PriceMarkup;
import kr.hhplus.be.reconciliation.domain.seat.Seat;
import kr.hhplus.be.reconciliation.domain.seat.SeatSnapshot;
import kr.hhplus.be.reconciliation.domain.seat.SeatSnapshotRepository;
import kr.hhplus.be.reconciliation.infrastructure.persistence.seat.jpa.entity.ScrapedSeatEmbeddable;
import kr.hhplus.be.reconciliation.infrastructure.persistence.seat.jpa.entity.SeatSnapshotJpaEntity;
import kr.hhplus.be.reconciliation.infrastructure.persistence.seat.jpa.repository.SeatSnapshotJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class SeatSnapshotJpaAdapter implements SeatSnapshotRepository {

    private final SeatSnapshotJpaRepository jpaRepository;

    @Override
    @Transactional
    public SeatSnapshot save(SeatSnapshot snapshot) {
        SeatSnapshotJpaEntity entity = jpaRepository.findById(snapshot.performanceId())
                .orElseGet(() -> new SeatSnapshotJpaEntity(snapshot.performanceId()));
        PriceMarkup markup = snapshot.markup();
        entity.replace(
                snapshot.source(),
                snapshot.seats().stream().map(this::toEmbeddable).toList(),
                snapshot.sectionSchemes(),
                snapshot.minPackSize(),
                snapshot.packingStrategy(),
                markup == null ? null : markup.type(),
                markup == null ? null : markup.value(),
                snapshot.capturedAt()
        );
        return toDomain(jpaRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SeatSnapshot> findByPerformanceId(String performanceId) {
        return jpaRepository.findById(performanceId).map(this::toDomain);
    }

    private ScrapedSeatEmbeddable toEmbeddable(Seat seat) {
        return new ScrapedSeatEmbeddable(seat.seatId(), seat.levelId(), seat.zoneId(), seat.sectionId(),
                seat.sectionName(), seat.rowLabel(), seat.seatLabel(), seat.available(),
                seat.price() == null ? null : seat.price().amount(), seat.wheelchairAccessible());
    }

    private SeatSnapshot toDomain(SeatSnapshotJpaEntity entity) {
        return new SeatSnapshot(
                entity.getPerformanceId(),
                entity.getSource(),
                entity.getSeats().stream()
                        .map(s -> new Seat(s.getSeatId(), s.getLevelId(), s.getZoneId(), s.getSectionId(),
                                s.getSectionName(), s.getRowLabel(), s.getSeatLabel(), s.isAvailable(),
                                Money.ofNullable(s.getPrice()), s.isWheelchairAccessible()))
                        .toList(),
                entity.getSectionSchemes(),
                entity.getMinPackSize(),
                entity.getPackingStrategy(),
                entity.getMarkupType() == null ? null : new PriceMarkup(entity.getMarkupType(), entity.getMarkupValue()),
                entity.getCapturedAt()
        );
    }
}
