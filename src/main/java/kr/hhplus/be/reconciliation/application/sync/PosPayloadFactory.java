package kr.hhplus.be.reconciliation.application.sync;

import kr.hhplus.be.reconciliation.application.port.out.PosListingPayload;
import kr.hhplus.be.reconciliation.application.port.out.PosListingPayload.EventMapping;
import kr.hhplus.be.reconciliation.application.port.out.PosListingPayload.ListingNote;
import kr.hhplus.be.reconciliation.application.port.out.PosListingPayload.Seating;
import kr.hhplus.be.reconciliation.domain.common.Money;
import kr.hhplus.be.reconciliation.domain.performance.Performance;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 팩 → POS 리스팅 요청 본문 변환
 */
@Component
@RequiredArgsConstructor
public class PosPayloadFactory {

    private static final DateTimeFormatter EVENT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final DateTimeFormatter NOTE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final String ACCESSIBLE_NOTE = "Wheelchair accessible seating";

    private final ReconciliationProperties properties;

    public PosListingPayload build(SeatPack pack, Performance performance, LocalDateTime now) {
        String eventTime = performance.getEventDate().format(EVENT_TIME);

        EventMapping eventMapping = new EventMapping(
                performance.getEventName(),
                eventTime,
                performance.getVenueName(),
                true,
                performance.getCity(),
                performance.getStateProvince(),
                performance.getCountryCode()
        );

        List<ListingNote> notes = pack.isWheelchairAccessible()
                ? List.of(new ListingNote(ACCESSIBLE_NOTE))
                : null;

        return new PosListingPayload(
                properties.getPos().getCurrency(),
                unitCost(pack).amount(),
                properties.getPos().getDeliveryType(),
                eventTime,
                new Seating(pack.getLocation().sectionName(), pack.getLocation().rowLabel()),
                eventMapping,
                pack.getId().value(),
                pack.getPackSize(),
                true,
                String.format("Auto-created via reconciliation sync. Generated on %s (%s, sources: %s)",
                        now.format(NOTE_TIME), pack.getPackState().name().toLowerCase(),
                        pack.getSourcePackIds().isEmpty() ? "-" : String.join(",", pack.getSourcePackIds())),
                true,
                notes
        );
    }

    // 장당 가격 = 총액 / 장수
    private Money unitCost(SeatPack pack) {
        return pack.getTotalPrice().divide(pack.getPackSize());
    }
}
