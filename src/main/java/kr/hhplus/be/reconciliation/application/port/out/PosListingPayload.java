package kr.hhplus.be.reconciliation.application.port.out;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.List;

/**
 * POS 리스팅 생성 요청 본문
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PosListingPayload(
        String currencyCode,
        BigDecimal unitCost,
        String deliveryType,
        String inHandAt,
        Seating seating,
        EventMapping eventMapping,
        String externalId,
        int ticketCount,
        boolean autoBroadcast,
        String internalNotes,
        boolean zoneFill,
        List<ListingNote> listingNotes
) {

    public record Seating(String section, String row) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EventMapping(
            String eventName,
            String eventDate,
            String venueName,
            boolean isEventDateConfirmed,
            String city,
            String stateProvince,
            String countryCode
    ) {
    }

    public record ListingNote(String note) {
    }
}
