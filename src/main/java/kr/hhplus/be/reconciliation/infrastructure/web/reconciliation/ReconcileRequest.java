package kr.hhplus.be.reconciliation.infrastructure.web.reconciliation;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import kr.hhplus.be.reconciliation.application.port.in.ReconciliationUseCase.PerformanceInfo;
import kr.hhplus.be.reconciliation.application.port.in.ReconciliationUseCase.ReconcileCommand;
import kr.hhplus.be.reconciliation.domain.common.Money;
import kr.hhplus.be.reconciliation.domain.seat.PriceMarkup;
import kr.hhplus.be.reconciliation.domain.seat.Seat;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 스크래퍼가 보내는 좌석 스냅샷
 */
public record ReconcileRequest(
        @NotBlank String performanceId,
        @NotBlank String source,
        @Valid PerformanceRequest performance,
        @NotNull List<@Valid SeatRequest> seats,
        String numberingScheme,
        Map<String, String> sectionSchemes,
        Integer minPackSize,
        String packingStrategy,
        @Valid MarkupRequest markup
) {

    public record PerformanceRequest(
            @NotBlank String venueId,
            String eventName,
            LocalDateTime eventDate,
            String venueName,
            String city,
            String stateProvince,
            String countryCode
    ) {
        PerformanceInfo toInfo() {
            return new PerformanceInfo(venueId, eventName, eventDate, venueName, city, stateProvince, countryCode);
        }
    }

    public record SeatRequest(
            @NotBlank @Pattern(regexp = "[^,]+", message = "좌석 ID에 쉼표를 쓸 수 없습니다") String seatId,
            String levelId,
            @NotBlank String zoneId,
            String sectionId,
            String sectionName,
            @NotBlank String rowLabel,
            @NotBlank String seatLabel,
            boolean available,
            BigDecimal price,
            boolean wheelchairAccessible
    ) {
        Seat toSeat() {
            return new Seat(seatId, levelId, zoneId, sectionId, sectionName == null ? sectionId : sectionName,
                    rowLabel, seatLabel, available, Money.ofNullable(price), wheelchairAccessible);
        }
    }

    public record MarkupRequest(@NotNull PriceMarkup.MarkupType type, @NotNull BigDecimal value) {
        PriceMarkup toMarkup() {
            return new PriceMarkup(type, value);
        }
    }

    public ReconcileCommand toCommand() {
        return new ReconcileCommand(
                performanceId,
                source,
                performance == null ? null : performance.toInfo(),
                seats.stream().map(SeatRequest::toSeat).toList(),
                numberingScheme,
                sectionSchemes,
                minPackSize,
                packingStrategy,
                markup == null ? null : markup.toMarkup()
        );
    }
}
