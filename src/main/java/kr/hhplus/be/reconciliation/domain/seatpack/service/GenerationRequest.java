package kr.hhplus.be.reconciliation.domain.seatpack.service;

import kr.hhplus.be.reconciliation.domain.seat.NumberingScheme;
import kr.hhplus.be.reconciliation.domain.seat.PriceMarkup;
import kr.hhplus.be.reconciliation.domain.seat.Seat;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 팩 생성 입력
 *
 * @param performanceId  공연 ID
 * @param source         스크랩 소스 (ID 해시에 포함)
 * @param idPrefix       소스별 팩 ID 접두어
 * @param seats          스크랩된 좌석 전체 (판매 가능 여부 포함)
 * @param defaultScheme  섹션별 지정이 없을 때 쓰는 번호 체계
 * @param sectionSchemes 섹션 ID → 번호 체계
 * @param minPackSize    최소 팩 크기 (1 미만이면 1로 보정)
 * @param strategy       팩 구성 방식
 * @param markup         공연장 가격 마크업
 */
public record GenerationRequest(
        String performanceId,
        String source,
        String idPrefix,
        List<Seat> seats,
        NumberingScheme defaultScheme,
        Map<String, NumberingScheme> sectionSchemes,
        int minPackSize,
        PackingStrategy strategy,
        PriceMarkup markup
) {

    public GenerationRequest {
        Objects.requireNonNull(performanceId, "공연 ID는 필수입니다");
        seats = seats == null ? List.of() : List.copyOf(seats);
        defaultScheme = defaultScheme == null ? NumberingScheme.CONSECUTIVE : defaultScheme;
        sectionSchemes = sectionSchemes == null ? Map.of() : Map.copyOf(sectionSchemes);
        minPackSize = Math.max(1, minPackSize);
        strategy = strategy == null ? PackingStrategy.MAXIMAL : strategy;
        markup = markup == null ? PriceMarkup.none() : markup;
        idPrefix = idPrefix == null || idPrefix.isBlank() ? "unk" : idPrefix;
    }

    public NumberingScheme schemeFor(String sectionId) {
        return sectionSchemes.getOrDefault(sectionId, defaultScheme);
    }
}
