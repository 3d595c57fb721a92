package kr.hhplus.be.reconciliation.domain.seatpack.service;

import kr.hhplus.be.reconciliation.domain.common.Money;
import kr.hhplus.be.reconciliation.domain.seat.NumberingScheme;
import kr.hhplus.be.reconciliation.domain.seat.Seat;
import kr.hhplus.be.reconciliation.domain.seat.SeatLabels;
import kr.hhplus.be.reconciliation.domain.seatpack.CandidatePack;
import kr.hhplus.be.reconciliation.domain.seatpack.PackLocation;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * 좌석 → 판매용 팩 생성기
 *
 * 1. 판매 가능 + 섹션이 있는 좌석만 대상
 * 2. 구역 → 섹션 → 열 단위로 묶고 열 안에서 자연 정렬
 * 3. 번호 체계에 따라 인접 좌석을 이어 연속 구간 생성 (홀짝은 홀/짝 각각)
 * 4. MAXIMAL 은 구간 하나당 팩 하나, EXHAUSTIVE 는 최소 크기 이상 모든 부분 구간
 *
 * 구역이 다르면 번호가 이어져도 같은 구간이 될 수 없다 (구역별로 먼저 나누기 때문).
 */
@Slf4j
@Component
public class SeatPackGenerator {

    private static final Comparator<Seat> SEAT_ORDER =
            Comparator.comparing(Seat::seatLabel, SeatLabels.naturalOrder())
                    .thenComparing(Seat::seatId);

    public List<CandidatePack> generate(GenerationRequest request) {
        Map<String, Map<String, Map<String, List<Seat>>>> grouped = groupByZoneSectionRow(request.seats());

        List<List<Seat>> blocks = new ArrayList<>();
        grouped.forEach((zoneId, sections) ->
                sections.forEach((sectionId, rows) -> {
                    NumberingScheme scheme = request.schemeFor(sectionId);
                    rows.values().forEach(rowSeats -> blocks.addAll(contiguousBlocks(rowSeats, scheme)));
                }));

        // 같은 좌석 구성은 같은 ID 이므로 먼저 나온 것만 남긴다
        Map<SeatPackId, CandidatePack> packs = new LinkedHashMap<>();
        for (List<Seat> block : blocks) {
            for (List<Seat> window : windows(block, request.minPackSize(), request.strategy())) {
                CandidatePack pack = toCandidate(window, request);
                packs.putIfAbsent(pack.id(), pack);
            }
        }

        log.info("[팩생성] 공연: {}, 좌석: {}, 연속구간: {}, 생성 팩: {}, 방식: {}",
                request.performanceId(), request.seats().size(), blocks.size(), packs.size(),
                request.strategy().getCode());
        return List.copyOf(packs.values());
    }

    /**
     * 공연장 좌석 번호 체계 판별 (섹션+열 단위 판별의 다수결)
     */
    public NumberingScheme detectVenueScheme(List<Seat> seats) {
        Map<String, List<Integer>> numbersByRow = new LinkedHashMap<>();
        for (Seat seat : seats) {
            String key = seat.sectionId() + "|" + seat.rowLabel();
            List<Integer> numbers = numbersByRow.computeIfAbsent(key, k -> new ArrayList<>());
            SeatLabels.numericValue(seat.seatLabel()).ifPresent(numbers::add);
        }
        return NumberingScheme.detectVenue(numbersByRow.values());
    }

    private Map<String, Map<String, Map<String, List<Seat>>>> groupByZoneSectionRow(List<Seat> seats) {
        Map<String, Map<String, Map<String, List<Seat>>>> grouped = new TreeMap<>();
        for (Seat seat : seats) {
            if (!seat.available() || !seat.hasSection()) {
                continue;
            }
            grouped.computeIfAbsent(seat.zoneId(), z -> new TreeMap<>())
                    .computeIfAbsent(seat.sectionId(), s -> new TreeMap<>(SeatLabels.naturalOrder()))
                    .computeIfAbsent(seat.rowLabel(), r -> new ArrayList<>())
                    .add(seat);
        }
        grouped.values().forEach(sections ->
                sections.values().forEach(rows ->
                        rows.values().forEach(rowSeats -> rowSeats.sort(SEAT_ORDER))));
        return grouped;
    }

    private List<List<Seat>> contiguousBlocks(List<Seat> sortedRow, NumberingScheme scheme) {
        if (scheme == NumberingScheme.ODD_EVEN) {
            List<Seat> odd = new ArrayList<>();
            List<Seat> even = new ArrayList<>();
            for (Seat seat : sortedRow) {
                OptionalInt number = SeatLabels.numericValue(seat.seatLabel());
                if (number.isEmpty()) {
                    continue;
                }
                if (number.getAsInt() % 2 == 1) {
                    odd.add(seat);
                } else {
                    even.add(seat);
                }
            }
            List<List<Seat>> blocks = new ArrayList<>(runs(odd, scheme));
            blocks.addAll(runs(even, scheme));
            return blocks;
        }
        return runs(sortedRow, scheme);
    }

    private List<List<Seat>> runs(List<Seat> seats, NumberingScheme scheme) {
        List<List<Seat>> blocks = new ArrayList<>();
        if (seats.isEmpty()) {
            return blocks;
        }
        List<Seat> current = new ArrayList<>();
        current.add(seats.get(0));
        for (int i = 1; i < seats.size(); i++) {
            if (isAdjacent(seats.get(i - 1), seats.get(i), scheme)) {
                current.add(seats.get(i));
            } else {
                blocks.add(current);
                current = new ArrayList<>();
                current.add(seats.get(i));
            }
        }
        blocks.add(current);
        return blocks;
    }

    private boolean isAdjacent(Seat previous, Seat current, NumberingScheme scheme) {
        OptionalInt prev = SeatLabels.numericValue(previous.seatLabel());
        OptionalInt curr = SeatLabels.numericValue(current.seatLabel());
        if (prev.isEmpty() || curr.isEmpty()) {
            return false;
        }
        return scheme.isAdjacent(prev.getAsInt(), curr.getAsInt());
    }

    private List<List<Seat>> windows(List<Seat> block, int minPackSize, PackingStrategy strategy) {
        List<List<Seat>> windows = new ArrayList<>();
        int length = block.size();
        if (strategy == PackingStrategy.MAXIMAL) {
            if (length >= minPackSize) {
                windows.add(block);
            }
            return windows;
        }
        for (int size = minPackSize; size <= length; size++) {
            for (int start = 0; start + size <= length; start++) {
                windows.add(block.subList(start, start + size));
            }
        }
        return windows;
    }

    private CandidatePack toCandidate(List<Seat> seats, GenerationRequest request) {
        Seat first = seats.get(0);
        Seat last = seats.get(seats.size() - 1);
        List<String> seatIds = seats.stream().map(Seat::seatId).toList();

        SeatPackId id = SeatPackId.generate(request.idPrefix(), request.source(), request.performanceId(),
                first.levelId(), first.zoneId(), first.rowLabel(), seatIds);

        PackLocation location = new PackLocation(request.performanceId(), first.levelId(), first.zoneId(),
                first.sectionId(), first.sectionName(), first.rowLabel());

        // 단가는 첫 좌석 기준 (같은 구역은 같은 가격)
        Money unitPrice = first.price();
        Money totalPrice = unitPrice == null
                ? null
                : request.markup().applyTo(unitPrice.multiply(seats.size()));

        boolean accessible = seats.stream().allMatch(Seat::wheelchairAccessible);

        return new CandidatePack(id, request.source(), location, seatIds,
                first.seatLabel(), last.seatLabel(), unitPrice, totalPrice, accessible);
    }
}
