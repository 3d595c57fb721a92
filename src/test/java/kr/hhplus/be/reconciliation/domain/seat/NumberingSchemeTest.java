package kr.hhplus.be.reconciliation.domain.seat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NumberingSchemeTest {

    @Test
    @DisplayName("차이가 대부분 1이면 연번")
    void detectRow_consecutive() {
        assertThat(NumberingScheme.detectRow(List.of(1, 2, 3, 4, 6))).isEqualTo(NumberingScheme.CONSECUTIVE);
    }

    @Test
    @DisplayName("차이가 대부분 2이면 홀짝")
    void detectRow_oddEven() {
        assertThat(NumberingScheme.detectRow(List.of(9, 1, 3, 5, 7))).isEqualTo(NumberingScheme.ODD_EVEN);
    }

    @Test
    @DisplayName("판단 기준에 못 미치면 연번으로 본다")
    void detectRow_ambiguous_defaultsToConsecutive() {
        assertThat(NumberingScheme.detectRow(List.of(1, 2, 4, 7, 11))).isEqualTo(NumberingScheme.CONSECUTIVE);
    }

    @Test
    @DisplayName("공연장 체계는 열 판별의 다수결, 좌석 1개 열은 제외")
    void detectVenue_majority() {
        NumberingScheme scheme = NumberingScheme.detectVenue(List.of(
                List.of(1, 3, 5),
                List.of(2, 4, 6),
                List.of(1, 2, 3),
                List.of(7)
        ));

        assertThat(scheme).isEqualTo(NumberingScheme.ODD_EVEN);
    }

    @Test
    @DisplayName("코드와 이름 모두로 찾을 수 있고 모르는 코드는 거부")
    void fromCode() {
        assertThat(NumberingScheme.fromCode("odd_even")).isEqualTo(NumberingScheme.ODD_EVEN);
        assertThat(NumberingScheme.fromCode("CONSECUTIVE")).isEqualTo(NumberingScheme.CONSECUTIVE);
        assertThatThrownBy(() -> NumberingScheme.fromCode("zigzag"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("라벨 자연 정렬과 숫자 추출")
    void seatLabels() {
        List<String> labels = new java.util.ArrayList<>(List.of("A10", "A2", "A1"));
        labels.sort(SeatLabels.naturalOrder());

        assertThat(labels).containsExactly("A1", "A2", "A10");
        assertThat(SeatLabels.numericValue("A12").getAsInt()).isEqualTo(12);
        assertThat(SeatLabels.numericValue("BOX")).isEmpty();
    }
}
