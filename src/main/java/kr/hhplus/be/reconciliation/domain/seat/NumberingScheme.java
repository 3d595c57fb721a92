package kr.hhplus.be.reconciliation.domain.seat;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 좌석 번호 체계
 * - CONSECUTIVE: 1, 2, 3 ... (차이 1이면 인접)
 * - ODD_EVEN: 1, 3, 5 / 2, 4, 6 ... (홀짝 각각 차이 2이면 인접)
 */
public enum NumberingScheme {

    CONSECUTIVE("consecutive", "연번", 1),
    ODD_EVEN("odd_even", "홀짝", 2);

    private static final double DETECTION_THRESHOLD = 0.7;

    private final String code;
    private final String displayName;
    private final int step;

    NumberingScheme(String code, String displayName, int step) {
        this.code = code;
        this.displayName = displayName;
        this.step = step;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getStep() {
        return step;
    }

    public boolean isAdjacent(int previous, int current) {
        return current - previous == step;
    }

    public static NumberingScheme fromCode(String code) {
        for (NumberingScheme scheme : values()) {
            if (scheme.code.equalsIgnoreCase(code) || scheme.name().equalsIgnoreCase(code)) {
                return scheme;
            }
        }
        throw new IllegalArgumentException("알 수 없는 좌석 번호 체계입니다: " + code);
    }

    /**
     * 한 열의 좌석 번호 체계 판별
     * 정렬된 번호 간 차이 중 70% 이상이 1이면 연번, 2이면 홀짝, 그 외에는 연번으로 본다.
     */
    public static NumberingScheme detectRow(Collection<Integer> seatNumbers) {
        List<Integer> sorted = new ArrayList<>(seatNumbers);
        sorted.sort(Integer::compare);
        if (sorted.size() < 2) {
            return CONSECUTIVE;
        }

        int diffOne = 0;
        int diffTwo = 0;
        int total = sorted.size() - 1;
        for (int i = 1; i < sorted.size(); i++) {
            int diff = sorted.get(i) - sorted.get(i - 1);
            if (diff == 1) diffOne++;
            if (diff == 2) diffTwo++;
        }

        if ((double) diffOne / total >= DETECTION_THRESHOLD) {
            return CONSECUTIVE;
        }
        if ((double) diffTwo / total >= DETECTION_THRESHOLD) {
            return ODD_EVEN;
        }
        return CONSECUTIVE;
    }

    /**
     * 공연장 전체 번호 체계 판별 (열 단위 판별 결과의 다수결, 동률이면 연번)
     * 좌석이 2개 미만인 열은 투표에서 제외한다.
     */
    public static NumberingScheme detectVenue(Collection<? extends Collection<Integer>> rows) {
        int consecutive = 0;
        int oddEven = 0;
        for (Collection<Integer> row : rows) {
            if (row.size() < 2) {
                continue;
            }
            if (detectRow(row) == ODD_EVEN) {
                oddEven++;
            } else {
                consecutive++;
            }
        }
        return oddEven > consecutive ? ODD_EVEN : CONSECUTIVE;
    }
}
