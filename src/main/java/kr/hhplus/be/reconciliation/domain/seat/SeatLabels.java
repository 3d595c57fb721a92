package kr.hhplus.be.reconciliation.domain.seat;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 좌석 라벨 유틸리티
 * - 숫자 인식 자연 정렬 ("2" &lt; "10", "A2" &lt; "A10")
 * - 인접성 판단에 쓰이는 숫자 추출 (마지막 숫자 구간)
 */
public final class SeatLabels {

    private static final Pattern CHUNK = Pattern.compile("\\d+|\\D+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final Comparator<String> NATURAL_ORDER = SeatLabels::compareNatural;

    private SeatLabels() {
    }

    public static Comparator<String> naturalOrder() {
        return NATURAL_ORDER;
    }

    /**
     * 라벨의 마지막 숫자 구간을 좌석 번호로 사용한다.
     * 숫자가 없으면 비어 있는 값을 반환하며, 이런 좌석은 어떤 좌석과도 인접하지 않는다.
     */
    public static OptionalInt numericValue(String label) {
        if (label == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = DIGITS.matcher(label);
        String last = null;
        while (matcher.find()) {
            last = matcher.group();
        }
        if (last == null) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(last));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    private static int compareNatural(String a, String b) {
        List<String> left = chunks(a);
        List<String> right = chunks(b);
        int size = Math.min(left.size(), right.size());
        for (int i = 0; i < size; i++) {
            String l = left.get(i);
            String r = right.get(i);
            boolean lNum = !l.isEmpty() && Character.isDigit(l.charAt(0));
            boolean rNum = !r.isEmpty() && Character.isDigit(r.charAt(0));
            int cmp;
            if (lNum && rNum) {
                cmp = new BigInteger(l).compareTo(new BigInteger(r));
            } else if (lNum != rNum) {
                // 숫자 구간이 문자 구간보다 앞선다
                cmp = lNum ? -1 : 1;
            } else {
                cmp = l.compareToIgnoreCase(r);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        int bySize = Integer.compare(left.size(), right.size());
        return bySize != 0 ? bySize : a.compareTo(b);
    }

    private static List<String> chunks(String label) {
        List<String> result = new ArrayList<>();
        Matcher matcher = CHUNK.matcher(label == null ? "" : label);
        while (matcher.find()) {
            result.add(matcher.group());
        }
        if (result.isEmpty()) {
            result.add("");
        }
        return result;
    }
}
