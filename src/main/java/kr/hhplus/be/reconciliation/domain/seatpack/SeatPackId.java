package kr.hhplus.be.reconciliation.domain.seatpack;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;

/**
 * 결정적(deterministic) 팩 식별자
 * - 같은 좌석 구성이면 언제 생성해도 같은 ID
 * - 형식: {prefix}_pk_{md5 앞 16자리}
 */
public record SeatPackId(String value) {

    private static final String UNKNOWN_LEVEL = "unknown";
    private static final int HASH_LENGTH = 16;

    public SeatPackId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("팩 ID는 필수입니다");
        }
    }

    public static SeatPackId of(String value) {
        return new SeatPackId(value);
    }

    /**
     * (source, performance, level, zone, row, 정렬된 좌석 ID 목록) 해시로 ID 생성
     */
    public static SeatPackId generate(String prefix, String source, String performanceId,
                                      String levelId, String zoneId, String rowLabel,
                                      Collection<String> seatIds) {
        List<String> sortedSeatIds = new ArrayList<>(seatIds);
        sortedSeatIds.sort(String::compareTo);

        String canonical = String.join("|",
                nullToEmpty(source),
                nullToEmpty(performanceId),
                levelId == null || levelId.isBlank() ? UNKNOWN_LEVEL : levelId,
                nullToEmpty(zoneId),
                nullToEmpty(rowLabel),
                String.join(",", sortedSeatIds));

        return new SeatPackId(prefix + "_pk_" + md5Hex(canonical).substring(0, HASH_LENGTH));
    }

    private static String md5Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 알고리즘을 사용할 수 없습니다", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @Override
    public String toString() {
        return value;
    }
}
