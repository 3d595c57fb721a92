package kr.hhplus.be.reconciliation.application.port.out;

import java.util.List;

/**
 * 동기화 진행 알림 내용
 */
public record SyncNotification(
        Type type,
        String operationId,
        String performanceId,
        String venueName,
        String eventTitle,
        int totalPacks,
        int synced,
        int failed,
        int skipped,
        double executionSeconds,
        List<String> errors
) {

    public enum Type {
        STARTED,
        COMPLETED,
        FAILED
    }

    public SyncNotification {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static SyncNotification started(String operationId, String performanceId,
                                           String venueName, String eventTitle, int totalPacks) {
        return new SyncNotification(Type.STARTED, operationId, performanceId, venueName, eventTitle,
                totalPacks, 0, 0, 0, 0.0, List.of());
    }
}
