package kr.hhplus.be.reconciliation.infrastructure.kafka.message;

import kr.hhplus.be.reconciliation.application.port.out.SyncNotification;

import java.time.LocalDateTime;
import java.util.List;

public record SyncNotificationMessage(
        String pattern,        // "pos.sync.success" | "pos.sync.error"
        String syncType,       // "started" | "ended" | "failed"
        String operationId,
        String performanceId,
        String venueName,
        String eventTitle,
        int totalPacks,
        int synced,
        int failed,
        int skipped,
        double executionSeconds,
        List<String> errors,
        LocalDateTime timestamp
) {
    public static final String SUCCESS_PATTERN = "pos.sync.success";
    public static final String ERROR_PATTERN = "pos.sync.error";

    public static SyncNotificationMessage from(SyncNotification notification, LocalDateTime now) {
        String pattern = notification.type() == SyncNotification.Type.FAILED ? ERROR_PATTERN : SUCCESS_PATTERN;
        String syncType = switch (notification.type()) {
            case STARTED -> "started";
            case COMPLETED -> "ended";
            case FAILED -> "failed";
        };
        return new SyncNotificationMessage(
                pattern,
                syncType,
                notification.operationId(),
                notification.performanceId(),
                notification.venueName(),
                notification.eventTitle(),
                notification.totalPacks(),
                notification.synced(),
                notification.failed(),
                notification.skipped(),
                notification.executionSeconds(),
                notification.errors(),
                now
        );
    }
}
