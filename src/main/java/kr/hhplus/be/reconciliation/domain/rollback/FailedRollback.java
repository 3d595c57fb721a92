package kr.hhplus.be.reconciliation.domain.rollback;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 실패한 보상 작업 기록 (수동 처리 전까지 남는다)
 */
public class FailedRollback implements Serializable {

    private final Long id;
    private final String operationId;
    private final String packId;
    private final String actionType;
    private final String actionData;
    private final String errorMessage;
    private final LocalDateTime createdAt;
    private LocalDateTime resolvedAt;
    private String resolvedBy;
    private String resolutionNotes;

    private FailedRollback(Long id, String operationId, String packId, String actionType, String actionData,
                           String errorMessage, LocalDateTime createdAt, LocalDateTime resolvedAt,
                           String resolvedBy, String resolutionNotes) {
        this.id = id;
        this.operationId = Objects.requireNonNull(operationId, "작업 ID는 필수입니다");
        this.packId = packId;
        this.actionType = Objects.requireNonNull(actionType, "보상 작업 유형은 필수입니다");
        this.actionData = actionData;
        this.errorMessage = errorMessage;
        this.createdAt = createdAt;
        this.resolvedAt = resolvedAt;
        this.resolvedBy = resolvedBy;
        this.resolutionNotes = resolutionNotes;
    }

    public static FailedRollback record(String operationId, String packId, String actionType,
                                        String actionData, String errorMessage, LocalDateTime now) {
        return new FailedRollback(null, operationId, packId, actionType, actionData, errorMessage,
                now, null, null, null);
    }

    public static FailedRollback restore(Long id, String operationId, String packId, String actionType,
                                         String actionData, String errorMessage, LocalDateTime createdAt,
                                         LocalDateTime resolvedAt, String resolvedBy, String resolutionNotes) {
        return new FailedRollback(id, operationId, packId, actionType, actionData, errorMessage,
                createdAt, resolvedAt, resolvedBy, resolutionNotes);
    }

    public void resolve(String operator, String notes, LocalDateTime now) {
        if (isResolved()) {
            throw new IllegalStateException("이미 처리된 롤백 실패 기록입니다: " + id);
        }
        this.resolvedBy = Objects.requireNonNull(operator, "처리자는 필수입니다");
        this.resolutionNotes = notes;
        this.resolvedAt = now;
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    public Long getId() { return id; }
    public String getOperationId() { return operationId; }
    public String getPackId() { return packId; }
    public String getActionType() { return actionType; }
    public String getActionData() { return actionData; }
    public String getErrorMessage() { return errorMessage; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getResolvedAt() { return resolvedAt; }
    public String getResolvedBy() { return resolvedBy; }
    public String getResolutionNotes() { return resolutionNotes; }
}
