package kr.hhplus.be.reconciliation.infrastructure.persistence.rollback.jpa.entity;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "failed_rollback",
        indexes = {
                @Index(name = "idx_failed_rollback_unresolved", columnList = "resolved_at, created_at")
        }
)
public class FailedRollbackJpaEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "operation_id", nullable = false, length = 100)
    private String operationId;

    @Column(name = "pack_id", length = 100)
    private String packId;

    @Column(name = "action_type", nullable = false, length = 50)
    private String actionType;

    @Column(name = "action_data", length = 2000)
    private String actionData;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "resolved_by", length = 100)
    private String resolvedBy;

    @Column(name = "resolution_notes", length = 2000)
    private String resolutionNotes;

    protected FailedRollbackJpaEntity() {}

    public FailedRollbackJpaEntity(String operationId, String packId, String actionType,
                                   String actionData, String errorMessage, LocalDateTime createdAt) {
        this.operationId = operationId;
        this.packId = packId;
        this.actionType = actionType;
        this.actionData = actionData;
        this.errorMessage = errorMessage;
        this.createdAt = createdAt == null ? LocalDateTime.now() : createdAt;
    }

    public void resolve(LocalDateTime resolvedAt, String resolvedBy, String resolutionNotes) {
        this.resolvedAt = resolvedAt;
        this.resolvedBy = resolvedBy;
        this.resolutionNotes = resolutionNotes;
    }

    // Getters
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
