package com.rewardpick.refresh.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.OffsetDateTime;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Last refresh outcome per trigger source ("startup", "scheduled", "admin-api").
 */
@Getter
@Entity
@Table(name = "refresh_status")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RefreshStatusEntity {

    private static final int MAX_MESSAGE_LENGTH = 1000;

    @Id
    @Column(name = "trigger_source", nullable = false, length = 40)
    private String triggerSource;

    @Column(name = "last_result", nullable = false, length = 20)
    private String lastResult;

    @Column(name = "last_run_at")
    private OffsetDateTime lastRunAt;

    @Column(name = "last_success_at")
    private OffsetDateTime lastSuccessAt;

    @Column(name = "last_failure_at")
    private OffsetDateTime lastFailureAt;

    @Column(name = "last_message", columnDefinition = "text")
    private String lastMessage;

    @Column(name = "last_version_id", length = 120)
    private String lastVersionId;

    @Column(name = "last_document_count")
    private Integer lastDocumentCount;

    @Column(name = "last_expired_count")
    private Integer lastExpiredCount;

    @Column(name = "last_duration_ms")
    private Long lastDurationMs;

    @Column(name = "consecutive_failure_count", nullable = false)
    private int consecutiveFailureCount;

    public RefreshStatusEntity(String triggerSource) {
        this.triggerSource = triggerSource;
        this.lastResult = "NEVER";
        this.consecutiveFailureCount = 0;
    }

    public void markSuccess(
        String message,
        String versionId,
        int documentCount,
        int expiredCount,
        long durationMs,
        OffsetDateTime runAt
    ) {
        this.lastResult = "SUCCESS";
        this.lastRunAt = runAt;
        this.lastSuccessAt = runAt;
        this.lastMessage = trim(message);
        this.lastVersionId = versionId;
        this.lastDocumentCount = documentCount;
        this.lastExpiredCount = expiredCount;
        this.lastDurationMs = durationMs;
        this.consecutiveFailureCount = 0;
    }

    public void markFailure(String message, long durationMs, OffsetDateTime runAt) {
        this.lastResult = "FAILED";
        this.lastRunAt = runAt;
        this.lastFailureAt = runAt;
        this.lastMessage = trim(message);
        this.lastDurationMs = durationMs;
        this.consecutiveFailureCount += 1;
    }

    private String trim(String message) {
        if (message == null) {
            return "";
        }

        String normalized = message.trim();
        if (normalized.length() <= MAX_MESSAGE_LENGTH) {
            return normalized;
        }
        return normalized.substring(0, MAX_MESSAGE_LENGTH);
    }
}
