package com.rewardpick.refresh.dto;

import java.time.OffsetDateTime;

public record RefreshStatusResponse(
    String trigger,
    String lastResult,
    OffsetDateTime lastRunAt,
    OffsetDateTime lastSuccessAt,
    OffsetDateTime lastFailureAt,
    String lastMessage,
    String lastVersionId,
    Integer lastDocumentCount,
    Integer lastExpiredCount,
    Long lastDurationMs,
    int consecutiveFailureCount
) {
}
