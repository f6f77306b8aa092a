package com.rewardpick.refresh.dto;

import java.time.OffsetDateTime;

public record SystemStatusResponse(
    boolean healthy,
    int documentCount,
    int expiredCardsCount,
    String currentVersionId,
    int backupCount,
    boolean refreshInProgress,
    RefreshStatusResponse lastRefresh,
    OffsetDateTime generatedAt
) {
}
