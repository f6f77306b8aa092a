package com.rewardpick.refresh.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record RefreshReport(
    String status,
    String trigger,
    String versionId,
    int documentCount,
    int expiredCardsCount,
    List<String> expiredCards,
    int backupCount,
    boolean fetched,
    String fetchWarning,
    long durationMs,
    OffsetDateTime completedAt
) {

    public RefreshReport {
        expiredCards = List.copyOf(expiredCards);
    }
}
