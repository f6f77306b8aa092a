package com.rewardpick.catalog.dto;

import java.time.OffsetDateTime;

public record CatalogVersionResponse(
    String versionId,
    OffsetDateTime createdAt,
    long sizeBytes,
    boolean current
) {
}
