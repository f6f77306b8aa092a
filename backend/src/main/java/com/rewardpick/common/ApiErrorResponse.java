package com.rewardpick.common;

import java.time.Instant;

/**
 * Error body for every failed request. {@code code} is stable across wording changes, e.g.
 * {@code INDEX_NOT_READY} or {@code REFRESH_IN_PROGRESS}, so clients can branch on it.
 */
public record ApiErrorResponse(
    Instant timestamp,
    int status,
    String error,
    String code,
    String message,
    String path
) {
}
