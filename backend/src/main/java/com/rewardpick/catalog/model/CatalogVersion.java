package com.rewardpick.catalog.model;

import java.time.OffsetDateTime;

/**
 * A catalog file known to the version store. {@code id} is the file name, which embeds the
 * creation timestamp for promoted versions.
 */
public record CatalogVersion(
    String id,
    OffsetDateTime createdAt,
    byte[] content,
    Source source
) {

    public enum Source {
        PROMOTED,
        BUNDLED
    }

    public int sizeBytes() {
        return content == null ? 0 : content.length;
    }
}
