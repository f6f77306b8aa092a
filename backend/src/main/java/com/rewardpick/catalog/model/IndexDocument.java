package com.rewardpick.catalog.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Searchable form of a {@link CardRecord}. The {@code text} is embedded and is also the only
 * grounding handed to answer generation.
 */
public record IndexDocument(
    String id,
    String text,
    Metadata metadata,
    CardRecord card
) {

    public record Metadata(
        List<String> categories,
        boolean activationRequired,
        LocalDate validUntil
    ) {

        public Metadata {
            categories = List.copyOf(categories);
        }
    }
}
