package com.rewardpick.recommendation.dto;

import java.time.LocalDate;

/**
 * {@code similarity} is null when the card was added by name instead of by retrieval; it never
 * influences the order.
 */
public record RankedCard(
    String cardName,
    String category,
    double rate,
    boolean activationRequired,
    LocalDate validUntil,
    String conditions,
    Double similarity
) {
}
