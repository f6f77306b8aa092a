package com.rewardpick.catalog.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One credit card of the catalog with its reward rate per spending category.
 *
 * <p>Rates are percentages ({@code 3.0} means 3%). Categories are canonical lower-case names
 * produced by {@code CategoryCatalog#canonicalize}.
 */
public record CardRecord(
    String name,
    String issuer,
    Map<String, Double> rewards,
    boolean activationRequired,
    LocalDate validUntil,
    String conditions,
    String annualFeeText
) {

    public CardRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("card name is required");
        }
        if (rewards == null || rewards.isEmpty()) {
            throw new IllegalArgumentException("card '" + name + "' has no reward categories");
        }
        for (Map.Entry<String, Double> reward : rewards.entrySet()) {
            if (reward.getValue() == null || reward.getValue() < 0) {
                throw new IllegalArgumentException(
                    "card '" + name + "' has a negative reward rate for " + reward.getKey()
                );
            }
        }
        name = name.trim();
        issuer = issuer == null ? "" : issuer.trim();
        rewards = Collections.unmodifiableMap(new LinkedHashMap<>(rewards));
        conditions = conditions == null ? "" : conditions.trim();
        annualFeeText = annualFeeText == null ? "" : annualFeeText.trim();
    }

    public Optional<Double> rateFor(String category) {
        return Optional.ofNullable(rewards.get(category));
    }

    /**
     * Highest rate over every category; ties go to the alphabetically first category.
     */
    public Map.Entry<String, Double> bestReward() {
        return rewards.entrySet().stream()
            .min(Comparator.<Map.Entry<String, Double>>comparingDouble(Map.Entry::getValue)
                .reversed()
                .thenComparing(Map.Entry::getKey))
            .orElseThrow();
    }

    public List<String> categories() {
        return List.copyOf(rewards.keySet());
    }

    public boolean isExpired(LocalDate today) {
        return validUntil != null && validUntil.isBefore(today);
    }
}
