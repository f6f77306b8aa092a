package com.rewardpick.catalog.dto;

import java.time.LocalDate;
import java.util.Map;

public record CardDetailResponse(
    String name,
    String issuer,
    Map<String, Double> rewards,
    boolean activationRequired,
    LocalDate validUntil,
    String conditions,
    String annualFee,
    String description,
    String catalogVersionId
) {
}
