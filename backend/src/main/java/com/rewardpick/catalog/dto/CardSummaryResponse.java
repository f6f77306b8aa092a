package com.rewardpick.catalog.dto;

import java.time.LocalDate;
import java.util.List;

public record CardSummaryResponse(
    String name,
    String issuer,
    List<String> categories,
    boolean activationRequired,
    LocalDate validUntil
) {
}
