package com.rewardpick.recommendation.dto;

import java.time.LocalDate;

public record ExpiredCard(String cardName, LocalDate validUntil) {
}
