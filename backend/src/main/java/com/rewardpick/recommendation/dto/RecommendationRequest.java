package com.rewardpick.recommendation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RecommendationRequest(
    @NotBlank @Size(max = 100)
    String userId,

    @NotBlank @Size(max = 500)
    String query
) {
}
