package com.rewardpick.recommendation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

public record SimulateRecommendationRequest(
    @NotBlank @Size(max = 500)
    String query,

    @NotNull @Size(max = 100)
    List<String> heldCards
) {
}
