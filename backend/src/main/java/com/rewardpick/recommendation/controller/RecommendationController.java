package com.rewardpick.recommendation.controller;

import com.rewardpick.recommendation.dto.RecommendationRequest;
import com.rewardpick.recommendation.dto.RecommendationResult;
import com.rewardpick.recommendation.dto.SimulateRecommendationRequest;
import com.rewardpick.recommendation.service.RecommendationEngine;
import com.rewardpick.wallet.service.HeldCardService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/recommendations")
public class RecommendationController {

    private final RecommendationEngine recommendationEngine;
    private final HeldCardService heldCardService;

    public RecommendationController(RecommendationEngine recommendationEngine, HeldCardService heldCardService) {
        this.recommendationEngine = recommendationEngine;
        this.heldCardService = heldCardService;
    }

    @PostMapping
    public RecommendationResult recommend(@Valid @RequestBody RecommendationRequest request) {
        return recommendationEngine.recommend(request.query(), heldCardService.getHeldCards(request.userId()));
    }

    @PostMapping("/simulate")
    public RecommendationResult simulate(@Valid @RequestBody SimulateRecommendationRequest request) {
        return recommendationEngine.recommend(request.query(), request.heldCards());
    }
}
