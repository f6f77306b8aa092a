package com.rewardpick.catalog.controller;

import com.rewardpick.catalog.dto.CardDetailResponse;
import com.rewardpick.catalog.dto.CardSummaryResponse;
import com.rewardpick.catalog.model.CardRecord;
import com.rewardpick.catalog.model.IndexDocument;
import com.rewardpick.index.service.IndexHandle;
import com.rewardpick.recommendation.service.IndexNotReadyException;
import com.rewardpick.recommendation.service.RecommendationEngine;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {

    private final RecommendationEngine recommendationEngine;

    public CatalogController(RecommendationEngine recommendationEngine) {
        this.recommendationEngine = recommendationEngine;
    }

    @GetMapping("/cards")
    public List<CardSummaryResponse> getCards() {
        IndexHandle handle = recommendationEngine.activeHandle().orElseThrow(IndexNotReadyException::new);
        return handle.documents().values().stream()
            .map(IndexDocument::card)
            .map(card -> new CardSummaryResponse(
                card.name(),
                card.issuer(),
                card.categories(),
                card.activationRequired(),
                card.validUntil()
            ))
            .toList();
    }

    @GetMapping("/cards/{name}")
    public CardDetailResponse getCard(@PathVariable String name) {
        IndexDocument document = recommendationEngine.describeCard(name)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Card '" + name + "' is not in the catalog"));
        CardRecord card = document.card();
        String versionId = recommendationEngine.activeHandle().map(IndexHandle::versionId).orElse(null);
        return new CardDetailResponse(
            card.name(),
            card.issuer(),
            card.rewards(),
            card.activationRequired(),
            card.validUntil(),
            card.conditions(),
            card.annualFeeText(),
            document.text(),
            versionId
        );
    }
}
