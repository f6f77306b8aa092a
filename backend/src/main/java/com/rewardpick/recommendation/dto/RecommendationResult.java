package com.rewardpick.recommendation.dto;

import java.util.List;

public record RecommendationResult(
    List<RankedCard> recommendations,
    List<ExpiredCard> expiredCards,
    List<String> unknownCards,
    String inferredCategory,
    List<String> notes,
    String summary,
    boolean summaryGenerated,
    String catalogVersionId
) {

    public RecommendationResult {
        recommendations = List.copyOf(recommendations);
        expiredCards = List.copyOf(expiredCards);
        unknownCards = List.copyOf(unknownCards);
        notes = List.copyOf(notes);
    }
}
