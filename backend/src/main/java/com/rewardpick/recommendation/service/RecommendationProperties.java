package com.rewardpick.recommendation.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "recommendation")
public class RecommendationProperties {

    /**
     * Minimum number of documents retrieved per query; raised to twice the held cards plus one
     */
    private int candidatePoolSize = 10;

    /**
     * Number of ranked cards returned
     */
    private int topN = 3;
}
