package com.rewardpick.index.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "rag.index")
public class KnowledgeIndexProperties {

    /**
     * Directory for the serialized embedding stores, one file per live handle
     */
    private String directory = "./index";

    /**
     * Upper bound for k in a single query
     */
    private int maxQueryResults = 50;
}
