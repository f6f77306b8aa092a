package com.rewardpick.config;

import com.rewardpick.catalog.service.CatalogNotFoundException;
import com.rewardpick.catalog.service.CatalogVersionStore;
import com.rewardpick.index.service.IndexHandle;
import com.rewardpick.recommendation.service.RecommendationEngine;
import java.util.Optional;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN until a knowledge index is active, so that a missing or unreadable catalog
 * shows up on {@code /actuator/health}.
 */
@Component
public class KnowledgeIndexHealthIndicator implements HealthIndicator {

    private final RecommendationEngine recommendationEngine;
    private final CatalogVersionStore catalogVersionStore;

    public KnowledgeIndexHealthIndicator(RecommendationEngine recommendationEngine, CatalogVersionStore catalogVersionStore) {
        this.recommendationEngine = recommendationEngine;
        this.catalogVersionStore = catalogVersionStore;
    }

    @Override
    public Health health() {
        Optional<IndexHandle> active = recommendationEngine.activeHandle();
        if (active.isEmpty()) {
            return Health.down()
                .withDetail("initialized", false)
                .withDetail("catalog", catalogAvailability())
                .build();
        }

        IndexHandle handle = active.get();
        return Health.up()
            .withDetail("initialized", true)
            .withDetail("versionId", handle.versionId())
            .withDetail("documents", handle.documents().size())
            .withDetail("builtAt", String.valueOf(handle.builtAt()))
            .withDetail("backups", catalogVersionStore.backupCount())
            .build();
    }

    private String catalogAvailability() {
        try {
            return catalogVersionStore.getCurrent().id();
        } catch (CatalogNotFoundException exception) {
            return "missing";
        }
    }
}
