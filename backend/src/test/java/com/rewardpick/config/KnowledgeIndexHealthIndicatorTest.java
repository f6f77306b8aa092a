package com.rewardpick.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.rewardpick.catalog.model.CatalogVersion;
import com.rewardpick.catalog.service.CatalogNotFoundException;
import com.rewardpick.catalog.service.CatalogParser;
import com.rewardpick.catalog.service.CatalogVersionStore;
import com.rewardpick.catalog.service.CategoryCatalog;
import com.rewardpick.index.service.IndexHandle;
import com.rewardpick.recommendation.service.RecommendationEngine;
import com.rewardpick.support.TestCatalogs;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.time.OffsetDateTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@ExtendWith(MockitoExtension.class)
class KnowledgeIndexHealthIndicatorTest {

    @Mock
    private RecommendationEngine recommendationEngine;

    @Mock
    private CatalogVersionStore catalogVersionStore;

    @InjectMocks
    private KnowledgeIndexHealthIndicator healthIndicator;

    @Test
    void health_should_be_down_until_an_index_is_active() {
        when(recommendationEngine.activeHandle()).thenReturn(Optional.empty());
        when(catalogVersionStore.getCurrent()).thenReturn(
            new CatalogVersion("cards.csv", null, TestCatalogs.BASIC, CatalogVersion.Source.BUNDLED)
        );

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
            .containsEntry("initialized", false)
            .containsEntry("catalog", "cards.csv");
    }

    @Test
    void health_should_report_missing_catalog_when_nothing_can_be_indexed() {
        when(recommendationEngine.activeHandle()).thenReturn(Optional.empty());
        when(catalogVersionStore.getCurrent()).thenThrow(new CatalogNotFoundException("No catalog version available"));

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("catalog", "missing");
    }

    @Test
    void health_should_be_up_with_version_and_document_count_once_indexed() {
        CatalogParser catalogParser = new CatalogParser(new CategoryCatalog());
        IndexHandle handle = new IndexHandle(
            "handle-1",
            "cards_20261019T111500.csv",
            OffsetDateTime.parse("2026-10-19T11:15:00+08:00"),
            new InMemoryEmbeddingStore<>(),
            catalogParser.toDocuments(catalogParser.parse(TestCatalogs.BASIC)),
            null
        );
        when(recommendationEngine.activeHandle()).thenReturn(Optional.of(handle));
        when(catalogVersionStore.backupCount()).thenReturn(2);

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("initialized", true)
            .containsEntry("versionId", "cards_20261019T111500.csv")
            .containsEntry("documents", 6)
            .containsEntry("builtAt", "2026-10-19T11:15+08:00")
            .containsEntry("backups", 2);
    }
}
