package com.rewardpick.refresh.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rewardpick.catalog.service.CatalogParser;
import com.rewardpick.catalog.service.CatalogStorageProperties;
import com.rewardpick.catalog.service.CatalogVersionStore;
import com.rewardpick.catalog.service.CategoryCatalog;
import com.rewardpick.catalog.service.MalformedCatalogException;
import com.rewardpick.catalog.service.RemoteCatalogClient;
import com.rewardpick.catalog.service.RemoteFetchException;
import com.rewardpick.index.service.IndexBuildException;
import com.rewardpick.index.service.KnowledgeIndex;
import com.rewardpick.index.service.KnowledgeIndexProperties;
import com.rewardpick.recommendation.dto.RankedCard;
import com.rewardpick.recommendation.dto.RecommendationResult;
import com.rewardpick.recommendation.service.AnswerGenerator;
import com.rewardpick.recommendation.service.CategoryInference;
import com.rewardpick.recommendation.service.RecommendationEngine;
import com.rewardpick.recommendation.service.RecommendationProperties;
import com.rewardpick.refresh.dto.RefreshReport;
import com.rewardpick.refresh.dto.SystemStatusResponse;
import com.rewardpick.refresh.repository.RefreshStatusRepository;
import com.rewardpick.support.KeywordEmbeddingModel;
import com.rewardpick.support.TestCatalogs;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RefreshOrchestratorTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-10-19T03:15:00Z"), ZoneId.of("Asia/Taipei"));

    @TempDir
    Path tempDir;

    @Mock
    private RemoteCatalogClient remoteCatalogClient;

    @Mock
    private RefreshStatusWriter refreshStatusWriter;

    @Mock
    private RefreshStatusRepository refreshStatusRepository;

    @Mock
    private AnswerGenerator answerGenerator;

    private CatalogVersionStore versionStore;
    private RecommendationEngine recommendationEngine;
    private RefreshOrchestrator refreshOrchestrator;
    private ExecutorService executor;
    private volatile boolean embeddingUnavailable;

    @BeforeEach
    void setUp() {
        CatalogStorageProperties storageProperties = new CatalogStorageProperties();
        storageProperties.setDataDir(tempDir.resolve("data").toString());
        storageProperties.setBackupDir(tempDir.resolve("backups").toString());
        storageProperties.setMaxBackups(3);
        versionStore = new CatalogVersionStore(storageProperties, FIXED_CLOCK);

        KnowledgeIndexProperties indexProperties = new KnowledgeIndexProperties();
        indexProperties.setDirectory(tempDir.resolve("index").toString());
        KeywordEmbeddingModel embeddingModel = new KeywordEmbeddingModel() {
            @Override
            public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
                if (embeddingUnavailable) {
                    throw new IllegalStateException("embedding service unavailable");
                }
                return super.embedAll(textSegments);
            }
        };
        KnowledgeIndex knowledgeIndex = new KnowledgeIndex(embeddingModel, indexProperties, FIXED_CLOCK);

        CategoryCatalog categoryCatalog = new CategoryCatalog();
        CatalogParser catalogParser = new CatalogParser(categoryCatalog);
        recommendationEngine = new RecommendationEngine(
            knowledgeIndex,
            new CategoryInference(categoryCatalog),
            answerGenerator,
            new RecommendationProperties(),
            FIXED_CLOCK
        );

        refreshOrchestrator = new RefreshOrchestrator(
            versionStore,
            catalogParser,
            remoteCatalogClient,
            knowledgeIndex,
            recommendationEngine,
            refreshStatusWriter,
            refreshStatusRepository,
            FIXED_CLOCK
        );

        versionStore.promote(TestCatalogs.BASIC);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void refresh_should_index_current_version_and_report_expired_cards() {
        String currentId = versionStore.currentVersionId().orElseThrow();

        RefreshReport report = refreshOrchestrator.refresh("admin-api", false);

        assertThat(report.status()).isEqualTo("SUCCESS");
        assertThat(report.versionId()).isEqualTo(currentId);
        assertThat(report.documentCount()).isEqualTo(6);
        assertThat(report.expiredCardsCount()).isEqualTo(1);
        assertThat(report.expiredCards()).containsExactly("ExpiredCard");
        assertThat(report.fetched()).isFalse();
        assertThat(report.fetchWarning()).isNull();
        assertThat(recommendationEngine.activeHandle()).hasValueSatisfying(handle ->
            assertThat(handle.versionId()).isEqualTo(currentId));
        verify(refreshStatusWriter).markSuccess(eq("admin-api"), anyString(), eq(currentId), eq(6), eq(1), anyLong(), any());
        verify(remoteCatalogClient, never()).fetchLatestFile();
    }

    @Test
    void refresh_should_promote_fetched_catalog_and_serve_it() {
        refreshOrchestrator.refresh("startup", false);
        when(remoteCatalogClient.isEnabled()).thenReturn(true);
        when(remoteCatalogClient.fetchLatestFile()).thenReturn(TestCatalogs.UPDATED);
        when(answerGenerator.generate(anyString(), anyList())).thenReturn("answer");

        RefreshReport report = refreshOrchestrator.refresh("scheduled", true);

        assertThat(report.fetched()).isTrue();
        assertThat(report.versionId()).isEqualTo(versionStore.currentVersionId().orElseThrow());
        assertThat(report.documentCount()).isEqualTo(2);
        assertThat(report.backupCount()).isEqualTo(1);

        RecommendationResult result = recommendationEngine.recommend("booking a flight", List.of("CardD"));
        assertThat(result.catalogVersionId()).isEqualTo(report.versionId());
        assertThat(result.recommendations()).extracting(RankedCard::cardName).containsExactly("CardD");
    }

    @Test
    void refresh_should_keep_serving_previous_version_when_fetched_catalog_is_malformed() {
        RefreshReport initial = refreshOrchestrator.refresh("startup", false);
        when(remoteCatalogClient.isEnabled()).thenReturn(true);
        when(remoteCatalogClient.fetchLatestFile()).thenReturn(TestCatalogs.MALFORMED);

        assertThatThrownBy(() -> refreshOrchestrator.refresh("scheduled", true))
            .isInstanceOf(MalformedCatalogException.class)
            .hasMessageContaining("row 3");

        assertThat(versionStore.currentVersionId()).contains(initial.versionId());
        assertThat(versionStore.backupCount()).isZero();
        assertThat(recommendationEngine.activeHandle()).hasValueSatisfying(handle ->
            assertThat(handle.versionId()).isEqualTo(initial.versionId()));
        assertThat(refreshOrchestrator.isRefreshInProgress()).isFalse();
        verify(refreshStatusWriter).markFailure(eq("scheduled"), contains("row 3"), anyLong(), any());
    }

    @Test
    void refresh_should_not_promote_fetched_catalog_when_index_build_fails() throws Exception {
        RefreshReport initial = refreshOrchestrator.refresh("startup", false);
        when(remoteCatalogClient.isEnabled()).thenReturn(true);
        when(remoteCatalogClient.fetchLatestFile()).thenReturn(TestCatalogs.UPDATED);
        embeddingUnavailable = true;

        assertThatThrownBy(() -> refreshOrchestrator.refresh("scheduled", true))
            .isInstanceOf(IndexBuildException.class)
            .hasMessageContaining("embedding service unavailable");

        assertThat(versionStore.currentVersionId()).contains(initial.versionId());
        assertThat(versionStore.backupCount()).isZero();
        assertThat(recommendationEngine.activeHandle()).hasValueSatisfying(handle ->
            assertThat(handle.versionId()).isEqualTo(initial.versionId()));
        assertThat(refreshOrchestrator.isRefreshInProgress()).isFalse();
        try (Stream<Path> files = Files.list(tempDir.resolve("data"))) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly(initial.versionId());
        }
        verify(refreshStatusWriter).markFailure(eq("scheduled"), contains("embedding service unavailable"), anyLong(), any());
    }

    @Test
    void refresh_should_keep_previous_index_when_rebuild_of_current_version_fails() {
        RefreshReport initial = refreshOrchestrator.refresh("startup", false);
        String activeHandleId = recommendationEngine.activeHandle().orElseThrow().handleId();
        embeddingUnavailable = true;

        assertThatThrownBy(() -> refreshOrchestrator.refresh("admin-api", false))
            .isInstanceOf(IndexBuildException.class);

        assertThat(versionStore.currentVersionId()).contains(initial.versionId());
        assertThat(recommendationEngine.activeHandle()).hasValueSatisfying(handle ->
            assertThat(handle.handleId()).isEqualTo(activeHandleId));
        verify(refreshStatusWriter).markFailure(eq("admin-api"), contains("embedding service unavailable"), anyLong(), any());

        embeddingUnavailable = false;
        RefreshReport recovered = refreshOrchestrator.refresh("admin-api", false);
        assertThat(recovered.status()).isEqualTo("SUCCESS");
    }

    @Test
    void refresh_should_continue_from_current_version_when_fetch_fails() {
        when(remoteCatalogClient.isEnabled()).thenReturn(true);
        when(remoteCatalogClient.fetchLatestFile()).thenThrow(new RemoteFetchException("remote catalog returned HTTP 500"));

        RefreshReport report = refreshOrchestrator.refresh("scheduled", true);

        assertThat(report.status()).isEqualTo("SUCCESS");
        assertThat(report.fetched()).isFalse();
        assertThat(report.fetchWarning()).isEqualTo("remote catalog returned HTTP 500");
        assertThat(report.versionId()).isEqualTo(versionStore.currentVersionId().orElseThrow());
    }

    @Test
    void refresh_should_warn_when_remote_source_is_not_configured() {
        when(remoteCatalogClient.isEnabled()).thenReturn(false);

        RefreshReport report = refreshOrchestrator.refresh("admin-api", true);

        assertThat(report.fetchWarning()).isEqualTo("remote catalog source is not configured");
        verify(remoteCatalogClient, never()).fetchLatestFile();
    }

    @Test
    void refresh_should_reject_overlapping_runs_while_queries_see_previous_version() throws Exception {
        RefreshReport initial = refreshOrchestrator.refresh("startup", false);
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch releaseFetch = new CountDownLatch(1);
        when(remoteCatalogClient.isEnabled()).thenReturn(true);
        when(remoteCatalogClient.fetchLatestFile()).thenAnswer(invocation -> {
            fetchStarted.countDown();
            releaseFetch.await(10, TimeUnit.SECONDS);
            return TestCatalogs.UPDATED;
        });
        when(answerGenerator.generate(anyString(), anyList())).thenReturn("answer");

        Future<RefreshReport> running = executor.submit(() -> refreshOrchestrator.refresh("scheduled", true));
        assertThat(fetchStarted.await(10, TimeUnit.SECONDS)).isTrue();

        assertThat(refreshOrchestrator.isRefreshInProgress()).isTrue();
        assertThatThrownBy(() -> refreshOrchestrator.refresh("admin-api", true))
            .isInstanceOf(RefreshInProgressException.class);
        assertThat(recommendationEngine.recommend("need gas", List.of("CardA")).catalogVersionId())
            .isEqualTo(initial.versionId());

        releaseFetch.countDown();
        RefreshReport updated = running.get(10, TimeUnit.SECONDS);

        assertThat(updated.versionId()).isNotEqualTo(initial.versionId());
        assertThat(recommendationEngine.recommend("need gas", List.of("CardA")).catalogVersionId())
            .isEqualTo(updated.versionId());
        assertThat(refreshOrchestrator.isRefreshInProgress()).isFalse();
    }

    @Test
    void status_should_describe_active_index() {
        when(refreshStatusRepository.findFirstByLastRunAtIsNotNullOrderByLastRunAtDesc()).thenReturn(Optional.empty());

        SystemStatusResponse before = refreshOrchestrator.status();
        RefreshReport report = refreshOrchestrator.refresh("startup", false);
        SystemStatusResponse after = refreshOrchestrator.status();

        assertThat(before.healthy()).isFalse();
        assertThat(before.documentCount()).isZero();
        assertThat(after.healthy()).isTrue();
        assertThat(after.documentCount()).isEqualTo(6);
        assertThat(after.expiredCardsCount()).isEqualTo(1);
        assertThat(after.currentVersionId()).isEqualTo(report.versionId());
        assertThat(after.refreshInProgress()).isFalse();
        assertThat(after.lastRefresh()).isNull();
    }
}
