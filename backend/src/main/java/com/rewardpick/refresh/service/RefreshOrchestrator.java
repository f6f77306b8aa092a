package com.rewardpick.refresh.service;

import com.rewardpick.catalog.model.CardRecord;
import com.rewardpick.catalog.model.CatalogVersion;
import com.rewardpick.catalog.service.CatalogParser;
import com.rewardpick.catalog.service.CatalogVersionStore;
import com.rewardpick.catalog.service.RemoteCatalogClient;
import com.rewardpick.catalog.service.RemoteFetchException;
import com.rewardpick.index.service.IndexHandle;
import com.rewardpick.index.service.KnowledgeIndex;
import com.rewardpick.recommendation.service.RecommendationEngine;
import com.rewardpick.refresh.dto.RefreshReport;
import com.rewardpick.refresh.dto.RefreshStatusResponse;
import com.rewardpick.refresh.dto.SystemStatusResponse;
import com.rewardpick.refresh.entity.RefreshStatusEntity;
import com.rewardpick.refresh.repository.RefreshStatusRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Rebuilds the knowledge index from the current catalog, optionally after pulling a new catalog
 * from the remote source, and swaps it in. Only one refresh runs at a time; a failed refresh
 * leaves the previously active index serving queries.
 */
@Service
public class RefreshOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RefreshOrchestrator.class);

    private final CatalogVersionStore versionStore;
    private final CatalogParser catalogParser;
    private final RemoteCatalogClient remoteCatalogClient;
    private final KnowledgeIndex knowledgeIndex;
    private final RecommendationEngine recommendationEngine;
    private final RefreshStatusWriter refreshStatusWriter;
    private final RefreshStatusRepository refreshStatusRepository;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RefreshOrchestrator(
        CatalogVersionStore versionStore,
        CatalogParser catalogParser,
        RemoteCatalogClient remoteCatalogClient,
        KnowledgeIndex knowledgeIndex,
        RecommendationEngine recommendationEngine,
        RefreshStatusWriter refreshStatusWriter,
        RefreshStatusRepository refreshStatusRepository,
        Clock clock
    ) {
        this.versionStore = versionStore;
        this.catalogParser = catalogParser;
        this.remoteCatalogClient = remoteCatalogClient;
        this.knowledgeIndex = knowledgeIndex;
        this.recommendationEngine = recommendationEngine;
        this.refreshStatusWriter = refreshStatusWriter;
        this.refreshStatusRepository = refreshStatusRepository;
        this.clock = clock;
    }

    /**
     * @throws RefreshInProgressException when another refresh has not finished yet
     */
    public RefreshReport refresh(String trigger, boolean fetchRemote) {
        if (!running.compareAndSet(false, true)) {
            throw new RefreshInProgressException(trigger);
        }

        long startedAt = System.nanoTime();
        OffsetDateTime runAt = OffsetDateTime.now(clock);
        try {
            byte[] fetchedContent = null;
            String fetchWarning = null;
            if (fetchRemote) {
                if (!remoteCatalogClient.isEnabled()) {
                    fetchWarning = "remote catalog source is not configured";
                } else {
                    try {
                        fetchedContent = remoteCatalogClient.fetchLatestFile();
                    } catch (RemoteFetchException exception) {
                        fetchWarning = exception.getReason();
                        log.warn("Remote catalog fetch failed, refreshing from current version (trigger={}): {}", trigger, fetchWarning);
                    }
                }
            }

            String versionId;
            List<CardRecord> cards;
            IndexHandle handle;
            if (fetchedContent != null) {
                // a download becomes current only once it has parsed and indexed
                cards = catalogParser.parse(fetchedContent);
                CatalogVersionStore.StagedVersion staged = versionStore.stage(fetchedContent);
                try {
                    handle = knowledgeIndex.build(catalogParser.toDocuments(cards), staged.id());
                } catch (RuntimeException exception) {
                    versionStore.discard(staged);
                    throw exception;
                }
                try {
                    versionId = versionStore.promote(staged).id();
                } catch (RuntimeException exception) {
                    knowledgeIndex.dispose(handle);
                    throw exception;
                }
            } else {
                CatalogVersion version = versionStore.getCurrent();
                cards = catalogParser.parse(version.content());
                versionId = version.id();
                handle = knowledgeIndex.build(catalogParser.toDocuments(cards), versionId);
            }

            IndexHandle previous = recommendationEngine.activate(handle);
            if (previous != null && previous != handle) {
                knowledgeIndex.dispose(previous);
            }

            LocalDate today = LocalDate.now(clock);
            List<String> expiredCards = cards.stream()
                .filter(card -> card.isExpired(today))
                .map(CardRecord::name)
                .toList();
            long durationMs = elapsedMs(startedAt);

            RefreshReport report = new RefreshReport(
                "SUCCESS",
                trigger,
                versionId,
                knowledgeIndex.documentCount(handle),
                expiredCards.size(),
                expiredCards,
                versionStore.backupCount(),
                fetchedContent != null,
                fetchWarning,
                durationMs,
                OffsetDateTime.now(clock)
            );

            recordSuccess(report, runAt);
            log.info(
                "Catalog refresh completed (trigger={}, version={}, documents={}, expired={}, backups={}, fetched={}, tookMs={})",
                trigger,
                report.versionId(),
                report.documentCount(),
                report.expiredCardsCount(),
                report.backupCount(),
                report.fetched(),
                durationMs
            );
            return report;
        } catch (RuntimeException exception) {
            long durationMs = elapsedMs(startedAt);
            recordFailure(trigger, rootMessage(exception), durationMs, runAt);
            log.warn("Catalog refresh failed (trigger={}, tookMs={}): {}", trigger, durationMs, exception.getMessage());
            throw exception;
        } finally {
            running.set(false);
        }
    }

    public boolean isRefreshInProgress() {
        return running.get();
    }

    @Transactional(readOnly = true)
    public SystemStatusResponse status() {
        IndexHandle handle = recommendationEngine.activeHandle().orElse(null);
        RefreshStatusResponse lastRefresh = refreshStatusRepository.findFirstByLastRunAtIsNotNullOrderByLastRunAtDesc()
            .map(this::toStatusResponse)
            .orElse(null);

        return new SystemStatusResponse(
            handle != null,
            handle == null ? 0 : knowledgeIndex.documentCount(handle),
            recommendationEngine.expiredCardNames().size(),
            handle == null ? null : handle.versionId(),
            versionStore.backupCount(),
            running.get(),
            lastRefresh,
            OffsetDateTime.now(clock)
        );
    }

    private void recordSuccess(RefreshReport report, OffsetDateTime runAt) {
        try {
            refreshStatusWriter.markSuccess(
                report.trigger(),
                report.fetchWarning() == null ? "Catalog refresh completed" : "Completed without remote fetch: " + report.fetchWarning(),
                report.versionId(),
                report.documentCount(),
                report.expiredCardsCount(),
                report.durationMs(),
                runAt
            );
        } catch (RuntimeException exception) {
            log.warn("Failed to record refresh status (trigger={}): {}", report.trigger(), exception.getMessage());
        }
    }

    private void recordFailure(String trigger, String message, long durationMs, OffsetDateTime runAt) {
        try {
            refreshStatusWriter.markFailure(trigger, message, durationMs, runAt);
        } catch (RuntimeException exception) {
            log.warn("Failed to record refresh failure (trigger={}): {}", trigger, exception.getMessage());
        }
    }

    private RefreshStatusResponse toStatusResponse(RefreshStatusEntity status) {
        return new RefreshStatusResponse(
            status.getTriggerSource(),
            status.getLastResult(),
            status.getLastRunAt(),
            status.getLastSuccessAt(),
            status.getLastFailureAt(),
            status.getLastMessage(),
            status.getLastVersionId(),
            status.getLastDocumentCount(),
            status.getLastExpiredCount(),
            status.getLastDurationMs(),
            status.getConsecutiveFailureCount()
        );
    }

    private long elapsedMs(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }

    private String rootMessage(Throwable throwable) {
        String message = throwable.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }

        Throwable cursor = throwable;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        message = cursor.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getSimpleName() : message;
    }
}
