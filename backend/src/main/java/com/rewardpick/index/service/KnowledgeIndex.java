package com.rewardpick.index.service;

import com.rewardpick.catalog.model.IndexDocument;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Embeds catalog documents into an in-memory vector store and answers similarity queries
 * against a specific {@link IndexHandle}. Every build produces a fresh handle; existing handles
 * are never touched.
 */
@Service
public class KnowledgeIndex {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeIndex.class);

    static final String CARD_NAME_KEY = "card_name";
    private static final String FILE_PREFIX = "index-";
    private static final String FILE_SUFFIX = ".json";

    private final EmbeddingModel embeddingModel;
    private final KnowledgeIndexProperties properties;
    private final Clock clock;
    private final Path directory;

    public KnowledgeIndex(EmbeddingModel embeddingModel, KnowledgeIndexProperties properties, Clock clock) {
        this.embeddingModel = embeddingModel;
        this.properties = properties;
        this.clock = clock;
        this.directory = Path.of(properties.getDirectory()).toAbsolutePath().normalize();
        removeOrphanedFiles();
    }

    /**
     * @throws IndexBuildException when the documents cannot be embedded, persisted or verified
     */
    public IndexHandle build(List<IndexDocument> documents, String versionId) {
        if (documents == null || documents.isEmpty()) {
            throw new IndexBuildException("Cannot build an index without documents (version=" + versionId + ")");
        }

        long startedAt = System.nanoTime();
        List<TextSegment> segments = documents.stream()
            .map(document -> TextSegment.from(document.text(), Metadata.from(CARD_NAME_KEY, document.id())))
            .toList();

        List<Embedding> embeddings;
        try {
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            embeddings = response == null ? null : response.content();
        } catch (RuntimeException exception) {
            throw new IndexBuildException("Embedding failed for version " + versionId + ": " + exception.getMessage(), exception);
        }
        if (embeddings == null || embeddings.size() != segments.size()) {
            throw new IndexBuildException(
                "Embedding count mismatch for version " + versionId
                    + " (expected=" + segments.size() + ", got=" + (embeddings == null ? 0 : embeddings.size()) + ")"
            );
        }

        InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
        store.addAll(embeddings, segments);
        verify(store, embeddings.get(0), segments.size(), versionId);

        String handleId = UUID.randomUUID().toString();
        Path persistedPath = persist(store, handleId, versionId);

        IndexHandle handle = new IndexHandle(
            handleId,
            versionId,
            OffsetDateTime.now(clock),
            store,
            documents,
            persistedPath
        );
        log.info(
            "Knowledge index built (handle={}, version={}, documents={}, tookMs={})",
            handleId,
            versionId,
            documents.size(),
            (System.nanoTime() - startedAt) / 1_000_000
        );
        return handle;
    }

    /**
     * Documents most similar to {@code text}, best first. {@code k} is capped by
     * {@code rag.index.max-query-results}.
     */
    public List<ScoredDocument> query(IndexHandle handle, String text, int k) {
        int limit = Math.min(Math.max(k, 1), Math.max(properties.getMaxQueryResults(), 1));
        Embedding queryEmbedding = embeddingModel.embed(text == null ? "" : text).content();

        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(limit)
            .minScore(0.0)
            .build();

        List<ScoredDocument> results = new ArrayList<>();
        for (EmbeddingMatch<TextSegment> match : handle.store().search(request).matches()) {
            String cardName = match.embedded().metadata().getString(CARD_NAME_KEY);
            IndexDocument document = cardName == null ? null : handle.documents().get(cardName);
            if (document != null) {
                results.add(new ScoredDocument(document, match.score()));
            }
        }
        return results;
    }

    public int documentCount(IndexHandle handle) {
        return handle.documents().size();
    }

    public Optional<IndexDocument> find(IndexHandle handle, String cardName) {
        if (cardName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handle.documents().get(cardName.trim()));
    }

    /**
     * Removes the persisted file of a handle that is no longer active. Failures are logged only.
     */
    public void dispose(IndexHandle handle) {
        if (handle == null || handle.persistedPath() == null) {
            return;
        }
        try {
            Files.deleteIfExists(handle.persistedPath());
            log.debug("Disposed index handle {}", handle.handleId());
        } catch (IOException exception) {
            log.warn("Failed to delete index file {}", handle.persistedPath(), exception);
        }
    }

    private void verify(InMemoryEmbeddingStore<TextSegment> store, Embedding sample, int expected, String versionId) {
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
            .queryEmbedding(sample)
            .maxResults(expected)
            .minScore(0.0)
            .build();

        int found = store.search(request).matches().size();
        if (found != expected) {
            throw new IndexBuildException(
                "Index verification failed for version " + versionId + " (expected=" + expected + ", searchable=" + found + ")"
            );
        }
    }

    private Path persist(InMemoryEmbeddingStore<TextSegment> store, String handleId, String versionId) {
        Path target = directory.resolve(FILE_PREFIX + handleId + FILE_SUFFIX);
        Path temp = directory.resolve(FILE_PREFIX + handleId + FILE_SUFFIX + ".tmp");
        try {
            Files.createDirectories(directory);
            store.serializeToFile(temp);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException exception) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return target;
        } catch (IOException | RuntimeException exception) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                exception.addSuppressed(cleanup);
            }
            throw new IndexBuildException(
                "Failed to persist index for version " + versionId + ": " + exception.getMessage(),
                exception
            );
        }
    }

    private void removeOrphanedFiles() {
        if (!Files.isDirectory(directory)) {
            return;
        }
        // handles never survive a restart, so any file found here belongs to a previous process
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, FILE_PREFIX + "*")) {
            for (Path path : stream) {
                Files.deleteIfExists(path);
                log.info("Removed orphaned index file {}", path.getFileName());
            }
        } catch (IOException exception) {
            log.warn("Failed to clean index directory {}", directory, exception);
        }
    }
}
