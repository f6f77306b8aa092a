package com.rewardpick.index.service;

import com.rewardpick.catalog.model.IndexDocument;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * One built index. The embedding store is filled during the build and only searched afterwards,
 * so a handle can be shared by any number of readers without locking.
 */
public final class IndexHandle {

    private final String handleId;
    private final String versionId;
    private final OffsetDateTime builtAt;
    private final InMemoryEmbeddingStore<TextSegment> store;
    private final Map<String, IndexDocument> documents;
    private final List<String> categories;
    private final Path persistedPath;

    public IndexHandle(
        String handleId,
        String versionId,
        OffsetDateTime builtAt,
        InMemoryEmbeddingStore<TextSegment> store,
        List<IndexDocument> documents,
        Path persistedPath
    ) {
        this.handleId = Objects.requireNonNull(handleId);
        this.versionId = Objects.requireNonNull(versionId);
        this.builtAt = builtAt;
        this.store = Objects.requireNonNull(store);
        this.persistedPath = persistedPath;

        Map<String, IndexDocument> byName = new LinkedHashMap<>();
        TreeSet<String> allCategories = new TreeSet<>();
        for (IndexDocument document : documents) {
            byName.put(document.id(), document);
            allCategories.addAll(document.metadata().categories());
        }
        this.documents = Collections.unmodifiableMap(byName);
        this.categories = List.copyOf(allCategories);
    }

    public String handleId() {
        return handleId;
    }

    public String versionId() {
        return versionId;
    }

    public OffsetDateTime builtAt() {
        return builtAt;
    }

    /**
     * Documents keyed by card name, in catalog order.
     */
    public Map<String, IndexDocument> documents() {
        return documents;
    }

    /**
     * Every category that appears in the catalog, sorted by name.
     */
    public List<String> categories() {
        return categories;
    }

    public Path persistedPath() {
        return persistedPath;
    }

    InMemoryEmbeddingStore<TextSegment> store() {
        return store;
    }

    @Override
    public String toString() {
        return "IndexHandle[" + handleId + ", version=" + versionId + ", documents=" + documents.size() + "]";
    }
}
