package com.rewardpick.recommendation.service;

import com.rewardpick.catalog.service.CategoryCatalog;
import java.util.Collection;
import java.util.Optional;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

@Component
public class CategoryInference {

    private final CategoryCatalog categoryCatalog;

    public CategoryInference(CategoryCatalog categoryCatalog) {
        this.categoryCatalog = categoryCatalog;
    }

    /**
     * Resolves the spending category a query is about, limited to {@code knownCategories}.
     * Keyword rules are consulted first; a catalog category named literally in the query is
     * the fallback, checked in name order. A query whose only matches are categories the
     * catalog does not carry resolves to nothing.
     */
    public Optional<String> inferCategory(String query, Collection<String> knownCategories) {
        if (query == null || query.isBlank() || knownCategories == null || knownCategories.isEmpty()) {
            return Optional.empty();
        }

        Optional<String> byKeyword = categoryCatalog.matchKeyword(query, knownCategories);
        if (byKeyword.isPresent()) {
            return byKeyword;
        }

        for (String category : new TreeSet<>(knownCategories)) {
            if (categoryCatalog.mentions(query, category)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
