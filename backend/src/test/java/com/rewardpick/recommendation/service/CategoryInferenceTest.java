package com.rewardpick.recommendation.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.rewardpick.catalog.service.CategoryCatalog;
import java.util.List;
import org.junit.jupiter.api.Test;

class CategoryInferenceTest {

    private final CategoryInference categoryInference = new CategoryInference(new CategoryCatalog());

    @Test
    void infer_category_should_match_keyword_rules() {
        List<String> known = List.of("dining", "fuel", "online", "streaming");

        assertThat(categoryInference.inferCategory("need gas", known)).contains("fuel");
        assertThat(categoryInference.inferCategory("明天要加油", known)).contains("fuel");
        assertThat(categoryInference.inferCategory("ordering food delivery tonight", known)).contains("dining");
        assertThat(categoryInference.inferCategory("Netflix renewal", known)).contains("streaming");
    }

    @Test
    void infer_category_should_prefer_the_longest_keyword() {
        List<String> known = List.of("dining", "transport");

        assertThat(categoryInference.inferCategory("uber eats for lunch", known)).contains("dining");
        assertThat(categoryInference.inferCategory("uber to the airport", known)).contains("transport");
    }

    @Test
    void infer_category_should_ignore_keywords_for_categories_missing_from_the_catalog() {
        List<String> known = List.of("dining", "fuel", "online");

        assertThat(categoryInference.inferCategory("weekly groceries at the supermarket", known)).isEmpty();
        assertThat(categoryInference.inferCategory("Netflix renewal", known)).isEmpty();
        assertThat(categoryInference.inferCategory("uber eats tonight", List.of("transport"))).contains("transport");
        assertThat(categoryInference.inferCategory("need gas", List.of())).isEmpty();
    }

    @Test
    void infer_category_should_match_ascii_keywords_on_word_boundaries_only() {
        assertThat(categoryInference.inferCategory("las vegas trip", List.of("fuel", "travel"))).contains("travel");
    }

    @Test
    void infer_category_should_fall_back_to_catalog_category_names() {
        List<String> known = List.of("pet-care", "bookstore");

        assertThat(categoryInference.inferCategory("pet care supplies", known)).contains("pet-care");
        assertThat(categoryInference.inferCategory("a bookstore haul", known)).contains("bookstore");
    }

    @Test
    void infer_category_should_return_empty_when_nothing_matches() {
        assertThat(categoryInference.inferCategory("hello there", List.of("fuel"))).isEmpty();
        assertThat(categoryInference.inferCategory("   ", List.of("fuel"))).isEmpty();
        assertThat(categoryInference.inferCategory(null, List.of("fuel"))).isEmpty();
    }

    @Test
    void infer_category_should_be_deterministic() {
        List<String> known = List.of("fuel", "dining");
        String query = "dinner after refuel";

        assertThat(categoryInference.inferCategory(query, known))
            .isEqualTo(categoryInference.inferCategory(query, List.of("dining", "fuel")));
    }
}
