package com.rewardpick.catalog.service;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Shared spending-category vocabulary. Catalog rows and free-text queries are both mapped
 * through it so that "gas", "petrol" and "加油" all land on {@code fuel}.
 */
@Component
public class CategoryCatalog {

    private static final List<CategoryKeywordRule> KEYWORD_RULES = buildKeywordRules();
    private static final Map<String, String> CATEGORY_ALIASES = buildCategoryAliases();

    /**
     * Maps a raw category cell to its canonical name. Unknown categories stay open-ended and
     * are only normalized (lower case, inner whitespace collapsed to '-').
     */
    public String canonicalize(String rawCategory) {
        String token = normalizeToken(rawCategory);
        if (token.isBlank()) {
            return "";
        }
        String alias = CATEGORY_ALIASES.get(token);
        if (alias != null) {
            return alias;
        }
        return rawCategory.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
    }

    /**
     * Finds the category among {@code candidates} whose keyword occurs in the text. The longest
     * matching keyword wins; equal lengths go to the rule declared first. Rules for categories
     * outside {@code candidates} are ignored.
     */
    public Optional<String> matchKeyword(String text, Collection<String> candidates) {
        String normalized = normalizeText(text);
        if (normalized.isBlank() || candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        String bestCategory = null;
        int bestLength = 0;
        for (CategoryKeywordRule rule : KEYWORD_RULES) {
            if (!candidates.contains(rule.category())) {
                continue;
            }
            for (Keyword keyword : rule.keywords()) {
                if (keyword.value().length() > bestLength && keyword.matches(normalized)) {
                    bestCategory = rule.category();
                    bestLength = keyword.value().length();
                }
            }
        }
        return Optional.ofNullable(bestCategory);
    }

    /**
     * True when the category name itself (with '-' read as a space) occurs in the text.
     */
    public boolean mentions(String text, String category) {
        String normalized = normalizeText(text);
        String phrase = category == null ? "" : category.toLowerCase(Locale.ROOT).replace('-', ' ').trim();
        if (normalized.isBlank() || phrase.isBlank()) {
            return false;
        }
        return Keyword.of(phrase).matches(normalized);
    }

    static String normalizeText(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", " ").trim();
    }

    private static String normalizeToken(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT)
            .replaceAll("[\\s_./|-]+", "")
            .trim();
    }

    private static List<CategoryKeywordRule> buildKeywordRules() {
        return List.of(
            new CategoryKeywordRule("fuel", Set.of(
                "fuel", "gas", "gasoline", "petrol", "gas station", "refuel", "diesel",
                "加油", "油錢", "中油", "台塑", "加油站")),
            new CategoryKeywordRule("online", Set.of(
                "online", "online shopping", "e-commerce", "ecommerce", "amazon", "shopee", "momo", "pchome",
                "網購", "網路購物", "線上購物", "蝦皮")),
            new CategoryKeywordRule("dining", Set.of(
                "dining", "restaurant", "dinner", "lunch", "breakfast", "meal", "eat out", "food delivery",
                "uber eats", "foodpanda", "餐廳", "吃飯", "用餐", "美食", "餐飲", "外送")),
            new CategoryKeywordRule("convenience", Set.of(
                "convenience store", "convenience", "7-11", "7-eleven", "familymart", "family mart",
                "超商", "便利商店", "全家", "萊爾富")),
            new CategoryKeywordRule("grocery", Set.of(
                "grocery", "groceries", "supermarket", "costco", "超市", "量販", "全聯", "家樂福")),
            new CategoryKeywordRule("travel", Set.of(
                "travel", "trip", "flight", "airline", "hotel", "vacation",
                "旅遊", "旅行", "出國", "機票", "飯店", "訂房")),
            new CategoryKeywordRule("overseas", Set.of(
                "overseas", "abroad", "foreign currency", "foreign purchase", "海外", "國外消費", "外幣")),
            new CategoryKeywordRule("streaming", Set.of(
                "streaming", "netflix", "disney+", "disney", "spotify", "youtube premium", "subscription",
                "影音", "串流", "訂閱")),
            new CategoryKeywordRule("transport", Set.of(
                "transport", "transit", "train", "metro", "subway", "taxi", "uber", "bus", "high speed rail",
                "交通", "高鐵", "台鐵", "計程車", "捷運", "公車")),
            new CategoryKeywordRule("mobile-pay", Set.of(
                "mobile pay", "mobile payment", "line pay", "apple pay", "google pay", "jko pay",
                "行動支付", "街口")),
            new CategoryKeywordRule("general", Set.of(
                "general", "everyday", "all purchases", "any purchase", "一般消費", "國內一般消費"))
        );
    }

    private static Map<String, String> buildCategoryAliases() {
        Map<String, String> aliases = new HashMap<>();
        for (CategoryKeywordRule rule : KEYWORD_RULES) {
            aliases.put(normalizeToken(rule.category()), rule.category());
            for (Keyword keyword : rule.keywords()) {
                aliases.putIfAbsent(normalizeToken(keyword.value()), rule.category());
            }
        }
        return aliases;
    }

    private record CategoryKeywordRule(String category, List<Keyword> keywords) {

        private CategoryKeywordRule(String category, Set<String> keywords) {
            this(category, keywords.stream().sorted().map(Keyword::of).toList());
        }
    }

    /**
     * ASCII keywords only match on word boundaries so "gas" does not fire inside "vegas";
     * CJK keywords match as plain substrings.
     */
    private record Keyword(String value, Pattern pattern) {

        private static Keyword of(String raw) {
            String value = normalizeText(raw);
            if (value.chars().allMatch(ch -> ch < 128)) {
                return new Keyword(value, Pattern.compile("(?<![a-z0-9])" + Pattern.quote(value) + "(?![a-z0-9])"));
            }
            return new Keyword(value, null);
        }

        private boolean matches(String normalizedText) {
            if (pattern == null) {
                return normalizedText.contains(value);
            }
            return pattern.matcher(normalizedText).find();
        }
    }
}
