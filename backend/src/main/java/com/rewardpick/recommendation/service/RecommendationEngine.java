package com.rewardpick.recommendation.service;

import com.rewardpick.catalog.model.CardRecord;
import com.rewardpick.catalog.model.IndexDocument;
import com.rewardpick.catalog.service.CatalogParser;
import com.rewardpick.index.service.IndexHandle;
import com.rewardpick.index.service.KnowledgeIndex;
import com.rewardpick.index.service.ScoredDocument;
import com.rewardpick.recommendation.dto.ExpiredCard;
import com.rewardpick.recommendation.dto.RankedCard;
import com.rewardpick.recommendation.dto.RecommendationResult;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Recommends which of the user's held cards to use for a spending scenario.
 *
 * <p>The active {@link IndexHandle} is the only shared state. It is read once per request and
 * replaced as a whole by {@link #activate(IndexHandle)}, so a request that started before a
 * refresh finishes against the index it started with.
 */
@Service
public class RecommendationEngine {

    private static final Logger log = LoggerFactory.getLogger(RecommendationEngine.class);

    static final String NO_CARDS_SUMMARY =
        "You have not added any cards yet. Add the cards you hold to get a recommendation.";
    static final String CATEGORY_INFERENCE_FAILED = "category inference failed";

    private static final Comparator<RankedCard> RANKING = Comparator
        .comparingDouble(RankedCard::rate).reversed()
        .thenComparing(RankedCard::cardName);

    private final KnowledgeIndex knowledgeIndex;
    private final CategoryInference categoryInference;
    private final AnswerGenerator answerGenerator;
    private final RecommendationProperties properties;
    private final Clock clock;
    private final AtomicReference<IndexHandle> activeHandle = new AtomicReference<>();

    public RecommendationEngine(
        KnowledgeIndex knowledgeIndex,
        CategoryInference categoryInference,
        AnswerGenerator answerGenerator,
        RecommendationProperties properties,
        Clock clock
    ) {
        this.knowledgeIndex = knowledgeIndex;
        this.categoryInference = categoryInference;
        this.answerGenerator = answerGenerator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Makes {@code handle} the index for every request that starts from now on.
     *
     * @return the handle that was active before, or null
     */
    public IndexHandle activate(IndexHandle handle) {
        IndexHandle previous = activeHandle.getAndSet(handle);
        log.info(
            "Index handle activated (handle={}, version={}, previous={})",
            handle.handleId(),
            handle.versionId(),
            previous == null ? "none" : previous.handleId()
        );
        return previous;
    }

    public Optional<IndexHandle> activeHandle() {
        return Optional.ofNullable(activeHandle.get());
    }

    public RecommendationResult recommend(String query, Collection<String> heldCards) {
        Set<String> held = normalizeHeld(heldCards);
        if (held.isEmpty()) {
            return noCardsHeld();
        }

        IndexHandle handle = requireHandle();
        LocalDate today = LocalDate.now(clock);

        Map<String, IndexDocument> heldDocuments = new LinkedHashMap<>();
        List<String> unknownCards = new ArrayList<>();
        for (String name : held) {
            IndexDocument document = resolve(handle, name);
            if (document == null) {
                unknownCards.add(name);
            } else {
                heldDocuments.putIfAbsent(document.id(), document);
            }
        }

        Map<String, Double> similarities = retrieveSimilarities(handle, query, held.size(), heldDocuments.keySet());

        List<IndexDocument> active = new ArrayList<>();
        List<ExpiredCard> expiredCards = new ArrayList<>();
        for (IndexDocument document : heldDocuments.values()) {
            CardRecord card = document.card();
            if (card.isExpired(today)) {
                expiredCards.add(new ExpiredCard(card.name(), card.validUntil()));
            } else {
                active.add(document);
            }
        }

        Optional<String> category = categoryInference.inferCategory(query, handle.categories());
        List<String> notes = new ArrayList<>();
        List<RankedCard> candidates = new ArrayList<>();
        for (IndexDocument document : active) {
            CardRecord card = document.card();
            Double similarity = similarities.get(card.name());
            if (category.isPresent()) {
                double rate = card.rateFor(category.get()).orElse(0.0);
                if (rate > 0) {
                    candidates.add(toRankedCard(card, category.get(), rate, similarity));
                }
            } else {
                Map.Entry<String, Double> best = card.bestReward();
                candidates.add(toRankedCard(card, best.getKey(), best.getValue(), similarity));
            }
        }

        if (category.isEmpty()) {
            notes.add(CATEGORY_INFERENCE_FAILED);
        }
        if (!unknownCards.isEmpty()) {
            notes.add("not in the catalog: " + String.join(", ", unknownCards));
        }
        if (!expiredCards.isEmpty()) {
            notes.add("expired and not ranked: " + String.join(", ", expiredCards.stream().map(ExpiredCard::cardName).toList()));
        }

        List<RankedCard> ranked = candidates.stream()
            .sorted(RANKING)
            .limit(Math.max(properties.getTopN(), 1))
            .toList();

        String summary;
        boolean generated = false;
        if (ranked.isEmpty()) {
            summary = emptySummary(category.orElse(null), active.isEmpty());
        } else {
            String templated = templatedSummary(category.orElse(null), ranked);
            summary = templated;
            try {
                summary = answerGenerator.generate(buildPrompt(query, category.orElse(null), ranked), groundingFacts(ranked, heldDocuments));
                generated = true;
            } catch (RuntimeException exception) {
                log.warn("Answer generation failed, using template (version={}): {}", handle.versionId(), exception.getMessage());
                summary = templated;
            }
        }

        log.debug(
            "Recommendation served (version={}, held={}, category={}, ranked={}, expired={}, unknown={})",
            handle.versionId(),
            held.size(),
            category.orElse("none"),
            ranked.size(),
            expiredCards.size(),
            unknownCards.size()
        );

        return new RecommendationResult(
            ranked,
            expiredCards,
            unknownCards,
            category.orElse(null),
            notes,
            summary,
            generated,
            handle.versionId()
        );
    }

    /**
     * Card names of the active catalog, in catalog order.
     */
    public List<String> knownCardNames() {
        return List.copyOf(requireHandle().documents().keySet());
    }

    public Optional<IndexDocument> describeCard(String cardName) {
        return Optional.ofNullable(resolve(requireHandle(), cardName));
    }

    /**
     * Cards of the active catalog whose expiry date lies before today.
     */
    public List<String> expiredCardNames() {
        IndexHandle handle = activeHandle.get();
        if (handle == null) {
            return List.of();
        }
        LocalDate today = LocalDate.now(clock);
        return handle.documents().values().stream()
            .filter(document -> document.card().isExpired(today))
            .map(IndexDocument::id)
            .toList();
    }

    private IndexHandle requireHandle() {
        IndexHandle handle = activeHandle.get();
        if (handle == null) {
            throw new IndexNotReadyException();
        }
        return handle;
    }

    /**
     * Similarity of every held card that the retrieval step returned. Cards it missed are still
     * ranked; they simply carry no similarity.
     */
    private Map<String, Double> retrieveSimilarities(IndexHandle handle, String query, int heldCount, Set<String> heldNames) {
        int k = Math.max(properties.getCandidatePoolSize(), heldCount * 2 + 1);
        Map<String, Double> similarities = new LinkedHashMap<>();
        try {
            for (ScoredDocument scored : knowledgeIndex.query(handle, query, k)) {
                if (heldNames.contains(scored.document().id())) {
                    similarities.putIfAbsent(scored.document().id(), scored.similarity());
                }
            }
        } catch (RuntimeException exception) {
            log.warn("Retrieval failed, ranking held cards by name only (version={}): {}", handle.versionId(), exception.getMessage());
        }
        return similarities;
    }

    private IndexDocument resolve(IndexHandle handle, String cardName) {
        if (cardName == null || cardName.isBlank()) {
            return null;
        }
        String trimmed = cardName.trim();
        Optional<IndexDocument> exact = knowledgeIndex.find(handle, trimmed);
        if (exact.isPresent()) {
            return exact.get();
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        return handle.documents().values().stream()
            .filter(document -> document.id().toLowerCase(Locale.ROOT).equals(lower))
            .findFirst()
            .orElse(null);
    }

    private Set<String> normalizeHeld(Collection<String> heldCards) {
        Set<String> held = new LinkedHashSet<>();
        if (heldCards == null) {
            return held;
        }
        for (String name : heldCards) {
            if (name != null && !name.isBlank()) {
                held.add(name.trim());
            }
        }
        return held;
    }

    private RankedCard toRankedCard(CardRecord card, String category, double rate, Double similarity) {
        return new RankedCard(
            card.name(),
            category,
            rate,
            card.activationRequired(),
            card.validUntil(),
            card.conditions(),
            similarity
        );
    }

    private RecommendationResult noCardsHeld() {
        return new RecommendationResult(List.of(), List.of(), List.of(), null, List.of(), NO_CARDS_SUMMARY, false, null);
    }

    private String buildPrompt(String query, String category, List<RankedCard> ranked) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Question: ").append(query).append('\n');
        prompt.append("Category: ").append(category == null ? "unknown, ranked by each card's best reward" : category).append('\n');
        prompt.append("Ranking:\n");
        for (int index = 0; index < ranked.size(); index++) {
            prompt.append(index + 1).append(". ").append(describe(ranked.get(index))).append('\n');
        }
        return prompt.toString();
    }

    private List<String> groundingFacts(List<RankedCard> ranked, Map<String, IndexDocument> heldDocuments) {
        List<String> facts = new ArrayList<>();
        for (RankedCard card : ranked) {
            facts.add(describe(card));
            IndexDocument document = heldDocuments.get(card.cardName());
            if (document != null) {
                facts.add(document.text());
            }
        }
        return facts;
    }

    private String describe(RankedCard card) {
        StringBuilder line = new StringBuilder();
        line.append(card.cardName())
            .append(": ")
            .append(CatalogParser.formatRate(card.rate()))
            .append("% on ")
            .append(card.category())
            .append(", activation: ")
            .append(CatalogParser.activationCaveat(card.activationRequired()));
        if (card.validUntil() != null) {
            line.append(", valid until ").append(card.validUntil());
        }
        if (card.conditions() != null && !card.conditions().isBlank()) {
            line.append(", conditions: ").append(card.conditions());
        }
        return line.toString();
    }

    private String templatedSummary(String category, List<RankedCard> ranked) {
        RankedCard best = ranked.get(0);
        StringBuilder summary = new StringBuilder();
        summary.append(category == null ? "Best overall: " : "Best for " + category + ": ")
            .append(best.cardName())
            .append(" at ")
            .append(CatalogParser.formatRate(best.rate()))
            .append("%")
            .append(category == null ? " on " + best.category() : "")
            .append('.');

        for (int index = 1; index < ranked.size(); index++) {
            RankedCard next = ranked.get(index);
            summary.append(" Next: ")
                .append(next.cardName())
                .append(" at ")
                .append(CatalogParser.formatRate(next.rate()))
                .append("%")
                .append(category == null ? " on " + next.category() : "")
                .append('.');
        }

        for (RankedCard card : ranked) {
            if (card.activationRequired()) {
                summary.append(' ')
                    .append(card.cardName())
                    .append(" requires switching to the matching reward plan in the issuer's app before spending.");
            }
        }
        return summary.toString();
    }

    private String emptySummary(String category, boolean noActiveCards) {
        if (noActiveCards) {
            return "None of your cards is currently available in the catalog.";
        }
        return "None of your cards earns a reward for " + category + ".";
    }
}
