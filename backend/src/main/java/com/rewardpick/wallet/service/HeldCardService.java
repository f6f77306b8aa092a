package com.rewardpick.wallet.service;

import com.rewardpick.catalog.model.CardRecord;
import com.rewardpick.index.service.IndexHandle;
import com.rewardpick.recommendation.service.RecommendationEngine;
import com.rewardpick.wallet.dto.WalletCardDetail;
import com.rewardpick.wallet.dto.WalletDetailResponse;
import com.rewardpick.wallet.dto.WalletResponse;
import com.rewardpick.wallet.entity.UserCardEntity;
import com.rewardpick.wallet.repository.UserCardRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Per-user set of held card names. Names are validated against the active catalog when added
 * and stored in their catalog spelling.
 */
@Service
public class HeldCardService {

    private static final Logger log = LoggerFactory.getLogger(HeldCardService.class);

    private static final int MAX_SUGGESTIONS = 3;

    private final UserCardRepository userCardRepository;
    private final RecommendationEngine recommendationEngine;
    private final Clock clock;

    public HeldCardService(UserCardRepository userCardRepository, RecommendationEngine recommendationEngine, Clock clock) {
        this.userCardRepository = userCardRepository;
        this.recommendationEngine = recommendationEngine;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Set<String> getHeldCards(String userId) {
        Set<String> cards = new LinkedHashSet<>();
        for (UserCardEntity card : userCardRepository.findByUserIdOrderByAddedAtAscCardNameAsc(normalizeUserId(userId))) {
            cards.add(card.getCardName());
        }
        return cards;
    }

    @Transactional(readOnly = true)
    public WalletResponse getWallet(String userId) {
        String normalizedUserId = normalizeUserId(userId);
        return new WalletResponse(normalizedUserId, List.copyOf(getHeldCards(normalizedUserId)), null);
    }

    /**
     * Held cards in wallet order, each joined with its entry in the active catalog.
     *
     * @throws com.rewardpick.recommendation.service.IndexNotReadyException before the first index is active
     */
    @Transactional(readOnly = true)
    public WalletDetailResponse getWalletDetails(String userId) {
        String normalizedUserId = normalizeUserId(userId);
        LocalDate today = LocalDate.now(clock);
        List<WalletCardDetail> details = getHeldCards(normalizedUserId).stream()
            .map(name -> recommendationEngine.describeCard(name)
                .map(document -> toDetail(document.card(), today))
                .orElseGet(() -> WalletCardDetail.missing(name)))
            .toList();
        String versionId = recommendationEngine.activeHandle().map(IndexHandle::versionId).orElse(null);
        return new WalletDetailResponse(normalizedUserId, details, versionId);
    }

    /**
     * @throws UnknownCardException when the name is not in the active catalog
     */
    @Transactional
    public WalletResponse addCard(String userId, String cardName) {
        String normalizedUserId = normalizeUserId(userId);
        List<String> knownNames = recommendationEngine.knownCardNames();
        String canonicalName = matchCatalogName(cardName, knownNames)
            .orElseThrow(() -> new UnknownCardException(cardName, suggest(cardName, knownNames)));

        if (userCardRepository.findByUserIdAndCardName(normalizedUserId, canonicalName).isPresent()) {
            return walletWithMessage(normalizedUserId, "'" + canonicalName + "' is already in your wallet");
        }

        userCardRepository.save(new UserCardEntity(normalizedUserId, canonicalName, OffsetDateTime.now(clock)));
        log.info("Card added to wallet (user={}, card={})", normalizedUserId, canonicalName);
        return walletWithMessage(normalizedUserId, "Added '" + canonicalName + "'");
    }

    @Transactional
    public WalletResponse removeCard(String userId, String cardName) {
        String normalizedUserId = normalizeUserId(userId);
        String name = cardName == null ? "" : cardName.trim();
        UserCardEntity card = userCardRepository.findByUserIdAndCardName(normalizedUserId, name)
            .orElseThrow(() -> new ResponseStatusException(
                HttpStatus.NOT_FOUND,
                "'" + name + "' is not in your wallet"
            ));

        userCardRepository.delete(card);
        log.info("Card removed from wallet (user={}, card={})", normalizedUserId, name);
        return walletWithMessage(normalizedUserId, "Removed '" + name + "'");
    }

    @Transactional
    public WalletResponse clearCards(String userId) {
        String normalizedUserId = normalizeUserId(userId);
        long removed = userCardRepository.deleteByUserId(normalizedUserId);
        log.info("Wallet cleared (user={}, removed={})", normalizedUserId, removed);
        return new WalletResponse(normalizedUserId, List.of(), "Removed " + removed + " card(s)");
    }

    static Optional<String> matchCatalogName(String cardName, List<String> knownNames) {
        if (cardName == null || cardName.isBlank()) {
            return Optional.empty();
        }
        String trimmed = cardName.trim();
        if (knownNames.contains(trimmed)) {
            return Optional.of(trimmed);
        }
        return knownNames.stream().filter(name -> name.equalsIgnoreCase(trimmed)).findFirst();
    }

    /**
     * Catalog names that contain the input (or are contained in it), then names within a small
     * edit distance, closest first.
     */
    static List<String> suggest(String cardName, List<String> knownNames) {
        String input = cardName == null ? "" : cardName.trim().toLowerCase(Locale.ROOT);
        if (input.isEmpty()) {
            return List.of();
        }

        int maxDistance = Math.max(2, input.length() / 3);
        return knownNames.stream()
            .map(name -> new Suggestion(name, score(input, name.toLowerCase(Locale.ROOT))))
            .filter(suggestion -> suggestion.score() <= maxDistance)
            .sorted(Comparator.comparingInt(Suggestion::score).thenComparing(Suggestion::name))
            .limit(MAX_SUGGESTIONS)
            .map(Suggestion::name)
            .toList();
    }

    private static int score(String input, String candidate) {
        if (candidate.contains(input) || input.contains(candidate)) {
            return 0;
        }
        return editDistance(input, candidate);
    }

    private static int editDistance(String left, String right) {
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= right.length(); j++) {
                int substitution = previous[j - 1] + (left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }

    private WalletCardDetail toDetail(CardRecord card, LocalDate today) {
        Map.Entry<String, Double> best = card.bestReward();
        return new WalletCardDetail(
            card.name(),
            true,
            card.issuer(),
            card.rewards(),
            best.getKey(),
            best.getValue(),
            card.activationRequired(),
            card.validUntil(),
            card.isExpired(today),
            card.conditions(),
            card.annualFeeText()
        );
    }

    private WalletResponse walletWithMessage(String userId, String message) {
        return new WalletResponse(userId, List.copyOf(getHeldCards(userId)), message);
    }

    private String normalizeUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userId is required");
        }
        return userId.trim();
    }

    private record Suggestion(String name, int score) {
    }
}
