package com.rewardpick.wallet.service;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class UnknownCardException extends ResponseStatusException {

    private final List<String> suggestions;

    public UnknownCardException(String cardName, List<String> suggestions) {
        super(HttpStatus.NOT_FOUND, message(cardName, suggestions));
        this.suggestions = List.copyOf(suggestions);
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    private static String message(String cardName, List<String> suggestions) {
        String base = "Card '" + cardName + "' is not in the catalog. Use the full card name.";
        if (suggestions.isEmpty()) {
            return base;
        }
        return base + " Did you mean: " + String.join(", ", suggestions) + "?";
    }
}
