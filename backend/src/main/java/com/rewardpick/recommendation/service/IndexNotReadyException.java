package com.rewardpick.recommendation.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class IndexNotReadyException extends ResponseStatusException {

    public IndexNotReadyException() {
        super(HttpStatus.SERVICE_UNAVAILABLE, "The card index is warming up. Please try again in a moment.");
    }
}
