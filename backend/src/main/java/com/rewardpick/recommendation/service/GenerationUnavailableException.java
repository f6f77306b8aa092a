package com.rewardpick.recommendation.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class GenerationUnavailableException extends ResponseStatusException {

    public enum Reason {
        QUOTA_EXCEEDED,
        TIMEOUT,
        NOT_CONFIGURED,
        UNAVAILABLE
    }

    private final Reason failureReason;

    public GenerationUnavailableException(Reason failureReason, String detail) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "Answer generation unavailable (" + failureReason + "): " + detail);
        this.failureReason = failureReason;
    }

    public GenerationUnavailableException(Reason failureReason, String detail, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "Answer generation unavailable (" + failureReason + "): " + detail, cause);
        this.failureReason = failureReason;
    }

    public Reason getFailureReason() {
        return failureReason;
    }
}
