package com.rewardpick.refresh.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class RefreshInProgressException extends ResponseStatusException {

    public RefreshInProgressException(String trigger) {
        super(HttpStatus.CONFLICT, "A catalog refresh is already running; request from " + trigger + " was rejected");
    }
}
