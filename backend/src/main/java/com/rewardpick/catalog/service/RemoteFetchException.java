package com.rewardpick.catalog.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class RemoteFetchException extends ResponseStatusException {

    public RemoteFetchException(String reason) {
        super(HttpStatus.BAD_GATEWAY, reason);
    }

    public RemoteFetchException(String reason, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, reason, cause);
    }
}
