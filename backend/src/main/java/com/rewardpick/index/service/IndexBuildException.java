package com.rewardpick.index.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class IndexBuildException extends ResponseStatusException {

    public IndexBuildException(String reason) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, reason);
    }

    public IndexBuildException(String reason, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, reason, cause);
    }
}
