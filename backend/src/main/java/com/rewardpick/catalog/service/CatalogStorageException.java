package com.rewardpick.catalog.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class CatalogStorageException extends ResponseStatusException {

    public CatalogStorageException(String reason) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, reason);
    }

    public CatalogStorageException(String reason, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, reason, cause);
    }
}
