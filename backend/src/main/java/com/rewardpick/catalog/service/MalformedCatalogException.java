package com.rewardpick.catalog.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Raised for the first catalog row that cannot be turned into a card record. Row numbers
 * count the header as row 1.
 */
public class MalformedCatalogException extends ResponseStatusException {

    private final int row;

    public MalformedCatalogException(int row, String detail) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "Malformed catalog at row " + row + ": " + detail);
        this.row = row;
    }

    public MalformedCatalogException(int row, String detail, Throwable cause) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "Malformed catalog at row " + row + ": " + detail, cause);
        this.row = row;
    }

    public int getRow() {
        return row;
    }
}
