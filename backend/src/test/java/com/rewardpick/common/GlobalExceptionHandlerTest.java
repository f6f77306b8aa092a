package com.rewardpick.common;

import static org.assertj.core.api.Assertions.assertThat;

import com.rewardpick.catalog.service.MalformedCatalogException;
import com.rewardpick.recommendation.service.IndexNotReadyException;
import com.rewardpick.wallet.service.UnknownCardException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.server.ResponseStatusException;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void error_code_should_follow_exception_type() {
        assertThat(GlobalExceptionHandler.errorCode(new IndexNotReadyException(), HttpStatus.SERVICE_UNAVAILABLE))
            .isEqualTo("INDEX_NOT_READY");
        assertThat(GlobalExceptionHandler.errorCode(new MalformedCatalogException(3, "rate is not a number"), HttpStatus.UNPROCESSABLE_ENTITY))
            .isEqualTo("MALFORMED_CATALOG");
    }

    @Test
    void error_code_should_fall_back_to_status_name_for_plain_status_exceptions() {
        ResponseStatusException exception = new ResponseStatusException(HttpStatus.NOT_FOUND, "missing");

        assertThat(GlobalExceptionHandler.errorCode(exception, HttpStatus.NOT_FOUND)).isEqualTo("NOT_FOUND");
    }

    @Test
    void handler_should_fill_code_status_and_path() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/users/u1/cards");

        ResponseEntity<ApiErrorResponse> response = handler.handleResponseStatusException(
            new UnknownCardException("Road Savr", List.of("Road Saver")),
            request
        );

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().code()).isEqualTo("UNKNOWN_CARD");
        assertThat(response.getBody().status()).isEqualTo(404);
        assertThat(response.getBody().path()).isEqualTo("/api/users/u1/cards");
    }
}
