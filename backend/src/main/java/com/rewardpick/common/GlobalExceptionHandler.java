package com.rewardpick.common;

import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String EXCEPTION_SUFFIX = "Exception";
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiErrorResponse> handleResponseStatusException(
        ResponseStatusException exception,
        HttpServletRequest request
    ) {
        HttpStatus status = HttpStatus.valueOf(exception.getStatusCode().value());
        return toResponse(status, errorCode(exception, status), exception.getReason(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidationException(
        MethodArgumentNotValidException exception,
        HttpServletRequest request
    ) {
        String message = exception.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return toResponse(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message.isBlank() ? "Invalid request" : message, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpectedException(Exception exception, HttpServletRequest request) {
        log.error("Unhandled error on {}", request.getRequestURI(), exception);
        return toResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "INTERNAL_ERROR",
            "Something went wrong while handling the request. Please try again later.",
            request
        );
    }

    /**
     * {@code IndexNotReadyException} becomes {@code INDEX_NOT_READY}. A plain
     * {@link ResponseStatusException} falls back to the status name.
     */
    static String errorCode(ResponseStatusException exception, HttpStatus status) {
        String simpleName = exception.getClass().getSimpleName();
        if (exception.getClass() == ResponseStatusException.class || !simpleName.endsWith(EXCEPTION_SUFFIX)) {
            return status.name();
        }
        String stem = simpleName.substring(0, simpleName.length() - EXCEPTION_SUFFIX.length());
        return CAMEL_BOUNDARY.matcher(stem).replaceAll("_").toUpperCase(Locale.ROOT);
    }

    private ResponseEntity<ApiErrorResponse> toResponse(
        HttpStatus status,
        String code,
        String message,
        HttpServletRequest request
    ) {
        ApiErrorResponse body = new ApiErrorResponse(
            Instant.now(),
            status.value(),
            status.getReasonPhrase(),
            code,
            message,
            request.getRequestURI()
        );

        return ResponseEntity.status(status).body(body);
    }
}
