package com.example.resumeindex;

import org.springframework.http.HttpStatus;

/**
 * Failure categories surfaced by the index and query operations, with the HTTP status each one
 * maps to at the API boundary.
 */
public enum ErrorCode {

    CONFIGURATION("invalid configuration or request parameter", HttpStatus.BAD_REQUEST),
    VALIDATION("invalid record or vector data", HttpStatus.UNPROCESSABLE_ENTITY),
    NOT_FOUND("requested store row or index artifact not found", HttpStatus.NOT_FOUND),
    DIMENSION_MISMATCH("query vector dimension does not match the index", HttpStatus.UNPROCESSABLE_ENTITY),
    UPSTREAM("embedding provider failure", HttpStatus.BAD_GATEWAY);

    private final String defaultMessage;
    private final HttpStatus status;

    ErrorCode(String defaultMessage, HttpStatus status) {
        this.defaultMessage = defaultMessage;
        this.status = status;
    }

    public String defaultMessage() { return defaultMessage; }

    public HttpStatus status() { return status; }
}
