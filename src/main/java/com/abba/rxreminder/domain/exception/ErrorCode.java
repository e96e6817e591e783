package com.abba.rxreminder.domain.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    MISSING_PARAMETER(HttpStatus.BAD_REQUEST),
    INVALID_FORMAT(HttpStatus.BAD_REQUEST),
    INVALID_PARAMETER(HttpStatus.BAD_REQUEST),
    EXTRACTION_PARSE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    DELIVERY_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    UPSTREAM_SERVICE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
