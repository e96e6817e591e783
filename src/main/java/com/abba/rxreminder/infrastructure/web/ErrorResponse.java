package com.abba.rxreminder.infrastructure.web;

import com.abba.rxreminder.domain.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, ErrorCode code, String details) {
}
