package com.abba.rxreminder.infrastructure.web;

import com.abba.rxreminder.domain.exception.ErrorCode;
import com.abba.rxreminder.domain.exception.RxReminderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(RxReminderException.class)
    public ResponseEntity<ErrorResponse> handleApplicationError(RxReminderException e) {
        ErrorCode code = e.getErrorCode();
        if (code.getStatus().is4xxClientError()) {
            log.warn("Rejected request code={} message={}", code, e.getMessage());
        }
        return ResponseEntity.status(code.getStatus())
                .body(new ErrorResponse(e.getMessage(), code, e.getDetails()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.status(ErrorCode.INVALID_FORMAT.getStatus())
                .body(new ErrorResponse("Request body is not valid JSON.", ErrorCode.INVALID_FORMAT, null));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(ErrorCode.INVALID_PARAMETER.getStatus())
                .body(new ErrorResponse("Uploaded file is too large.", ErrorCode.INVALID_PARAMETER, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled error: {}", e.getMessage(), e);
        return ResponseEntity.status(ErrorCode.INTERNAL_ERROR.getStatus())
                .body(new ErrorResponse("An internal server error occurred.", ErrorCode.INTERNAL_ERROR, null));
    }
}
