package com.abba.rxreminder.domain.exception;

/**
 * Base type for failures that are reported to API callers. {@link #getDetails()} carries
 * an optional technical detail (parser message, provider status) kept apart from the message.
 */
public abstract class RxReminderException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String details;

    protected RxReminderException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected RxReminderException(ErrorCode errorCode, String message, String details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getDetails() {
        return details;
    }
}
