package com.abba.rxreminder.domain.exception;

public class UpstreamServiceException extends RxReminderException {

    public UpstreamServiceException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_SERVICE_ERROR, message, cause.getMessage(), cause);
    }
}
