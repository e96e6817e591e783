package com.abba.rxreminder.domain.exception;

public class InvalidParameterException extends RxReminderException {

    public InvalidParameterException(String message) {
        super(ErrorCode.INVALID_PARAMETER, message);
    }
}
