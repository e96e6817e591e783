package com.abba.rxreminder.domain.exception;

public class InvalidFormatException extends RxReminderException {

    public InvalidFormatException(String message) {
        super(ErrorCode.INVALID_FORMAT, message);
    }
}
