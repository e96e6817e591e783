package com.abba.rxreminder.domain.exception;

public class MissingParameterException extends RxReminderException {

    public MissingParameterException(String message) {
        super(ErrorCode.MISSING_PARAMETER, message);
    }
}
