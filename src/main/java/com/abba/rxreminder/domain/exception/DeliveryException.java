package com.abba.rxreminder.domain.exception;

public class DeliveryException extends RxReminderException {

    public DeliveryException(String message, String details) {
        super(ErrorCode.DELIVERY_ERROR, message, details, null);
    }

    public DeliveryException(String message, Throwable cause) {
        super(ErrorCode.DELIVERY_ERROR, message, cause.getMessage(), cause);
    }
}
