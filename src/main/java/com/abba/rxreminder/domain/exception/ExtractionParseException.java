package com.abba.rxreminder.domain.exception;

/**
 * The AI service answered, but its text could not be read as a prescription document.
 */
public class ExtractionParseException extends RxReminderException {

    public ExtractionParseException(String message, String details, Throwable cause) {
        super(ErrorCode.EXTRACTION_PARSE_ERROR, message, details, cause);
    }
}
