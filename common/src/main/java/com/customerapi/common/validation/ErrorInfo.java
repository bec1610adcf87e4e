package com.customerapi.common.validation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Structured result of a single validation check.
 *
 * A validator never throws for bad input; it returns an ErrorInfo and lets the
 * caller decide what to do with it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ErrorInfo {

    private static final ErrorInfo OK = new ErrorInfo(ErrorType.OK, null, null);

    ErrorType errorType;
    String field;
    String message;

    public static ErrorInfo ok() {
        return OK;
    }

    public static ErrorInfo badInput(String field, String message) {
        return new ErrorInfo(ErrorType.BAD_INPUT, field, message);
    }

    public static ErrorInfo notFound(String field, String message) {
        return new ErrorInfo(ErrorType.NOT_FOUND, field, message);
    }

    public boolean isOk() {
        return errorType == ErrorType.OK;
    }
}
