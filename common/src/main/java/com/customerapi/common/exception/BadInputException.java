package com.customerapi.common.exception;

import com.customerapi.common.validation.ErrorInfo;
import com.customerapi.common.validation.ErrorType;

/**
 * Thrown when a request field fails validation.
 */
public class BadInputException extends CustomerApiException {

    public BadInputException(ErrorInfo errorInfo) {
        super(errorInfo.getMessage(), ErrorType.BAD_INPUT.getStatus(),
                ErrorType.BAD_INPUT.getErrorCode(), errorInfo.getField());
    }
}
