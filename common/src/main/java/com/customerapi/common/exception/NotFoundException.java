package com.customerapi.common.exception;

import com.customerapi.common.validation.ErrorInfo;
import com.customerapi.common.validation.ErrorType;

/**
 * Thrown when the addressed entity does not exist.
 */
public class NotFoundException extends CustomerApiException {

    public NotFoundException(ErrorInfo errorInfo) {
        super(errorInfo.getMessage(), ErrorType.NOT_FOUND.getStatus(),
                ErrorType.NOT_FOUND.getErrorCode(), errorInfo.getField());
    }
}
