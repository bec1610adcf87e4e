package com.customerapi.common.validation;

import org.springframework.http.HttpStatus;

/**
 * Outcome categories reported by validators.
 */
public enum ErrorType {

    OK(HttpStatus.OK, null),
    BAD_INPUT(HttpStatus.BAD_REQUEST, "CUSTOMER_ERR_400"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "CUSTOMER_ERR_404");

    private final HttpStatus status;
    private final String errorCode;

    ErrorType(HttpStatus status, String errorCode) {
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
