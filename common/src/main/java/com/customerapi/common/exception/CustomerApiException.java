package com.customerapi.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception for all Customer API business exceptions.
 */
@Getter
public class CustomerApiException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;
    private final String field;

    public CustomerApiException(String message, HttpStatus status, String errorCode, String field) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
        this.field = field;
    }

    public CustomerApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = HttpStatus.INTERNAL_SERVER_ERROR;
        this.errorCode = "CUSTOMER_ERR_500";
        this.field = null;
    }
}
