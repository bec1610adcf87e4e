package com.customerapi.common.exception;

/**
 * Thrown when the backing store fails to complete an operation.
 */
public class PersistenceException extends CustomerApiException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
