package com.customerapi.common.validation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Validation outcome carrying the normalized value when the check passed.
 *
 * @param <T> type of the normalized value
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult<T> {

    ErrorInfo errorInfo;
    T value;

    public static <T> ValidationResult<T> ok(T value) {
        return new ValidationResult<>(ErrorInfo.ok(), value);
    }

    public static <T> ValidationResult<T> failed(ErrorInfo errorInfo) {
        if (errorInfo.isOk()) {
            throw new IllegalArgumentException("A failed result needs a non-OK ErrorInfo");
        }
        return new ValidationResult<>(errorInfo, null);
    }

    public static <T> ValidationResult<T> badInput(String field, String message) {
        return failed(ErrorInfo.badInput(field, message));
    }

    public boolean isOk() {
        return errorInfo.isOk();
    }
}
