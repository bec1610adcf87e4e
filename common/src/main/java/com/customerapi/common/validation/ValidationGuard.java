package com.customerapi.common.validation;

import com.customerapi.common.exception.BadInputException;
import com.customerapi.common.exception.NotFoundException;

/**
 * Converts the first failed validation into the matching API exception.
 *
 * This is the only place where validator results turn into exceptions; the
 * global exception handler renders them as HTTP error responses.
 */
public final class ValidationGuard {

    private ValidationGuard() {
        // Utility class - no instantiation
    }

    /**
     * Pass through when OK, otherwise raise BadInput / NotFound.
     */
    public static void check(ErrorInfo errorInfo) {
        switch (errorInfo.getErrorType()) {
            case OK:
                return;
            case NOT_FOUND:
                throw new NotFoundException(errorInfo);
            case BAD_INPUT:
            default:
                throw new BadInputException(errorInfo);
        }
    }

    /**
     * Same as {@link #check(ErrorInfo)} but returns the normalized value.
     */
    public static <T> T check(ValidationResult<T> result) {
        check(result.getErrorInfo());
        return result.getValue();
    }
}
