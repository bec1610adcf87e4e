package com.customerapi.common.validation;

import java.util.Optional;

/**
 * Reports a missing entity as NOT_FOUND.
 */
public final class ExistenceValidator {

    private ExistenceValidator() {
        // Utility class - no instantiation
    }

    public static <T> ValidationResult<T> validate(Optional<T> entity, String entityName, Object id) {
        return entity
                .map(ValidationResult::ok)
                .orElseGet(() -> ValidationResult.failed(ErrorInfo.notFound("id",
                        String.format("%s not found with identifier: %s", entityName, id))));
    }
}
