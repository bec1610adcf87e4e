package com.customerapi.common.validation;

import java.util.Collection;
import java.util.Locale;

/**
 * Validates sort parameters against the sortable fields of a record type.
 */
public final class SortFieldValidator {

    private SortFieldValidator() {
        // Utility class - no instantiation
    }

    /**
     * Match the requested field case-insensitively.
     *
     * @return the canonical field name, or the default when nothing was requested
     */
    public static ValidationResult<String> validate(String sortField, Collection<String> sortableFields,
                                                    String defaultField) {
        if (sortField == null || sortField.isBlank()) {
            return ValidationResult.ok(defaultField);
        }

        String requested = sortField.trim();
        for (String field : sortableFields) {
            if (field.equalsIgnoreCase(requested)) {
                return ValidationResult.ok(field);
            }
        }

        return ValidationResult.badInput("sortField",
                String.format("Cannot sort by '%s'. Sortable fields: %s", requested, String.join(", ", sortableFields)));
    }

    /**
     * Accepts "asc" / "desc" in any case; ascending when nothing was requested.
     */
    public static ValidationResult<SortDirection> validateDirection(String sortDirection) {
        if (sortDirection == null || sortDirection.isBlank()) {
            return ValidationResult.ok(SortDirection.ASC);
        }

        try {
            return ValidationResult.ok(SortDirection.valueOf(sortDirection.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return ValidationResult.badInput("sortDirection", "Sort direction must be 'asc' or 'desc'");
        }
    }
}
