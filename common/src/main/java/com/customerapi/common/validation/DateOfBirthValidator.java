package com.customerapi.common.validation;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Validates dates of birth.
 *
 * Supports:
 * - YYYY-MM-DD strings
 * - ISO datetime strings, local or with offset (the time part must be valid, then is dropped)
 */
public final class DateOfBirthValidator {

    public static final int MAX_AGE_YEARS = 150;

    private static final DateTimeFormatter ISO_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private DateOfBirthValidator() {
        // Utility class - no instantiation
    }

    /**
     * @param dateOfBirth raw value from the request
     * @param today       current date in the service's time zone
     */
    public static ValidationResult<LocalDate> validate(String dateOfBirth, LocalDate today) {
        if (dateOfBirth == null || dateOfBirth.isBlank()) {
            return ValidationResult.badInput("dateOfBirth", "Date of birth is required");
        }

        LocalDate parsed = parse(dateOfBirth.trim());
        if (parsed == null) {
            return ValidationResult.badInput("dateOfBirth", "Date of birth must be a valid date in YYYY-MM-DD format");
        }

        if (parsed.isAfter(today)) {
            return ValidationResult.badInput("dateOfBirth", "Date of birth cannot be in the future");
        }

        if (parsed.isBefore(today.minusYears(MAX_AGE_YEARS))) {
            return ValidationResult.badInput("dateOfBirth",
                    String.format("Date of birth cannot be more than %d years ago", MAX_AGE_YEARS));
        }

        return ValidationResult.ok(parsed);
    }

    private static LocalDate parse(String value) {
        if (value.indexOf('T') < 0) {
            try {
                return LocalDate.parse(value, ISO_FORMAT);
            } catch (DateTimeParseException e) {
                return null;
            }
        }

        try {
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toLocalDate();
        } catch (DateTimeParseException e) {
            // fall through to the offset form
        }
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toLocalDate();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
