package com.customerapi.common.validation;

import java.util.regex.Pattern;

/**
 * Validates and normalizes person names.
 *
 * Accepted: letters in any script, spaces, apostrophes, hyphens and periods.
 * Normalized form: trimmed, runs of whitespace collapsed to one space, first
 * letter of every word upper-cased (the rest of the word is kept as typed so
 * "McDonald" survives).
 */
public final class FullNameValidator {

    public static final int MIN_LENGTH = 2;
    public static final int MAX_LENGTH = 100;

    private static final Pattern ALLOWED = Pattern.compile("^[\\p{L}\\p{M}' .\\-]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");

    private FullNameValidator() {
        // Utility class - no instantiation
    }

    public static ValidationResult<String> validate(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            return ValidationResult.badInput("fullName", "Full name is required");
        }

        String collapsed = WHITESPACE.matcher(fullName.trim()).replaceAll(" ");

        if (collapsed.length() < MIN_LENGTH || collapsed.length() > MAX_LENGTH) {
            return ValidationResult.badInput("fullName",
                    String.format("Full name must be between %d and %d characters", MIN_LENGTH, MAX_LENGTH));
        }

        if (!ALLOWED.matcher(collapsed).matches() || !HAS_LETTER.matcher(collapsed).find()) {
            return ValidationResult.badInput("fullName",
                    "Full name may only contain letters, spaces, apostrophes, hyphens and periods");
        }

        return ValidationResult.ok(capitalizeWords(collapsed));
    }

    private static String capitalizeWords(String value) {
        StringBuilder result = new StringBuilder(value.length());
        boolean wordStart = true;

        for (int i = 0; i < value.length(); ) {
            int codePoint = value.codePointAt(i);
            if (wordStart && Character.isLetter(codePoint)) {
                result.appendCodePoint(Character.toTitleCase(codePoint));
            } else {
                result.appendCodePoint(codePoint);
            }
            wordStart = codePoint == ' ' || codePoint == '-';
            i += Character.charCount(codePoint);
        }

        return result.toString();
    }
}
