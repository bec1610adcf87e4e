package com.customerapi.common.validation;

import com.customerapi.common.dto.customer.AddressRequest;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates a single address entry and returns a trimmed copy of it.
 */
public final class AddressValidator {

    public static final Set<String> ADDRESS_TYPES = Set.of("HOME", "WORK", "MAILING", "OTHER");

    private static final int MAX_LINE_LENGTH = 200;
    private static final int MAX_CITY_LENGTH = 100;
    private static final Pattern POSTAL_CODE_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9 \\-]{1,8}[A-Za-z0-9]$");
    private static final Pattern COUNTRY_PATTERN = Pattern.compile("^[A-Za-z]{2}$");

    private AddressValidator() {
        // Utility class - no instantiation
    }

    public static ValidationResult<AddressRequest> validate(AddressRequest address) {
        if (address == null) {
            return ValidationResult.badInput("addresses", "Address entry cannot be null");
        }

        String type = trimToNull(address.getType());
        String line1 = trimToNull(address.getLine1());
        String line2 = trimToNull(address.getLine2());
        String city = trimToNull(address.getCity());
        String state = trimToNull(address.getState());
        String postalCode = trimToNull(address.getPostalCode());
        String country = trimToNull(address.getCountry());

        if (type != null && !ADDRESS_TYPES.contains(type.toUpperCase(Locale.ROOT))) {
            return ValidationResult.badInput("addresses.type",
                    "Address type must be one of " + String.join(", ", ADDRESS_TYPES.stream().sorted().toList()));
        }

        if (line1 == null) {
            return ValidationResult.badInput("addresses.line1", "Address line 1 is required");
        }

        if (line1.length() > MAX_LINE_LENGTH) {
            return ValidationResult.badInput("addresses.line1",
                    String.format("Address line 1 must not exceed %d characters", MAX_LINE_LENGTH));
        }

        if (line2 != null && line2.length() > MAX_LINE_LENGTH) {
            return ValidationResult.badInput("addresses.line2",
                    String.format("Address line 2 must not exceed %d characters", MAX_LINE_LENGTH));
        }

        if (city == null) {
            return ValidationResult.badInput("addresses.city", "City is required");
        }

        if (city.length() > MAX_CITY_LENGTH) {
            return ValidationResult.badInput("addresses.city",
                    String.format("City must not exceed %d characters", MAX_CITY_LENGTH));
        }

        if (state != null && state.length() > MAX_CITY_LENGTH) {
            return ValidationResult.badInput("addresses.state",
                    String.format("State must not exceed %d characters", MAX_CITY_LENGTH));
        }

        if (postalCode == null || !POSTAL_CODE_PATTERN.matcher(postalCode).matches()) {
            return ValidationResult.badInput("addresses.postalCode",
                    "Postal code must be 3 to 10 letters, digits, spaces or hyphens");
        }

        if (country == null || !COUNTRY_PATTERN.matcher(country).matches()) {
            return ValidationResult.badInput("addresses.country",
                    "Country must be a two-letter ISO 3166-1 code");
        }

        return ValidationResult.ok(AddressRequest.builder()
                .type(type == null ? null : type.toUpperCase(Locale.ROOT))
                .line1(line1)
                .line2(line2)
                .city(city)
                .state(state)
                .postalCode(postalCode.toUpperCase(Locale.ROOT))
                .country(country.toUpperCase(Locale.ROOT))
                .build());
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
