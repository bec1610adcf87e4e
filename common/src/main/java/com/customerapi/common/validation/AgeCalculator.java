package com.customerapi.common.validation;

import java.time.LocalDate;
import java.time.Period;

public final class AgeCalculator {

    private AgeCalculator() {
        // Utility class - no instantiation
    }

    /**
     * Whole years elapsed between the date of birth and today.
     */
    public static int calculate(LocalDate dateOfBirth, LocalDate today) {
        if (dateOfBirth == null || dateOfBirth.isAfter(today)) {
            return 0;
        }
        return Period.between(dateOfBirth, today).getYears();
    }
}
