package com.customerapi.common.validation;

/**
 * Validates paging query parameters, applying defaults for missing values.
 */
public final class PagingValidator {

    public static final int DEFAULT_PAGE_INDEX = 1;

    private PagingValidator() {
        // Utility class - no instantiation
    }

    /**
     * @param pageIndex       requested 1-based page, null for the first page
     * @param pageSize        requested page size, null for the default
     * @param defaultPageSize page size used when none is requested
     * @param maximumPageSize largest page size a caller may request
     */
    public static ValidationResult<Paging> validate(Integer pageIndex, Integer pageSize,
                                                    int defaultPageSize, int maximumPageSize) {
        int index = pageIndex == null ? DEFAULT_PAGE_INDEX : pageIndex;
        int size = pageSize == null ? Math.min(defaultPageSize, maximumPageSize) : pageSize;

        if (index < 1) {
            return ValidationResult.badInput("pageIndex", "Page index must be 1 or greater");
        }

        if (size < 1) {
            return ValidationResult.badInput("pageSize", "Page size must be 1 or greater");
        }

        if (size > maximumPageSize) {
            return ValidationResult.badInput("pageSize",
                    String.format("Page size must not exceed %d", maximumPageSize));
        }

        return ValidationResult.ok(new Paging(index, size));
    }
}
