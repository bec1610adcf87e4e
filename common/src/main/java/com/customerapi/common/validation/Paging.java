package com.customerapi.common.validation;

import lombok.Value;

/**
 * Validated, 1-based page coordinates.
 */
@Value
public class Paging {

    int pageIndex;
    int pageSize;

    /**
     * Number of records preceding this page.
     */
    public long offset() {
        return (long) (pageIndex - 1) * pageSize;
    }
}
