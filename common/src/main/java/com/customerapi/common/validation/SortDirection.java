package com.customerapi.common.validation;

public enum SortDirection {
    ASC,
    DESC
}
