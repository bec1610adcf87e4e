package com.customerapi.customer.service;

import com.customerapi.customer.model.Customer;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Customer fields a listing can be ordered by.
 */
public enum CustomerSortField {

    ID("id", Comparator.comparing(Customer::getId, Comparator.nullsLast(Comparator.naturalOrder()))),
    FULL_NAME("fullName", Comparator.comparing(Customer::getFullName,
            Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))),
    DATE_OF_BIRTH("dateOfBirth", Comparator.comparing(Customer::getDateOfBirth,
            Comparator.nullsLast(Comparator.naturalOrder()))),
    AGE("age", Comparator.comparingInt(Customer::getAge)),
    CREATED_AT("createdAt", Comparator.comparing(Customer::getCreatedAt,
            Comparator.nullsLast(Comparator.naturalOrder())));

    private static final List<String> FIELD_NAMES = Arrays.stream(values())
            .map(CustomerSortField::getFieldName)
            .toList();

    private final String fieldName;
    private final Comparator<Customer> comparator;

    CustomerSortField(String fieldName, Comparator<Customer> comparator) {
        this.fieldName = fieldName;
        this.comparator = comparator;
    }

    public String getFieldName() {
        return fieldName;
    }

    /**
     * Ties are broken by id so that paging is stable.
     */
    public Comparator<Customer> comparator() {
        return this == ID ? comparator : comparator.thenComparing(ID.comparator);
    }

    public static List<String> fieldNames() {
        return FIELD_NAMES;
    }

    public static CustomerSortField fromFieldName(String fieldName) {
        for (CustomerSortField field : values()) {
            if (field.fieldName.equals(fieldName)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown sort field: " + fieldName);
    }
}
