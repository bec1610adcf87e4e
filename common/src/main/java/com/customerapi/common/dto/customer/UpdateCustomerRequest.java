package com.customerapi.common.dto.customer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for updating a customer.
 *
 * Null fields are left untouched. A non-null address list replaces the stored one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateCustomerRequest {

    private Integer customerIdentifier;
    private String fullName;
    private String dateOfBirth;
    private List<AddressRequest> addresses;
}
