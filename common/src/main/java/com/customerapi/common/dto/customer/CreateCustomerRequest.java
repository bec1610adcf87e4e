package com.customerapi.common.dto.customer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for creating a customer.
 *
 * Date of birth travels as text so that an unparseable value is reported as a
 * validation error on the field rather than as a malformed body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateCustomerRequest {

    private String fullName;
    private String dateOfBirth;     // yyyy-MM-dd
    private List<AddressRequest> addresses;
}
