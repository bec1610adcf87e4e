package com.customerapi.common.dto.customer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Address entry as supplied by API callers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddressRequest {

    private String type;            // HOME, WORK, MAILING, OTHER (optional)
    private String line1;
    private String line2;
    private String city;
    private String state;
    private String postalCode;
    private String country;         // ISO 3166-1 alpha-2
}
