package com.customerapi.common.dto.customer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Data Transfer Object for Customer entities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerDto {

    private Integer id;
    private String fullName;
    private LocalDate dateOfBirth;
    private int age;
    private List<AddressDto> addresses;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
