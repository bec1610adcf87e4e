package com.customerapi.customer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Customer as stored in Firestore.
 *
 * The id is assigned by the repository on create and never changes afterwards.
 * Age is derived from the date of birth and recomputed on every write.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Customer {

    private Integer id;
    private String fullName;
    private LocalDate dateOfBirth;
    private int age;

    @Builder.Default
    private List<Address> addresses = new ArrayList<>();

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
