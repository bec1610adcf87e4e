package com.customerapi.customer.mapper;

import com.customerapi.common.dto.customer.AddressDto;
import com.customerapi.common.dto.customer.AddressRequest;
import com.customerapi.common.dto.customer.CustomerDto;
import com.customerapi.customer.model.Address;
import com.customerapi.customer.model.Customer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Field-by-field conversion between request, storage and response shapes.
 * No validation happens here.
 */
@Component
public class CustomerMapper {

    public CustomerDto toDto(Customer customer) {
        return CustomerDto.builder()
                .id(customer.getId())
                .fullName(customer.getFullName())
                .dateOfBirth(customer.getDateOfBirth())
                .age(customer.getAge())
                .addresses(toAddressDtos(customer.getAddresses()))
                .createdAt(customer.getCreatedAt())
                .updatedAt(customer.getUpdatedAt())
                .build();
    }

    public List<CustomerDto> toDtos(List<Customer> customers) {
        return customers.stream().map(this::toDto).toList();
    }

    public Address toAddress(AddressRequest request) {
        return Address.builder()
                .type(request.getType())
                .line1(request.getLine1())
                .line2(request.getLine2())
                .city(request.getCity())
                .state(request.getState())
                .postalCode(request.getPostalCode())
                .country(request.getCountry())
                .build();
    }

    /**
     * Maps into a fresh mutable list, preserving order.
     */
    public List<Address> toAddresses(List<AddressRequest> requests) {
        List<Address> addresses = new ArrayList<>();
        if (requests != null) {
            for (AddressRequest request : requests) {
                addresses.add(toAddress(request));
            }
        }
        return addresses;
    }

    private List<AddressDto> toAddressDtos(List<Address> addresses) {
        if (addresses == null) {
            return List.of();
        }
        return addresses.stream()
                .map(address -> AddressDto.builder()
                        .type(address.getType())
                        .line1(address.getLine1())
                        .line2(address.getLine2())
                        .city(address.getCity())
                        .state(address.getState())
                        .postalCode(address.getPostalCode())
                        .country(address.getCountry())
                        .build())
                .toList();
    }
}
