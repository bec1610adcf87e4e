package com.customerapi.customer.service;

import com.customerapi.common.dto.PagingDto;
import com.customerapi.common.dto.customer.AddressRequest;
import com.customerapi.common.dto.customer.CreateCustomerRequest;
import com.customerapi.common.dto.customer.CustomerDto;
import com.customerapi.common.dto.customer.DeletedCustomerDto;
import com.customerapi.common.dto.customer.UpdateCustomerRequest;
import com.customerapi.common.validation.AddressValidator;
import com.customerapi.common.validation.AgeCalculator;
import com.customerapi.common.validation.DateOfBirthValidator;
import com.customerapi.common.validation.ExistenceValidator;
import com.customerapi.common.validation.FullNameValidator;
import com.customerapi.common.validation.IdentifierValidator;
import com.customerapi.common.validation.Paging;
import com.customerapi.common.validation.PagingValidator;
import com.customerapi.common.validation.SortDirection;
import com.customerapi.common.validation.SortFieldValidator;
import com.customerapi.common.validation.ValidationGuard;
import com.customerapi.customer.mapper.CustomerMapper;
import com.customerapi.customer.model.Address;
import com.customerapi.customer.model.Customer;
import com.customerapi.customer.repository.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Service for customer records.
 *
 * ALL business logic for customer management is here.
 * Controllers only delegate to this service.
 *
 * Every operation runs its validators first; the first failure aborts the
 * operation before the repository is written to.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerService {

    private static final String ENTITY_NAME = "Customer";

    private final CustomerRepository customerRepository;
    private final CustomerMapper customerMapper;
    private final Clock clock;

    @Value("${customer.paging.default-page-size:20}")
    private int defaultPageSize;

    @Value("${customer.paging.max-page-size:100}")
    private int maximumPageSize;

    /**
     * Get one page of customers, ordered by the requested field.
     * Sorting and slicing happen in memory over the full collection.
     */
    public PagingDto<CustomerDto> getCustomers(Integer pageIndex, Integer pageSize,
                                               String sortField, String sortDirection) {
        Paging paging = ValidationGuard.check(
                PagingValidator.validate(pageIndex, pageSize, defaultPageSize, maximumPageSize));
        String field = ValidationGuard.check(
                SortFieldValidator.validate(sortField, CustomerSortField.fieldNames(), CustomerSortField.ID.getFieldName()));
        SortDirection direction = ValidationGuard.check(SortFieldValidator.validateDirection(sortDirection));

        log.debug("Fetching customers page {} (size {}) sorted by {} {}",
                paging.getPageIndex(), paging.getPageSize(), field, direction);

        List<Customer> customers = customerRepository.findAll();

        Comparator<Customer> comparator = CustomerSortField.fromFieldName(field).comparator();
        if (direction == SortDirection.DESC) {
            comparator = comparator.reversed();
        }

        List<Customer> page = customers.stream()
                .sorted(comparator)
                .skip(paging.offset())
                .limit(paging.getPageSize())
                .toList();

        return PagingDto.of(customerMapper.toDtos(page), paging.getPageIndex(), paging.getPageSize(), customers.size());
    }

    /**
     * Get customer by identifier.
     */
    public CustomerDto getCustomer(Integer id) {
        ValidationGuard.check(IdentifierValidator.validate(id));
        log.debug("Fetching customer: {}", id);

        Customer customer = ValidationGuard.check(
                ExistenceValidator.validate(customerRepository.findById(id), ENTITY_NAME, id));

        return customerMapper.toDto(customer);
    }

    /**
     * Create a customer. The repository assigns the identifier.
     */
    public CustomerDto createCustomer(CreateCustomerRequest request) {
        LocalDate today = LocalDate.now(clock);

        String fullName = ValidationGuard.check(FullNameValidator.validate(request.getFullName()));
        LocalDate dateOfBirth = ValidationGuard.check(DateOfBirthValidator.validate(request.getDateOfBirth(), today));
        List<AddressRequest> addresses = validateAddresses(request.getAddresses());

        LocalDateTime now = LocalDateTime.now(clock);
        Customer customer = Customer.builder()
                .fullName(fullName)
                .dateOfBirth(dateOfBirth)
                .age(AgeCalculator.calculate(dateOfBirth, today))
                .addresses(customerMapper.toAddresses(addresses))
                .createdAt(now)
                .updatedAt(now)
                .build();

        Customer created = customerRepository.create(customer);
        log.info("Created customer {} ({} addresses)", created.getId(), created.getAddresses().size());

        return customerMapper.toDto(created);
    }

    /**
     * Update the fields present in the request.
     *
     * A present address list replaces the stored one. Nothing is written when
     * no field actually changes.
     */
    public CustomerDto updateCustomer(Integer id, UpdateCustomerRequest request) {
        ValidationGuard.check(IdentifierValidator.validate(id, request.getCustomerIdentifier()));

        Customer current = ValidationGuard.check(
                ExistenceValidator.validate(customerRepository.findById(id), ENTITY_NAME, id));

        LocalDate today = LocalDate.now(clock);

        // Validate everything before touching the loaded record
        String fullName = null;
        if (request.getFullName() != null && !request.getFullName().equals(current.getFullName())) {
            fullName = ValidationGuard.check(FullNameValidator.validate(request.getFullName()));
        }

        LocalDate dateOfBirth = null;
        if (request.getDateOfBirth() != null) {
            dateOfBirth = ValidationGuard.check(DateOfBirthValidator.validate(request.getDateOfBirth(), today));
        }

        List<Address> addresses = null;
        if (request.getAddresses() != null) {
            addresses = customerMapper.toAddresses(validateAddresses(request.getAddresses()));
        }

        boolean isModified = false;

        if (fullName != null && !fullName.equals(current.getFullName())) {
            current.setFullName(fullName);
            isModified = true;
        }

        if (dateOfBirth != null && !dateOfBirth.equals(current.getDateOfBirth())) {
            current.setDateOfBirth(dateOfBirth);
            isModified = true;
        }

        if (addresses != null && !Objects.equals(addresses, current.getAddresses())) {
            current.setAddresses(addresses);
            isModified = true;
        }

        if (isModified) {
            current.setAge(AgeCalculator.calculate(current.getDateOfBirth(), today));
            current.setUpdatedAt(LocalDateTime.now(clock));
            customerRepository.update(current);
            log.info("Updated customer {}", id);
        } else {
            log.debug("No changes for customer {}, skipping update", id);
        }

        return customerMapper.toDto(current);
    }

    /**
     * Delete customer by identifier.
     */
    public DeletedCustomerDto deleteCustomer(Integer id) {
        ValidationGuard.check(IdentifierValidator.validate(id));
        ValidationGuard.check(ExistenceValidator.validate(customerRepository.findById(id), ENTITY_NAME, id));

        int deletedId = customerRepository.deleteById(id);
        log.info("Deleted customer {}", deletedId);

        return new DeletedCustomerDto(deletedId);
    }

    // Private helper methods

    private List<AddressRequest> validateAddresses(List<AddressRequest> addresses) {
        List<AddressRequest> validated = new ArrayList<>();
        if (addresses == null) {
            return validated;
        }

        for (AddressRequest address : addresses) {
            validated.add(ValidationGuard.check(AddressValidator.validate(address)));
        }
        return validated;
    }
}
