package com.customerapi.customer.controller;

import com.customerapi.common.dto.PagingDto;
import com.customerapi.common.dto.ProblemDetailsDto;
import com.customerapi.common.dto.customer.CreateCustomerRequest;
import com.customerapi.common.dto.customer.CustomerDto;
import com.customerapi.common.dto.customer.DeletedCustomerDto;
import com.customerapi.common.dto.customer.UpdateCustomerRequest;
import com.customerapi.customer.config.OpenApiConfig;
import com.customerapi.customer.service.CustomerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for customer records.
 *
 * IMPORTANT: Controllers contain NO business logic.
 * All logic is delegated to CustomerService.
 */
@RestController
@RequestMapping(value = "/api/customer", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Tag(name = "Customers", description = "Customer record management")
@SecurityRequirement(name = OpenApiConfig.SECURITY_SCHEME)
@ApiResponse(responseCode = "401", description = "Caller is not authenticated")
@ApiResponse(responseCode = "500", description = "Unexpected error",
        content = @Content(schema = @Schema(implementation = ProblemDetailsDto.class)))
public class CustomerController {

    private final CustomerService customerService;

    @GetMapping
    @Operation(summary = "Get a page of customers")
    @ApiResponse(responseCode = "200", description = "Page of customers")
    @ApiResponse(responseCode = "400", description = "Invalid paging or sort parameters",
            content = @Content(schema = @Schema(implementation = ProblemDetailsDto.class)))
    public ResponseEntity<PagingDto<CustomerDto>> getCustomers(
            @Parameter(description = "1-based page index") @RequestParam(required = false) Integer pageIndex,
            @Parameter(description = "Records per page") @RequestParam(required = false) Integer pageSize,
            @Parameter(description = "id, fullName, dateOfBirth, age or createdAt") @RequestParam(required = false) String sortField,
            @Parameter(description = "asc or desc") @RequestParam(required = false) String sortDirection) {
        PagingDto<CustomerDto> page = customerService.getCustomers(pageIndex, pageSize, sortField, sortDirection);
        return ResponseEntity.ok(page);
    }

    @GetMapping("/{customerId}")
    @Operation(summary = "Get customer by identifier")
    @ApiResponse(responseCode = "200", description = "Customer found")
    @ApiResponse(responseCode = "400", description = "Invalid identifier",
            content = @Content(schema = @Schema(implementation = ProblemDetailsDto.class)))
    @ApiResponse(responseCode = "404", description = "Customer not found",
            content = @Content(schema = @Schema(implementation = ProblemDetailsDto.class)))
    public ResponseEntity<CustomerDto> getCustomer(@PathVariable Integer customerId) {
        CustomerDto customer = customerService.getCustomer(customerId);
        return ResponseEntity.ok(customer);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create a customer")
    @ApiResponse(responseCode = "200", description = "Customer created")
    @ApiResponse(responseCode = "400", description = "Invalid customer data",
            content = @Content(schema = @Schema(implementation = ProblemDetailsDto.class)))
    public ResponseEntity<CustomerDto> createCustomer(@RequestBody CreateCustomerRequest request) {
        CustomerDto created = customerService.createCustomer(request);
        return ResponseEntity.ok(created);
    }

    @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update the fields present in the request")
    @ApiResponse(responseCode = "200", description = "Customer after the update")
    @ApiResponse(responseCode = "400", description = "Invalid customer data or identifier mismatch",
            content = @Content(schema = @Schema(implementation = ProblemDetailsDto.class)))
    @ApiResponse(responseCode = "404", description = "Customer not found",
            content = @Content(schema = @Schema(implementation = ProblemDetailsDto.class)))
    public ResponseEntity<CustomerDto> updateCustomer(
            @PathVariable Integer id,
            @RequestBody UpdateCustomerRequest request) {
        CustomerDto updated = customerService.updateCustomer(id, request);
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a customer")
    @ApiResponse(responseCode = "200", description = "Identifier of the deleted customer")
    @ApiResponse(responseCode = "400", description = "Invalid identifier",
            content = @Content(schema = @Schema(implementation = ProblemDetailsDto.class)))
    @ApiResponse(responseCode = "404", description = "Customer not found",
            content = @Content(schema = @Schema(implementation = ProblemDetailsDto.class)))
    public ResponseEntity<DeletedCustomerDto> deleteCustomer(@PathVariable Integer id) {
        DeletedCustomerDto deleted = customerService.deleteCustomer(id);
        return ResponseEntity.ok(deleted);
    }
}
