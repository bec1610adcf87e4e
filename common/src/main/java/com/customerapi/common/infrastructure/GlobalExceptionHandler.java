package com.customerapi.common.infrastructure;

import com.customerapi.common.dto.ProblemDetailsDto;
import com.customerapi.common.exception.BadInputException;
import com.customerapi.common.exception.CustomerApiException;
import com.customerapi.common.exception.NotFoundException;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for all services.
 * Converts exceptions to standardized problem-details responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Check if the response has already been committed (body already written).
     * If committed, we should not attempt to write another response.
     */
    private boolean isResponseCommitted() {
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs != null) {
            HttpServletResponse response = attrs.getResponse();
            return response != null && response.isCommitted();
        }
        return false;
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ProblemDetailsDto> handleNotFound(NotFoundException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.warn("Resource not found: {}", ex.getMessage());
        return problem(ex.getStatus(), ex.getMessage(), ex.getErrorCode(), ex.getField());
    }

    @ExceptionHandler(BadInputException.class)
    public ResponseEntity<ProblemDetailsDto> handleBadInput(BadInputException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.warn("Validation error on '{}': {}", ex.getField(), ex.getMessage());
        return problem(ex.getStatus(), ex.getMessage(), ex.getErrorCode(), ex.getField());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetailsDto> handleUnreadableBody(HttpMessageNotReadableException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for unreadable body");
            return null;
        }
        log.warn("Malformed request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Request body is missing or is not valid JSON", "CUSTOMER_ERR_400", null);
    }

    /** Handle type conversion errors (e.g., non-numeric identifier) */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetailsDto> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for parameter '{}'", ex.getName());
            return null;
        }
        log.warn("Type conversion failed for parameter '{}': {}", ex.getName(), ex.getMessage());
        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        return problem(HttpStatus.BAD_REQUEST,
                String.format("Invalid format for parameter '%s'. Expected type: %s", ex.getName(), expected),
                "CUSTOMER_ERR_400", ex.getName());
    }

    @ExceptionHandler(CustomerApiException.class)
    public ResponseEntity<ProblemDetailsDto> handleCustomerApiException(CustomerApiException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.error("Application error: {}", ex.getMessage(), ex);
        if (ex.getStatus().is5xxServerError()) {
            return problem(ex.getStatus(), "An unexpected error occurred", ex.getErrorCode(), null);
        }
        return problem(ex.getStatus(), ex.getMessage(), ex.getErrorCode(), ex.getField());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetailsDto> handleGeneric(Exception ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error. Original exception: {}", ex.getMessage(), ex);
            return null;
        }
        // Framework errors (unknown route, wrong method, missing parameter) keep their own status
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatus status = HttpStatus.resolve(errorResponse.getStatusCode().value());
            if (status != null && status.is4xxClientError()) {
                log.warn("Request rejected: {}", ex.getMessage());
                return problem(status, ex.getMessage(), ProblemDetailsFactory.errorCode(status), null);
            }
        }
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "CUSTOMER_ERR_500", null);
    }

    private ResponseEntity<ProblemDetailsDto> problem(HttpStatus status, String detail, String errorCode, String field) {
        return ResponseEntity.status(status).body(ProblemDetailsFactory.create(status, detail, errorCode, field));
    }
}
