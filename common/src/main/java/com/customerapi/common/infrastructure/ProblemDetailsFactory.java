package com.customerapi.common.infrastructure;

import com.customerapi.common.dto.ProblemDetailsDto;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;

/**
 * Builds the error body shared by the exception handler and the security layer.
 */
public final class ProblemDetailsFactory {

    private static final String ERROR_CODE_PREFIX = "CUSTOMER_ERR_";

    private ProblemDetailsFactory() {
        // Utility class - no instantiation
    }

    public static ProblemDetailsDto create(HttpStatus status, String detail, String errorCode, String field) {
        return ProblemDetailsDto.builder()
                .status(status.value())
                .title(status.getReasonPhrase())
                .detail(detail)
                .errorCode(errorCode != null ? errorCode : errorCode(status))
                .field(field)
                .requestId(RequestCorrelationFilter.currentRequestId())
                .timestamp(LocalDateTime.now())
                .build();
    }

    public static String errorCode(HttpStatus status) {
        return ERROR_CODE_PREFIX + status.value();
    }
}
