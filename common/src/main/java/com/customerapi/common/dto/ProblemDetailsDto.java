package com.customerapi.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Error body returned for every non-2xx response produced by the API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProblemDetailsDto {

    private int status;
    private String title;
    private String detail;
    private String errorCode;
    private String field;           // offending request field, if known
    private String requestId;
    private LocalDateTime timestamp;
}
