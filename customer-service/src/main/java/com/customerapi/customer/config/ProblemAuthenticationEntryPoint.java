package com.customerapi.customer.config;

import com.customerapi.common.dto.ProblemDetailsDto;
import com.customerapi.common.infrastructure.ProblemDetailsFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;

/**
 * Answers unauthenticated calls with 401, the bearer challenge header and the
 * same problem body as every other error.
 */
@Slf4j
@RequiredArgsConstructor
public class ProblemAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final AuthenticationEntryPoint challenge = new BearerTokenAuthenticationEntryPoint();
    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException, ServletException {
        log.warn("Unauthenticated request to {}: {}", request.getRequestURI(), authException.getMessage());

        // Sets 401 and WWW-Authenticate
        challenge.commence(request, response, authException);

        ProblemDetailsDto body = ProblemDetailsFactory.create(HttpStatus.UNAUTHORIZED,
                "Authentication is required to access this resource", null, null);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
