package com.customerapi.common.infrastructure;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Owns the request id of every call.
 *
 * A caller-supplied X-Request-Id is reused only when it is a short token of
 * safe characters, so it can be echoed into headers, logs and error bodies
 * as is. Anything else is replaced by a fresh UUID.
 *
 * The id is available through {@link #currentRequestId()} for the whole
 * request, including security failures raised before any controller runs.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_KEY = "requestId";

    private static final Pattern SAFE_REQUEST_ID = Pattern.compile("^[A-Za-z0-9._\\-]{1,64}$");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws IOException, ServletException {
        String requestId = resolveRequestId(request.getHeader(HEADER));
        MDC.put(MDC_KEY, requestId);
        response.setHeader(HEADER, requestId);

        long started = System.currentTimeMillis();
        try {
            filterChain.doFilter(request, response);
        } finally {
            logAccess(request, response.getStatus(), System.currentTimeMillis() - started);
            MDC.remove(MDC_KEY);
        }
    }

    /**
     * Request id of the call being served on this thread, or null outside a request.
     */
    public static String currentRequestId() {
        return MDC.get(MDC_KEY);
    }

    static String resolveRequestId(String supplied) {
        if (supplied != null && SAFE_REQUEST_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }

    // Query strings are left out: they can carry personal data
    private static void logAccess(HttpServletRequest request, int status, long durationMs) {
        if (status >= 500) {
            log.warn("{} {} -> {} ({}ms)", request.getMethod(), request.getRequestURI(), status, durationMs);
        } else {
            log.info("{} {} -> {} ({}ms)", request.getMethod(), request.getRequestURI(), status, durationMs);
        }
    }
}
