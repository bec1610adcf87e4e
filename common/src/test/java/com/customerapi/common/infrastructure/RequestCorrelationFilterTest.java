package com.customerapi.common.infrastructure;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RequestCorrelationFilterTest {

    private final RequestCorrelationFilter filter = new RequestCorrelationFilter();

    @Test
    void resolveRequestId_ShouldKeepSafeIds() {
        assertEquals("req-123_abc.9", RequestCorrelationFilter.resolveRequestId("req-123_abc.9"));
    }

    @Test
    void resolveRequestId_ShouldReplaceMissingOrUnsafeIds() {
        for (String supplied : new String[]{null, "", "has space", "line\r\nbreak", "x".repeat(65)}) {
            String resolved = RequestCorrelationFilter.resolveRequestId(supplied);
            assertNotEquals(supplied, resolved);
            assertEquals(36, resolved.length());
        }
    }

    @Test
    void doFilter_ShouldExposeIdDuringRequestAndClearItAfterwards() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/customer/1");
        request.addHeader(RequestCorrelationFilter.HEADER, "trace-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInChain = new AtomicReference<>();
        FilterChain chain = (req, res) -> seenInChain.set(RequestCorrelationFilter.currentRequestId());

        filter.doFilter(request, response, chain);

        assertEquals("trace-42", seenInChain.get());
        assertEquals("trace-42", response.getHeader(RequestCorrelationFilter.HEADER));
        assertNull(RequestCorrelationFilter.currentRequestId());
    }

    @Test
    void doFilter_ShouldClearIdWhenChainFails() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/customer/1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        FilterChain chain = (req, res) -> {
            throw new IllegalStateException("boom");
        };

        assertThrows(IllegalStateException.class, () -> filter.doFilter(request, response, chain));
        assertNull(RequestCorrelationFilter.currentRequestId());
    }
}
