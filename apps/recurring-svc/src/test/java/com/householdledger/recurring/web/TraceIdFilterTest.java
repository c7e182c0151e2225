package com.householdledger.recurring.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    void propagatesIncomingTraceIdForTheRequestOnly() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/recurring");
        request.addHeader(TraceIdFilter.TRACE_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenTraceId = new AtomicReference<>();
        AtomicReference<String> seenMdc = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> {
            seenTraceId.set(RequestContextHolder.traceId().orElse(null));
            seenMdc.set(MDC.get(TraceIdFilter.MDC_KEY));
        });

        assertThat(seenTraceId.get()).isEqualTo("abc-123");
        assertThat(seenMdc.get()).isEqualTo("abc-123");
        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo("abc-123");
        assertThat(RequestContextHolder.traceId()).isEmpty();
        assertThat(MDC.get(TraceIdFilter.MDC_KEY)).isNull();
    }

    @Test
    void generatesTraceIdWhenHeaderMissing() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/recurring"), response, (req, res) -> { });

        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isNotBlank();
    }
}
