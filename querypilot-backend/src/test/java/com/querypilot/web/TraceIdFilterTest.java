package com.querypilot.web;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    void incomingTraceIdIsEchoedAndVisibleDuringTheRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/v1/ask");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "abc-123.x_y");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(MDC.get(TraceIdFilter.MDC_TRACE_ID)));

        assertThat(seen.get()).isEqualTo("abc-123.x_y");
        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isEqualTo("abc-123.x_y");
        assertThat(MDC.get(TraceIdFilter.MDC_TRACE_ID)).isNull();
    }

    @Test
    void unsafeTraceIdIsReplaced() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/health");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "bad id\r\ninjected");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER))
                .isNotEqualTo("bad id\r\ninjected")
                .matches("[0-9a-f-]{36}");
    }

    @Test
    void missingTraceIdIsGenerated() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/v1/health"), response, (req, res) -> { });

        assertThat(response.getHeader(TraceIdFilter.TRACE_ID_HEADER)).isNotBlank();
    }

    @Test
    void mdcIsClearedWhenTheChainFails() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/health");

        assertThatThrownBy(() -> filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> {
            throw new IllegalStateException("boom");
        })).hasMessage("boom");

        assertThat(MDC.get(TraceIdFilter.MDC_TRACE_ID)).isNull();
    }
}
