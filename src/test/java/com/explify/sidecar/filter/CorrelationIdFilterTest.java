package com.explify.sidecar.filter;

import static org.junit.jupiter.api.Assertions.*;

import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void echoesCallerSuppliedRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        request.addHeader(CorrelationIdFilter.HEADER_NAME, "desktop-7f3a.1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> inHandler = new AtomicReference<>();
        FilterChain chain = (req, res) -> inHandler.set(MDC.get(CorrelationIdFilter.MDC_KEY));

        this.filter.doFilter(request, response, chain);

        assertEquals("desktop-7f3a.1", inHandler.get());
        assertEquals("desktop-7f3a.1", response.getHeader(CorrelationIdFilter.HEADER_NAME));
        assertNull(MDC.get(CorrelationIdFilter.MDC_KEY));
    }

    @Test
    void generatesIdWhenHeaderIsUnsafe() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        request.addHeader(CorrelationIdFilter.HEADER_NAME, "id\r\nSet-Cookie: x");
        MockHttpServletResponse response = new MockHttpServletResponse();

        this.filter.doFilter(request, response, (req, res) -> { });

        String header = response.getHeader(CorrelationIdFilter.HEADER_NAME);
        assertNotNull(header);
        assertTrue(header.matches("^[0-9a-f\\-]{36}$"), header);
    }

    @Test
    void fallsBackToLoadBalancerTraceRoot() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/history");
        request.addHeader(CorrelationIdFilter.TRACE_HEADER_NAME, "Self=1-67891234-12456789abcdef012345678;Root=1-67891233-abcdef012345678912345678");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> attribute = new AtomicReference<>();

        this.filter.doFilter(request, response, (req, res) -> attribute.set(CorrelationIdFilter.requestId(request)));

        assertEquals("1-67891233-abcdef012345678912345678", response.getHeader(CorrelationIdFilter.HEADER_NAME));
        assertEquals("1-67891233-abcdef012345678912345678", attribute.get());
    }

    @Test
    void callerIdWinsOverTraceHeader() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/history");
        request.addHeader(CorrelationIdFilter.HEADER_NAME, "desktop-7f3a.1");
        request.addHeader(CorrelationIdFilter.TRACE_HEADER_NAME, "Root=1-67891233-abcdef012345678912345678");
        MockHttpServletResponse response = new MockHttpServletResponse();

        this.filter.doFilter(request, response, (req, res) -> { });

        assertEquals("desktop-7f3a.1", response.getHeader(CorrelationIdFilter.HEADER_NAME));
    }

    @Test
    void malformedTraceHeaderIsIgnored() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/history");
        request.addHeader(CorrelationIdFilter.TRACE_HEADER_NAME, "Root=not-a-trace");
        MockHttpServletResponse response = new MockHttpServletResponse();

        this.filter.doFilter(request, response, (req, res) -> { });

        assertTrue(response.getHeader(CorrelationIdFilter.HEADER_NAME).matches("^[0-9a-f\\-]{36}$"));
    }

    @Test
    void requestsOutsideTheFilterHaveNoId() {
        assertNull(CorrelationIdFilter.requestId(new MockHttpServletRequest("GET", "/health")));
        assertNull(CorrelationIdFilter.requestId(null));
    }
}
