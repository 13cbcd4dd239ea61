package com.explify.sidecar.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Gives every request an id that ties together its log lines, its request audit record and any
 * PHI access it causes.
 *
 * <p>The id comes from the client's {@code X-Request-Id} when it is well formed, otherwise from the
 * root of the load balancer's {@code X-Amzn-Trace-Id}, otherwise a fresh UUID. It is echoed on
 * the response, kept in the MDC for the request thread and stored as a request attribute so the
 * audit writers can copy it onto records written from another thread.</p>
 */
@Component
public class CorrelationIdFilter extends OncePerRequestFilter {
    public static final String HEADER_NAME = "X-Request-Id";
    public static final String TRACE_HEADER_NAME = "X-Amzn-Trace-Id";
    public static final String MDC_KEY = "requestId";
    public static final String REQUEST_ID_ATTRIBUTE = "explify.requestId";
    private static final Pattern CLIENT_REQUEST_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final Pattern TRACE_ROOT = Pattern.compile("(?:^|;)Root=(1-[0-9a-f]{8}-[0-9a-f]{24})(?:;|$)");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain) throws ServletException, IOException {
        String requestId = resolveRequestId(request);
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(HEADER_NAME, requestId);
        MDC.put(MDC_KEY, requestId);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    /**
     * @return the id assigned to this request, or null when the request did not pass this filter
     */
    public static String requestId(HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        Object attribute = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        return attribute instanceof String ? (String)attribute : null;
    }

    static String resolveRequestId(HttpServletRequest request) {
        String clientId = request.getHeader(HEADER_NAME);
        if (clientId != null && CLIENT_REQUEST_ID.matcher(clientId).matches()) {
            return clientId;
        }
        String trace = request.getHeader(TRACE_HEADER_NAME);
        if (trace != null) {
            Matcher root = TRACE_ROOT.matcher(trace.trim());
            if (root.find()) {
                return root.group(1);
            }
        }
        return UUID.randomUUID().toString();
    }
}
