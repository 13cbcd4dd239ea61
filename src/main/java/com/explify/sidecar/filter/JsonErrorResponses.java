package com.explify.sidecar.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error bodies written by filters that reject a request before it reaches a controller. Same shape
 * as {@link com.explify.sidecar.exception.GlobalExceptionHandler}.
 */
final class JsonErrorResponses {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonErrorResponses() {
    }

    static void write(HttpServletResponse response, int status, String detail) throws IOException {
        write(response, status, detail, Map.of());
    }

    static void write(HttpServletResponse response, int status, String detail, Map<String, Object> extra) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("detail", detail);
        body.putAll(extra);
        body.put("timestamp", Instant.now().toString());
        response.setStatus(status);
        response.setContentType("application/json");
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(MAPPER.writeValueAsString(body));
    }
}
