package com.forecastbench.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-ID";
    public static final String ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";
    public static final int MAX_LENGTH = 64;

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String provided = request.getHeader(HEADER);
        if (provided != null && provided.length() > MAX_LENGTH) {
            String generated = UUID.randomUUID().toString();
            request.setAttribute(ATTRIBUTE, generated);
            response.setHeader(HEADER, generated);
            writeError(response, request.getRequestURI(), generated,
                HEADER + " must be at most " + MAX_LENGTH + " characters, got " + provided.length());
            return;
        }
        String requestId = resolveRequestId(request);
        request.setAttribute(ATTRIBUTE, requestId);
        response.setHeader(HEADER, requestId);
        filterChain.doFilter(request, response);
    }

    public static String requestId(HttpServletRequest request) {
        Object attribute = request.getAttribute(ATTRIBUTE);
        return attribute != null ? attribute.toString() : resolveRequestId(request);
    }

    private static String resolveRequestId(HttpServletRequest request) {
        String existing = request.getHeader(HEADER);
        return (existing != null && !existing.isBlank() && existing.length() <= MAX_LENGTH)
            ? existing : UUID.randomUUID().toString();
    }

    private void writeError(HttpServletResponse response, String path, String requestId, String message)
            throws IOException {
        response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        Map<String, Object> body = Map.of(
                "status", HttpServletResponse.SC_BAD_REQUEST,
                "error", "Bad Request",
                "code", "INVALID_REQUEST_ID",
                "message", message,
                "path", path,
                "requestId", requestId,
                "timestamp", Instant.now().toString()
        );
        mapper.writeValue(response.getWriter(), body);
        log.warn("Request rejected | status=400 | path={} | requestId={} | reason={}", path, requestId, message);
    }
}
