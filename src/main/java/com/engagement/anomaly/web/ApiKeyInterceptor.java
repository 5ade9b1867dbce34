package com.engagement.anomaly.web;

import com.engagement.anomaly.config.SecurityConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared-key gate for the alert and metrics routes. A blank configured key turns the check off.
 */
public class ApiKeyInterceptor implements HandlerInterceptor {

    public static final String HEADER = "X-API-Key";

    private static final Logger log = LoggerFactory.getLogger(ApiKeyInterceptor.class);

    private final SecurityConfig securityConfig;
    private final ObjectMapper objectMapper;

    public ApiKeyInterceptor(SecurityConfig securityConfig, ObjectMapper objectMapper) {
        this.securityConfig = securityConfig;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        String expected = securityConfig.getApiKey();
        if (expected == null || expected.isBlank() || CorsUtils.isPreFlightRequest(request)) {
            return true;
        }

        String provided = request.getHeader(HEADER);
        if (provided != null && MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
            return true;
        }

        log.warn("Rejected {} {} from {}: invalid API key",
                request.getMethod(), request.getRequestURI(), request.getRemoteAddr());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "forbidden");
        body.put("detail", "Could not validate API key");

        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), body);
        return false;
    }
}
