package com.engagement.anomaly.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adds the standard hardening headers to every API response, including throttled and rejected ones.
 */
public class SecurityHeadersInterceptor implements HandlerInterceptor {

    static final Map<String, String> HEADERS = new LinkedHashMap<>();

    static {
        HEADERS.put("X-Content-Type-Options", "nosniff");
        HEADERS.put("X-Frame-Options", "DENY");
        HEADERS.put("X-XSS-Protection", "1; mode=block");
        HEADERS.put("Strict-Transport-Security", "max-age=31536000; includeSubDomains");
        HEADERS.put("Content-Security-Policy", "default-src 'self'");
        HEADERS.put("Referrer-Policy", "strict-origin-when-cross-origin");
        HEADERS.put("Permissions-Policy", "camera=(), microphone=(), geolocation=()");
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        HEADERS.forEach(response::setHeader);
        return true;
    }
}
