package com.engagement.anomaly.web;

import com.engagement.anomaly.config.DetectionConfig;
import com.engagement.anomaly.config.MetricsConfig;
import com.engagement.anomaly.engine.throttle.RateLimiter;
import com.engagement.anomaly.model.AdmissionDecision;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rejects requests whose (client, path) bucket is empty with 429, before any validation
 * or cache lookup happens.
 */
public class ThrottleInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ThrottleInterceptor.class);

    private final RateLimiter rateLimiter;
    private final DetectionConfig detectionConfig;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper;

    public ThrottleInterceptor(RateLimiter rateLimiter,
                               DetectionConfig detectionConfig,
                               MetricsConfig metricsConfig,
                               ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.detectionConfig = detectionConfig;
        this.metricsConfig = metricsConfig;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        if (!detectionConfig.getThrottle().isEnabled() || CorsUtils.isPreFlightRequest(request)) {
            return true;
        }

        String clientIp = clientIp(request);
        String path = request.getRequestURI();
        AdmissionDecision decision = rateLimiter.tryAcquire(clientIp + ":" + path);
        if (decision.allowed()) {
            return true;
        }

        long retryAfter = Math.max(1L, (long) Math.ceil(decision.retryAfterSeconds()));
        metricsConfig.recordThrottled(routePattern(request));
        log.warn("Throttled client={} path={} retryAfter={}s", clientIp, path, retryAfter);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "rate_limited");
        body.put("detail", "Too many requests. Please try again later.");
        body.put("retry_after_seconds", decision.retryAfterSeconds());

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), body);
        return false;
    }

    /**
     * The matched mapping pattern, so path variables such as customer ids never become tag values.
     */
    static String routePattern(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern != null ? pattern.toString() : "unmatched";
    }

    /**
     * First hop of X-Forwarded-For when present, otherwise the socket peer.
     */
    static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return request.getRemoteAddr();
    }
}
