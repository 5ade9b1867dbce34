package com.engagement.anomaly.config;

import com.engagement.anomaly.engine.throttle.RateLimiter;
import com.engagement.anomaly.web.ApiKeyInterceptor;
import com.engagement.anomaly.web.SecurityHeadersInterceptor;
import com.engagement.anomaly.web.ThrottleInterceptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final RateLimiter rateLimiter;
    private final DetectionConfig detectionConfig;
    private final SecurityConfig securityConfig;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper;

    public WebConfig(RateLimiter rateLimiter,
                     DetectionConfig detectionConfig,
                     SecurityConfig securityConfig,
                     MetricsConfig metricsConfig,
                     ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.detectionConfig = detectionConfig;
        this.securityConfig = securityConfig;
        this.metricsConfig = metricsConfig;
        this.objectMapper = objectMapper;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new SecurityHeadersInterceptor())
                .addPathPatterns("/api/**")
                .order(0);
        // Throttling runs before the key check so rejected clients never reach it or the scorer
        registry.addInterceptor(new ThrottleInterceptor(rateLimiter, detectionConfig, metricsConfig, objectMapper))
                .addPathPatterns("/api/**")
                .order(1);
        registry.addInterceptor(new ApiKeyInterceptor(securityConfig, objectMapper))
                .addPathPatterns("/api/v1/alerts/**", "/api/v1/metrics/**")
                .order(2);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(securityConfig.getAllowedOrigins().toArray(new String[0]))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(false)
                .maxAge(3600);
    }
}
