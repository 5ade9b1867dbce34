package com.engagement.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "security")
public class SecurityConfig {

    // Shared key expected in X-API-Key on alert and metrics routes. Blank disables the check.
    private String apiKey;

    private List<String> allowedOrigins = List.of("http://localhost:5173");
}
