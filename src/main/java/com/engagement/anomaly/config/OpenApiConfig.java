package com.engagement.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI engagementAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Engagement Anomaly API")
                        .version("1.0.0")
                        .description(
                                "Anomaly detection and alerting for customer engagement score series.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Admission check: per-client token bucket (`429` with `Retry-After` when exhausted)\n" +
                                "2. Validate the series via `POST /detect` (1-1000 points, non-negative scores, ISO dates)\n" +
                                "3. Result cache lookup by series fingerprint (5 minute TTL)\n" +
                                "4. On miss: extract rolling features and fit a seeded Isolation Forest on the batch\n" +
                                "5. With `customer_id`: evaluate alert thresholds, cooldown, and notify recipients\n\n" +
                                "**Alert Severity:**\n" +
                                "- `warning`: anomaly fraction at or above the warning threshold (default 15%)\n" +
                                "- `critical`: anomaly fraction at or above the critical threshold (default 30%)\n\n" +
                                "Alert configuration, history and metrics routes require the `X-API-Key` header.")
                        .contact(new Contact().name("Engagement Analytics Team")));
    }
}
