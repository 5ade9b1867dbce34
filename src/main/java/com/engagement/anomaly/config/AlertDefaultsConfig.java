package com.engagement.anomaly.config;

import com.engagement.anomaly.model.AlertConfig;
import com.engagement.anomaly.model.AlertThresholds;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "alerting")
public class AlertDefaultsConfig {

    // Recipient used for customers without a stored configuration
    private String systemAddress = "alerts@customerengagement.com";

    // Sender address on outgoing alert emails
    private String fromAddress = "alerts@customerengagement.com";

    // "email", "sms" or "whatsapp"
    private String channel = "email";

    private AlertThresholds thresholds = new AlertThresholds();

    /**
     * A fresh default configuration. Never shared, so cooldown state set on it is discarded.
     */
    public AlertConfig defaultAlertConfig() {
        return AlertConfig.builder()
                .enabled(true)
                .recipients(new ArrayList<>(List.of(systemAddress)))
                .thresholds(thresholds.toBuilder().build())
                .build();
    }
}
