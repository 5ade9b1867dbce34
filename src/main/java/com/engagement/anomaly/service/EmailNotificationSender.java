package com.engagement.anomaly.service;

import com.engagement.anomaly.config.AlertDefaultsConfig;
import com.engagement.anomaly.config.MetricsConfig;
import com.engagement.anomaly.model.NotificationResult;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Sends alerts as plain-text email through the Spring Boot mail transport
 * ({@code spring.mail.*}). Without a configured transport every send fails.
 */
@Service
@ConditionalOnProperty(prefix = "alerting", name = "channel", havingValue = "email", matchIfMissing = true)
public class EmailNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(EmailNotificationSender.class);

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final AlertDefaultsConfig alertDefaults;
    private final MetricsConfig metricsConfig;

    public EmailNotificationSender(ObjectProvider<JavaMailSender> mailSenderProvider,
                                   AlertDefaultsConfig alertDefaults,
                                   MetricsConfig metricsConfig) {
        this.mailSenderProvider = mailSenderProvider;
        this.alertDefaults = alertDefaults;
        this.metricsConfig = metricsConfig;
    }

    @Override
    public NotificationResult send(List<String> recipients, String subject, String body) {
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            log.warn("Mail transport not configured. Alert '{}' not sent.", subject);
            metricsConfig.recordNotification(channel(), "unconfigured");
            return NotificationResult.failure("mail transport not configured");
        }
        if (recipients == null || recipients.isEmpty()) {
            metricsConfig.recordNotification(channel(), "error");
            return NotificationResult.failure("no recipients");
        }

        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, "UTF-8");
            helper.setFrom(alertDefaults.getFromAddress());
            helper.setTo(recipients.toArray(new String[0]));
            helper.setSubject(subject);
            helper.setText(body, false);

            mailSender.send(message);

            metricsConfig.recordNotification(channel(), "success");
            log.info("Alert email sent to {}", recipients);
            return NotificationResult.success();
        } catch (Exception e) {
            metricsConfig.recordNotification(channel(), "error");
            log.error("Failed to send alert email to {}: {}", recipients, e.getMessage(), e);
            return NotificationResult.failure(e.getMessage());
        }
    }

    @Override
    public String channel() {
        return "email";
    }
}
