package com.engagement.anomaly.service;

import com.engagement.anomaly.config.AlertDefaultsConfig;
import com.engagement.anomaly.config.MetricsConfig;
import com.engagement.anomaly.config.TwilioNotificationConfig;
import com.engagement.anomaly.model.NotificationResult;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Sends alerts as SMS or WhatsApp messages through Twilio, one message per recipient.
 * Recipients are phone numbers in E.164 format.
 */
@Service
@ConditionalOnExpression("'${alerting.channel:email}' == 'sms' or '${alerting.channel:email}' == 'whatsapp'")
public class TwilioNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationSender.class);

    private final TwilioNotificationConfig config;
    private final AlertDefaultsConfig alertDefaults;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationSender(TwilioNotificationConfig config,
                                    AlertDefaultsConfig alertDefaults,
                                    MetricsConfig metricsConfig) {
        this.config = config;
        this.alertDefaults = alertDefaults;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification sender initialized. Channel: {}", channel());
        } else {
            log.info("Twilio notification sender is DISABLED.");
        }
    }

    @Override
    public NotificationResult send(List<String> recipients, String subject, String body) {
        if (!config.isEnabled()) {
            metricsConfig.recordNotification(channel(), "unconfigured");
            return NotificationResult.failure("twilio transport not configured");
        }
        if (recipients == null || recipients.isEmpty()) {
            metricsConfig.recordNotification(channel(), "error");
            return NotificationResult.failure("no recipients");
        }

        String text = "[" + subject + "]\n" + body;
        try {
            PhoneNumber from = new PhoneNumber(resolveNumber(config.getFromNumber()));
            for (String recipient : recipients) {
                Message message = Message.creator(new PhoneNumber(resolveNumber(recipient)), from, text).create();
                log.info("Twilio alert sent to {}, sid={}", recipient, message.getSid());
            }
            metricsConfig.recordNotification(channel(), "success");
            return NotificationResult.success();
        } catch (Exception e) {
            metricsConfig.recordNotification(channel(), "error");
            log.error("Failed to send Twilio alert: {}", e.getMessage(), e);
            return NotificationResult.failure(e.getMessage());
        }
    }

    @Override
    public String channel() {
        return alertDefaults.getChannel().toLowerCase();
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equals(channel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
