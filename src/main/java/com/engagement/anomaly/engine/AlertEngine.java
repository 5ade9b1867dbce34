package com.engagement.anomaly.engine;

import com.engagement.anomaly.config.MetricsConfig;
import com.engagement.anomaly.model.AlertConfig;
import com.engagement.anomaly.model.AlertDecision;
import com.engagement.anomaly.model.AlertRecord;
import com.engagement.anomaly.model.AlertSeverity;
import com.engagement.anomaly.model.AlertThresholds;
import com.engagement.anomaly.model.DetectionMetadata;
import com.engagement.anomaly.model.DetectionResult;
import com.engagement.anomaly.model.NotificationResult;
import com.engagement.anomaly.model.SuppressionReason;
import com.engagement.anomaly.repository.AlertHistoryRepository;
import com.engagement.anomaly.service.AlertConfigService;
import com.engagement.anomaly.service.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides whether a detection result warrants a notification for a customer.
 *
 * Checks run in a fixed order and the first one that applies wins:
 * disabled, cooldown, too few anomalous points, below the warning threshold.
 * Evaluations for the same customer are serialized, including the dispatch, so two
 * concurrent requests cannot both pass the cooldown check.
 */
@Component
public class AlertEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertEngine.class);

    private final AlertConfigService configService;
    private final NotificationSender notificationSender;
    private final AlertHistoryRepository historyRepository;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final ConcurrentMap<String, ReentrantLock> customerLocks = new ConcurrentHashMap<>();

    public AlertEngine(AlertConfigService configService,
                       NotificationSender notificationSender,
                       AlertHistoryRepository historyRepository,
                       MetricsConfig metricsConfig,
                       Clock clock) {
        this.configService = configService;
        this.notificationSender = notificationSender;
        this.historyRepository = historyRepository;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public AlertDecision evaluate(String customerId, DetectionResult result) {
        ReentrantLock lock = customerLocks.computeIfAbsent(customerId, k -> new ReentrantLock());
        lock.lock();
        try {
            AlertDecision decision = decide(customerId, result);
            if (decision.isSent()) {
                metricsConfig.recordAlertSent(decision.getSeverity().label());
            } else {
                metricsConfig.recordAlertSuppressed(decision.getReason().label());
            }
            return decision;
        } finally {
            lock.unlock();
        }
    }

    private AlertDecision decide(String customerId, DetectionResult result) {
        long now = clock.millis();
        AlertConfig config = configService.getEffectiveConfig(customerId);
        AlertThresholds thresholds = config.getThresholds();
        DetectionMetadata metadata = result.getMetadata();

        if (!config.isEnabled()) {
            return AlertDecision.suppressed(SuppressionReason.DISABLED, "Alerts disabled for customer", now);
        }

        Long lastAlert = config.getLastAlertTime();
        if (lastAlert != null && now - lastAlert < thresholds.cooldown().toMillis()) {
            return AlertDecision.suppressed(SuppressionReason.COOLDOWN, "Alert cooldown period active", now);
        }

        if (metadata.getAnomalyCount() < thresholds.getMinAnomalyPoints()) {
            return AlertDecision.suppressed(SuppressionReason.INSUFFICIENT_POINTS,
                    "Not enough anomaly points to trigger alert", now);
        }

        double fraction = metadata.getAnomalyPercentage() / 100.0;
        AlertSeverity severity = AlertSeverity.fromFraction(fraction, thresholds);
        if (severity == AlertSeverity.NONE) {
            return AlertDecision.suppressed(SuppressionReason.BELOW_THRESHOLD, "No alert conditions met", now);
        }

        NotificationResult delivery = notificationSender.send(config.getRecipients(),
                subject(severity, customerId), body(severity, customerId, metadata));

        if (!delivery.delivered()) {
            log.warn("Alert for customer={} suppressed, delivery failed: {}", customerId, delivery.reason());
            return AlertDecision.suppressed(SuppressionReason.DELIVERY_FAILED, severity,
                    "Failed to send alert: " + delivery.reason(), now);
        }

        historyRepository.append(AlertRecord.builder()
                .customerId(customerId)
                .severity(severity)
                .timestamp(now)
                .details(metadata)
                .build());
        configService.recordAlert(customerId, now);

        log.info("{} alert sent for customer={} ({}% anomalous)",
                severity.name(), customerId, metadata.getAnomalyPercentage());
        return AlertDecision.sent(severity, now);
    }

    static String subject(AlertSeverity severity, String customerId) {
        return severity.name() + " Alert: Anomaly Detection for Customer " + customerId;
    }

    static String body(AlertSeverity severity, String customerId, DetectionMetadata metadata) {
        return String.format(Locale.ROOT,
                "Anomaly Alert Details:\n" +
                "---------------------\n" +
                "Severity: %s\n" +
                "Customer ID: %s\n" +
                "Anomaly Percentage: %.2f%%\n" +
                "Number of Anomalies: %d\n" +
                "Total Data Points: %d\n" +
                "Mean Score: %s\n" +
                "Standard Deviation: %s\n" +
                "Detected at: %s\n\n" +
                "Please review the customer engagement dashboard for more details.\n",
                severity.name(),
                customerId,
                metadata.getAnomalyPercentage(),
                metadata.getAnomalyCount(),
                metadata.getTotalPoints(),
                metadata.getMeanScore(),
                metadata.getStdScore(),
                metadata.getProcessedAt());
    }
}
