package com.engagement.anomaly.service;

import com.engagement.anomaly.config.AlertDefaultsConfig;
import com.engagement.anomaly.model.AlertConfig;
import com.engagement.anomaly.model.AlertThresholds;
import com.engagement.anomaly.model.FieldViolation;
import com.engagement.anomaly.repository.AlertConfigRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the per-customer alert configurations. The in-memory map is authoritative;
 * every change is written through to the key-value store.
 */
@Service
public class AlertConfigService {

    private static final Logger log = LoggerFactory.getLogger(AlertConfigService.class);

    private final AlertConfigRepository repository;
    private final AlertDefaultsConfig alertDefaults;
    private final Map<String, AlertConfig> configs = new ConcurrentHashMap<>();
    private final Object persistLock = new Object();

    public AlertConfigService(AlertConfigRepository repository, AlertDefaultsConfig alertDefaults) {
        this.repository = repository;
        this.alertDefaults = alertDefaults;
    }

    @PostConstruct
    public void load() {
        configs.putAll(repository.loadAll());
        log.info("Alert config service ready with {} customer configs", configs.size());
    }

    /**
     * The stored configuration for a customer, if one was ever set.
     */
    public Optional<AlertConfig> findStored(String customerId) {
        AlertConfig config = configs.get(customerId);
        return config == null ? Optional.empty() : Optional.of(config.copy());
    }

    /**
     * The stored configuration, or a fresh copy of the system default.
     */
    public AlertConfig getEffectiveConfig(String customerId) {
        return findStored(customerId).orElseGet(alertDefaults::defaultAlertConfig);
    }

    public Optional<FieldViolation> validate(AlertConfig config) {
        if (config == null) {
            return Optional.of(new FieldViolation("body", "alert config is required"));
        }
        AlertThresholds t = config.getThresholds();
        if (t == null) {
            return Optional.of(new FieldViolation("thresholds", "thresholds are required"));
        }
        if (t.getWarningThreshold() < 0 || t.getWarningThreshold() > 1) {
            return Optional.of(new FieldViolation("warning_threshold", "warning_threshold must be in [0, 1]"));
        }
        if (t.getCriticalThreshold() < 0 || t.getCriticalThreshold() > 1) {
            return Optional.of(new FieldViolation("critical_threshold", "critical_threshold must be in [0, 1]"));
        }
        if (t.getWarningThreshold() > t.getCriticalThreshold()) {
            return Optional.of(new FieldViolation("warning_threshold",
                    "warning_threshold must not exceed critical_threshold"));
        }
        if (t.getMinAnomalyPoints() < 0) {
            return Optional.of(new FieldViolation("min_anomaly_points", "min_anomaly_points must be >= 0"));
        }
        if (t.getCooldownMinutes() < 0) {
            return Optional.of(new FieldViolation("cooldown_minutes", "cooldown_minutes must be >= 0"));
        }
        if (config.isEnabled() && (config.getRecipients() == null || config.getRecipients().isEmpty())) {
            return Optional.of(new FieldViolation("email_recipients",
                    "at least one recipient is required while alerts are enabled"));
        }
        return Optional.empty();
    }

    /**
     * Stores a validated configuration. A request without last_alert_time keeps the
     * customer's current cooldown state; the merge is atomic with {@link #recordAlert}.
     */
    public AlertConfig updateConfig(String customerId, AlertConfig config) {
        AlertConfig incoming = config.copy();
        AlertConfig stored = configs.compute(customerId, (id, previous) -> {
            if (incoming.getLastAlertTime() == null && previous != null) {
                incoming.setLastAlertTime(previous.getLastAlertTime());
            }
            return incoming;
        });
        persist(customerId);
        log.info("Alert config updated for customer={}", customerId);
        return stored.copy();
    }

    /**
     * Sets last_alert_time on a stored configuration. Customers on the default
     * configuration have nothing stored and are left untouched.
     */
    public boolean recordAlert(String customerId, long alertTimeMillis) {
        AlertConfig updated = configs.computeIfPresent(customerId, (id, config) -> {
            AlertConfig next = config.copy();
            next.setLastAlertTime(alertTimeMillis);
            return next;
        });
        if (updated == null) {
            return false;
        }
        persist(customerId);
        return true;
    }

    public int storedCount() {
        return configs.size();
    }

    // Writes the customer's latest in-memory state; serialized so an older value never lands last
    private void persist(String customerId) {
        synchronized (persistLock) {
            AlertConfig current = configs.get(customerId);
            if (current != null && !repository.saveAll(Map.of(customerId, current.copy()))) {
                log.warn("Alert config for customer={} not persisted; in-memory state remains authoritative",
                        customerId);
            }
        }
    }
}
