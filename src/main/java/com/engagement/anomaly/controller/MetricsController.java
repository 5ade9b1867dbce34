package com.engagement.anomaly.controller;

import com.engagement.anomaly.config.MetricsConfig;
import com.engagement.anomaly.model.AlertSeverity;
import com.engagement.anomaly.repository.DetectionResultCache;
import com.engagement.anomaly.service.AlertConfigService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/metrics")
@Tag(name = "Metrics", description = "Service counters for dashboards")
public class MetricsController {

    private final MetricsConfig metricsConfig;
    private final DetectionResultCache cache;
    private final AlertConfigService configService;
    private final Clock clock;
    private final Instant startedAt;

    public MetricsController(MetricsConfig metricsConfig,
                             DetectionResultCache cache,
                             AlertConfigService configService,
                             Clock clock) {
        this.metricsConfig = metricsConfig;
        this.cache = cache;
        this.configService = configService;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @Operation(summary = "Summary of cache, detection, alert and throttling counters")
    @GetMapping("/summary")
    public ResponseEntity<Map<String, Object>> summary() {
        long hits = metricsConfig.cacheHitCount();
        long misses = metricsConfig.cacheMissCount();
        double hitRatio = Math.round(hits * 10000.0 / Math.max(1, hits + misses)) / 100.0;

        Map<String, Object> cachePerformance = new LinkedHashMap<>();
        cachePerformance.put("hits", hits);
        cachePerformance.put("misses", misses);
        cachePerformance.put("hit_ratio", hitRatio);

        Map<String, Object> alertsSent = new LinkedHashMap<>();
        alertsSent.put(AlertSeverity.WARNING.label(), metricsConfig.alertsSent(AlertSeverity.WARNING.label()));
        alertsSent.put(AlertSeverity.CRITICAL.label(), metricsConfig.alertsSent(AlertSeverity.CRITICAL.label()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cache_performance", cachePerformance);
        body.put("anomaly_detections", metricsConfig.detectionCount());
        body.put("current_cache_size", cache.size());
        body.put("alerts_sent", alertsSent);
        body.put("throttled_requests", metricsConfig.throttledCount());
        body.put("stored_alert_configs", configService.storedCount());
        body.put("uptime_seconds", Duration.between(startedAt, clock.instant()).toMillis() / 1000.0);
        return ResponseEntity.ok(body);
    }
}
