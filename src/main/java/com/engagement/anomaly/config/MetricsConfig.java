package com.engagement.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.search.Search;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final Counter detections;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.detections = Counter.builder("detection.count")
                .description("Series scored by the outlier model (cache misses only)")
                .register(registry);
        this.cacheHits = Counter.builder("cache.hit.count").register(registry);
        this.cacheMisses = Counter.builder("cache.miss.count").register(registry);
    }

    public void recordDetection() {
        detections.increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordThrottled(String route) {
        Counter.builder("throttle.rejected.count")
                .tag("route", route)
                .register(registry)
                .increment();
    }

    public void recordAlertSent(String severity) {
        Counter.builder("alert.sent.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordAlertSuppressed(String reason) {
        Counter.builder("alert.suppressed.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public long detectionCount() {
        return (long) detections.count();
    }

    public long cacheHitCount() {
        return (long) cacheHits.count();
    }

    public long cacheMissCount() {
        return (long) cacheMisses.count();
    }

    public long throttledCount() {
        return sum(registry.find("throttle.rejected.count"));
    }

    public long alertsSent(String severity) {
        return sum(registry.find("alert.sent.count").tag("severity", severity));
    }

    private long sum(Search search) {
        return (long) search.counters().stream().mapToDouble(Counter::count).sum();
    }
}
