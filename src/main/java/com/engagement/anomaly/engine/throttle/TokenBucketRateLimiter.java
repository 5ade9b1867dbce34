package com.engagement.anomaly.engine.throttle;

import com.engagement.anomaly.config.DetectionConfig;
import com.engagement.anomaly.model.AdmissionDecision;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Token bucket per key (typically "clientIp:path").
 *
 * Capacity is the configured requests per minute; tokens refill continuously at
 * capacity / 60 per second, starting full. A denied request leaves the bucket untouched.
 * Buckets live until restart.
 */
@Component
public class TokenBucketRateLimiter implements RateLimiter {

    private final double capacity;
    private final double refillPerSecond;
    private final Clock clock;
    private final ConcurrentMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    @Autowired
    public TokenBucketRateLimiter(DetectionConfig config, Clock clock) {
        this(config.getThrottle().getRequestsPerMinute(), clock);
    }

    public TokenBucketRateLimiter(double requestsPerMinute, Clock clock) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be > 0, got " + requestsPerMinute);
        }
        this.capacity = requestsPerMinute;
        this.refillPerSecond = requestsPerMinute / 60.0;
        this.clock = clock;
    }

    @Override
    public AdmissionDecision tryAcquire(String key) {
        long now = clock.millis();
        AdmissionDecision[] decision = new AdmissionDecision[1];

        buckets.compute(key, (k, bucket) -> {
            double tokens = capacity;
            if (bucket != null) {
                double elapsedSeconds = Math.max(0L, now - bucket.lastRefillMillis) / 1000.0;
                tokens = Math.min(capacity, bucket.tokens + elapsedSeconds * refillPerSecond);
            }

            if (tokens < 1.0) {
                decision[0] = AdmissionDecision.deny(tokens, retryAfterSeconds());
                return bucket;
            }

            decision[0] = AdmissionDecision.allow(tokens - 1.0);
            return new Bucket(tokens - 1.0, now);
        });

        return decision[0];
    }

    public double retryAfterSeconds() {
        return 60.0 / capacity;
    }

    public double getCapacity() {
        return capacity;
    }

    int trackedKeys() {
        return buckets.size();
    }

    private record Bucket(double tokens, long lastRefillMillis) {}
}
