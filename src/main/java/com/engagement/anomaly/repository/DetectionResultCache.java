package com.engagement.anomaly.repository;

import com.engagement.anomaly.config.DetectionConfig;
import com.engagement.anomaly.config.MetricsConfig;
import com.engagement.anomaly.model.DetectionResult;
import com.engagement.anomaly.model.ScoreSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * In-process cache of detection results keyed by series fingerprint.
 *
 * Entries expire after the configured TTL; at capacity the least recently used entry is evicted.
 * The same series always maps to the same fingerprint regardless of which client or customer
 * submitted it.
 */
@Repository
public class DetectionResultCache {

    private static final Logger log = LoggerFactory.getLogger(DetectionResultCache.class);

    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final MetricsConfig metricsConfig;

    // Access-ordered, guarded by `this`
    private final LinkedHashMap<String, CacheEntry> entries;

    private final ConcurrentMap<String, Object> computeLocks = new ConcurrentHashMap<>();

    @Autowired
    public DetectionResultCache(DetectionConfig config, Clock clock, MetricsConfig metricsConfig) {
        this(Duration.ofSeconds(config.getCache().getTtlSeconds()), config.getCache().getMaxEntries(),
                clock, metricsConfig);
    }

    public DetectionResultCache(Duration ttl, int maxEntries, Clock clock, MetricsConfig metricsConfig) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0, got " + maxEntries);
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
        this.metricsConfig = metricsConfig;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                return size() > DetectionResultCache.this.maxEntries;
            }
        };
    }

    public Optional<DetectionResult> lookup(String fingerprint) {
        Optional<DetectionResult> result = peek(fingerprint);
        if (result.isPresent()) {
            metricsConfig.recordCacheHit();
            log.debug("Cache hit for fingerprint={}", fingerprint);
        } else {
            metricsConfig.recordCacheMiss();
        }
        return result;
    }

    public void store(String fingerprint, DetectionResult result) {
        Instant expiresAt = clock.instant().plus(ttl);
        synchronized (this) {
            entries.put(fingerprint, new CacheEntry(result, expiresAt));
        }
    }

    /**
     * Returns the cached result, or computes and stores it. Concurrent callers with the same
     * fingerprint wait for a single computation and then share its result.
     */
    public DetectionResult getOrCompute(String fingerprint, Supplier<DetectionResult> computation) {
        Optional<DetectionResult> cached = lookup(fingerprint);
        if (cached.isPresent()) {
            return cached.get();
        }

        Object lock = computeLocks.computeIfAbsent(fingerprint, k -> new Object());
        try {
            synchronized (lock) {
                Optional<DetectionResult> raced = peek(fingerprint);
                if (raced.isPresent()) {
                    return raced.get();
                }
                DetectionResult result = computation.get();
                store(fingerprint, result);
                return result;
            }
        } finally {
            computeLocks.remove(fingerprint, lock);
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    /**
     * SHA-256 over the ordered (instant, value) pairs. Timestamps are normalized to UTC
     * instants so "2024-01-01" and "2024-01-01T00:00:00Z" collide.
     */
    public static String fingerprint(ScoreSeries series) {
        MessageDigest digest = sha256();
        ByteBuffer number = ByteBuffer.allocate(Double.BYTES);
        for (int i = 0; i < series.size(); i++) {
            digest.update(series.timestamps().get(i).toString().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '|');
            number.clear();
            number.putDouble(series.values().get(i));
            digest.update(number.array());
            digest.update((byte) ';');
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private Optional<DetectionResult> peek(String fingerprint) {
        Instant now = clock.instant();
        synchronized (this) {
            CacheEntry entry = entries.get(fingerprint);
            if (entry == null) {
                return Optional.empty();
            }
            if (!now.isBefore(entry.expiresAt())) {
                entries.remove(fingerprint);
                return Optional.empty();
            }
            return Optional.of(entry.result());
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record CacheEntry(DetectionResult result, Instant expiresAt) {}
}
