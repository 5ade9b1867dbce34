package com.engagement.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Largest series accepted by POST /detect
    private int maxPoints = 1000;

    private Model model = new Model();

    private Cache cache = new Cache();

    private Throttle throttle = new Throttle();

    @Data
    public static class Model {
        // Number of isolation trees fitted per request
        private int ensembleSize = 100;
        // Expected share of outliers, in (0, 0.5]
        private double contamination = 0.2;
        private long randomSeed = 42;
        // Sub-sampling size per tree; capped at the series length
        private int maxSamples = 256;
    }

    @Data
    public static class Cache {
        private long ttlSeconds = 300;
        private int maxEntries = 100;
    }

    @Data
    public static class Throttle {
        private boolean enabled = true;
        // Bucket capacity; refills at requestsPerMinute / 60 tokens per second
        private double requestsPerMinute = 60;
    }
}
