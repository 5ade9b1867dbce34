package com.engagement.anomaly.engine.throttle;

import com.engagement.anomaly.model.AdmissionDecision;

/**
 * Admission check for one request. Never blocks and never throws for an unknown key.
 */
public interface RateLimiter {
    AdmissionDecision tryAcquire(String key);
}
