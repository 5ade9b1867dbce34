package com.engagement.anomaly.service;

/**
 * Scoring failed for a series that passed validation. Never cached.
 */
public class DetectionException extends RuntimeException {

    private final String fingerprint;

    public DetectionException(String message, String fingerprint, Throwable cause) {
        super(message, cause);
        this.fingerprint = fingerprint;
    }

    public String getFingerprint() {
        return fingerprint;
    }
}
