package com.engagement.anomaly.model;

public record AdmissionDecision(boolean allowed, double remainingTokens, double retryAfterSeconds) {

    public static AdmissionDecision allow(double remainingTokens) {
        return new AdmissionDecision(true, remainingTokens, 0.0);
    }

    public static AdmissionDecision deny(double remainingTokens, double retryAfterSeconds) {
        return new AdmissionDecision(false, remainingTokens, retryAfterSeconds);
    }
}
