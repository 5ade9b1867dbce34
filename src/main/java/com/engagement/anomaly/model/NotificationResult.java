package com.engagement.anomaly.model;

public record NotificationResult(boolean delivered, String reason) {

    public static NotificationResult success() {
        return new NotificationResult(true, null);
    }

    public static NotificationResult failure(String reason) {
        return new NotificationResult(false, reason);
    }
}
