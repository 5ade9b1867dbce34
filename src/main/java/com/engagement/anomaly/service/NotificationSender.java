package com.engagement.anomaly.service;

import com.engagement.anomaly.model.NotificationResult;

import java.util.List;

/**
 * Delivery channel for alert notifications. Implementations report failures through the
 * returned {@link NotificationResult} and never throw.
 */
public interface NotificationSender {

    NotificationResult send(List<String> recipients, String subject, String body);

    String channel();
}
