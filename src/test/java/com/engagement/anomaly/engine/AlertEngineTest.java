package com.engagement.anomaly.engine;

import com.engagement.anomaly.config.AlertDefaultsConfig;
import com.engagement.anomaly.config.MetricsConfig;
import com.engagement.anomaly.model.*;
import com.engagement.anomaly.repository.AlertConfigRepository;
import com.engagement.anomaly.repository.AlertHistoryRepository;
import com.engagement.anomaly.service.AlertConfigService;
import com.engagement.anomaly.service.NotificationSender;
import com.engagement.anomaly.testutil.MutableClock;
import com.engagement.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertEngineTest {

    @Mock private AlertConfigRepository configRepository;
    @Mock private NotificationSender notificationSender;

    private MutableClock clock;
    private AlertConfigService configService;
    private AlertHistoryRepository historyRepository;
    private MetricsConfig metricsConfig;
    private AlertEngine alertEngine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestDataFactory.START);
        configService = new AlertConfigService(configRepository, new AlertDefaultsConfig());
        historyRepository = new AlertHistoryRepository();
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        alertEngine = new AlertEngine(configService, notificationSender, historyRepository, metricsConfig, clock);
    }

    private void storeConfig(String customerId, AlertConfig config) {
        configService.updateConfig(customerId, config);
        clearInvocations(configRepository);
    }

    @Test
    void evaluate_warningFraction_sendsWarning() {
        when(notificationSender.send(anyList(), anyString(), anyString())).thenReturn(NotificationResult.success());

        AlertDecision decision = alertEngine.evaluate("C1", TestDataFactory.createResult(3, 15));

        assertThat(decision.isSent()).isTrue();
        assertThat(decision.getSeverity()).isEqualTo(AlertSeverity.WARNING);
        assertThat(decision.getReason()).isNull();
        assertThat(decision.getMessage()).isEqualTo("WARNING alert sent successfully");
        assertThat(decision.getTimestamp()).isEqualTo(clock.millis());

        ArgumentCaptor<String> subject = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(notificationSender).send(eq(List.of("alerts@customerengagement.com")), subject.capture(), body.capture());
        assertThat(subject.getValue()).isEqualTo("WARNING Alert: Anomaly Detection for Customer C1");
        assertThat(body.getValue())
                .contains("Severity: WARNING")
                .contains("Customer ID: C1")
                .contains("Anomaly Percentage: 20.00%")
                .contains("Number of Anomalies: 3")
                .contains("Total Data Points: 15");

        assertThat(historyRepository.findRecent("C1", 10)).hasSize(1);
        assertThat(metricsConfig.alertsSent("warning")).isEqualTo(1);
    }

    @Test
    void evaluate_criticalFraction_sendsCritical() {
        when(notificationSender.send(anyList(), anyString(), anyString())).thenReturn(NotificationResult.success());

        AlertDecision decision = alertEngine.evaluate("C1", TestDataFactory.createResult(6, 10));

        assertThat(decision.isSent()).isTrue();
        assertThat(decision.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
    }

    @Test
    void evaluate_belowWarningThreshold_suppressed() {
        AlertDecision decision = alertEngine.evaluate("C1", TestDataFactory.createResult(3, 30));

        assertThat(decision.isSent()).isFalse();
        assertThat(decision.getReason()).isEqualTo(SuppressionReason.BELOW_THRESHOLD);
        assertThat(decision.getSeverity()).isEqualTo(AlertSeverity.NONE);
        verifyNoInteractions(notificationSender);
    }

    @Test
    void evaluate_tooFewAnomalousPoints_suppressed() {
        AlertDecision decision = alertEngine.evaluate("C1", TestDataFactory.createResult(2, 4));

        assertThat(decision.getReason()).isEqualTo(SuppressionReason.INSUFFICIENT_POINTS);
        verifyNoInteractions(notificationSender);
    }

    @Test
    void evaluate_disabled_suppressedBeforeAnythingElse() {
        AlertConfig disabled = TestDataFactory.createAlertConfig("ops@example.com", null);
        disabled.setEnabled(false);
        storeConfig("C1", disabled);

        AlertDecision decision = alertEngine.evaluate("C1", TestDataFactory.createResult(6, 10));

        assertThat(decision.getReason()).isEqualTo(SuppressionReason.DISABLED);
        verifyNoInteractions(notificationSender);
    }

    @Test
    void evaluate_storedCustomer_secondAlertWithinCooldownSuppressed() {
        storeConfig("C1", TestDataFactory.createAlertConfig("ops@example.com", null));
        when(notificationSender.send(anyList(), anyString(), anyString())).thenReturn(NotificationResult.success());

        AlertDecision first = alertEngine.evaluate("C1", TestDataFactory.createResult(6, 10));
        clock.advance(Duration.ofMinutes(30));
        AlertDecision second = alertEngine.evaluate("C1", TestDataFactory.createResult(6, 10));

        assertThat(first.isSent()).isTrue();
        assertThat(second.isSent()).isFalse();
        assertThat(second.getReason()).isEqualTo(SuppressionReason.COOLDOWN);
        verify(notificationSender, times(1)).send(anyList(), anyString(), anyString());
        verify(configRepository).saveAll(anyMap());
        assertThat(configService.findStored("C1").orElseThrow().getLastAlertTime())
                .isEqualTo(TestDataFactory.START.toEpochMilli());
    }

    @Test
    void evaluate_concurrentRequestsForOneCustomer_sendExactlyOnce() throws Exception {
        storeConfig("C1", TestDataFactory.createAlertConfig("ops@example.com", null));
        AtomicInteger deliveries = new AtomicInteger();
        NotificationSender slowSender = new NotificationSender() {
            @Override
            public NotificationResult send(List<String> recipients, String subject, String body) {
                deliveries.incrementAndGet();
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return NotificationResult.failure("interrupted");
                }
                return NotificationResult.success();
            }

            @Override
            public String channel() {
                return "test";
            }
        };
        AlertEngine engine = new AlertEngine(configService, slowSender, historyRepository, metricsConfig, clock);

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AlertDecision>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return engine.evaluate("C1", TestDataFactory.createResult(6, 10));
                }));
            }
            start.countDown();

            List<AlertDecision> decisions = new ArrayList<>();
            for (Future<AlertDecision> f : futures) decisions.add(f.get(10, TimeUnit.SECONDS));

            assertThat(decisions).filteredOn(AlertDecision::isSent).hasSize(1);
            assertThat(decisions).filteredOn(d -> !d.isSent())
                    .extracting(AlertDecision::getReason)
                    .containsOnly(SuppressionReason.COOLDOWN);
            assertThat(deliveries.get()).isEqualTo(1);
            assertThat(historyRepository.findRecent("C1", 10)).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void evaluate_storedCustomer_alertsAgainAfterCooldown() {
        storeConfig("C1", TestDataFactory.createAlertConfig("ops@example.com", null));
        when(notificationSender.send(anyList(), anyString(), anyString())).thenReturn(NotificationResult.success());

        alertEngine.evaluate("C1", TestDataFactory.createResult(6, 10));
        clock.advance(Duration.ofMinutes(60));
        AlertDecision again = alertEngine.evaluate("C1", TestDataFactory.createResult(6, 10));

        assertThat(again.isSent()).isTrue();
        assertThat(historyRepository.findRecent("C1", 10)).hasSize(2);
    }

    @Test
    void evaluate_cooldownReportedBeforeInsufficientPoints() {
        long tenMinutesAgo = clock.millis() - Duration.ofMinutes(10).toMillis();
        storeConfig("C1", TestDataFactory.createAlertConfig("ops@example.com", tenMinutesAgo));

        AlertDecision decision = alertEngine.evaluate("C1", TestDataFactory.createResult(0, 10));

        assertThat(decision.getReason()).isEqualTo(SuppressionReason.COOLDOWN);
    }

    @Test
    void evaluate_deliveryFailure_keepsCooldownUntouched() {
        storeConfig("C1", TestDataFactory.createAlertConfig("ops@example.com", null));
        when(notificationSender.send(anyList(), anyString(), anyString()))
                .thenReturn(NotificationResult.failure("mail transport not configured"));

        AlertDecision decision = alertEngine.evaluate("C1", TestDataFactory.createResult(3, 15));

        assertThat(decision.isSent()).isFalse();
        assertThat(decision.getReason()).isEqualTo(SuppressionReason.DELIVERY_FAILED);
        assertThat(decision.getSeverity()).isEqualTo(AlertSeverity.WARNING);
        assertThat(decision.getMessage()).contains("mail transport not configured");
        assertThat(configService.findStored("C1").orElseThrow().getLastAlertTime()).isNull();
        assertThat(historyRepository.size()).isZero();
        verify(configRepository, never()).saveAll(anyMap());
    }

    @Test
    void evaluate_defaultCustomer_cooldownStateNeverPersisted() {
        when(notificationSender.send(anyList(), anyString(), anyString())).thenReturn(NotificationResult.success());

        AlertDecision first = alertEngine.evaluate("NEW", TestDataFactory.createResult(6, 10));
        AlertDecision second = alertEngine.evaluate("NEW", TestDataFactory.createResult(6, 10));

        assertThat(first.isSent()).isTrue();
        assertThat(second.isSent()).isTrue();
        assertThat(configService.findStored("NEW")).isEmpty();
        verify(configRepository, never()).saveAll(anyMap());
    }

    @Test
    void evaluate_storedCustomerUsesItsOwnRecipientsAndThresholds() {
        AlertConfig config = TestDataFactory.createAlertConfig("team@example.com", null);
        config.getThresholds().setWarningThreshold(0.05);
        config.getThresholds().setMinAnomalyPoints(1);
        storeConfig("C1", config);
        when(notificationSender.send(anyList(), anyString(), anyString())).thenReturn(NotificationResult.success());

        AlertDecision decision = alertEngine.evaluate("C1", TestDataFactory.createResult(1, 10));

        assertThat(decision.getSeverity()).isEqualTo(AlertSeverity.WARNING);
        verify(notificationSender).send(eq(List.of("team@example.com")), anyString(), anyString());
    }
}
