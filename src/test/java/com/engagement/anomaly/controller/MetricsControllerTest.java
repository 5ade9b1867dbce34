package com.engagement.anomaly.controller;

import com.engagement.anomaly.config.ClockConfig;
import com.engagement.anomaly.config.DetectionConfig;
import com.engagement.anomaly.config.MetricsConfig;
import com.engagement.anomaly.config.SecurityConfig;
import com.engagement.anomaly.engine.throttle.RateLimiter;
import com.engagement.anomaly.model.AdmissionDecision;
import com.engagement.anomaly.repository.DetectionResultCache;
import com.engagement.anomaly.service.AlertConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MetricsController.class)
@Import(ClockConfig.class)
class MetricsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean private MetricsConfig metricsConfig;
    @MockBean private DetectionResultCache cache;
    @MockBean private AlertConfigService configService;
    @MockBean private RateLimiter rateLimiter;
    @MockBean private DetectionConfig detectionConfig;
    @MockBean private SecurityConfig securityConfig;

    @BeforeEach
    void setUp() {
        when(detectionConfig.getThrottle()).thenReturn(new DetectionConfig.Throttle());
        when(securityConfig.getApiKey()).thenReturn("test-key");
        when(rateLimiter.tryAcquire(anyString())).thenReturn(AdmissionDecision.allow(59));
    }

    @Test
    void summary_reportsCounters() throws Exception {
        when(metricsConfig.cacheHitCount()).thenReturn(3L);
        when(metricsConfig.cacheMissCount()).thenReturn(1L);
        when(metricsConfig.detectionCount()).thenReturn(1L);
        when(metricsConfig.alertsSent("warning")).thenReturn(2L);
        when(metricsConfig.alertsSent("critical")).thenReturn(1L);
        when(metricsConfig.throttledCount()).thenReturn(4L);
        when(cache.size()).thenReturn(1);
        when(configService.storedCount()).thenReturn(7);

        mockMvc.perform(get("/api/v1/metrics/summary").header("X-API-Key", "test-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cache_performance.hits").value(3))
                .andExpect(jsonPath("$.cache_performance.misses").value(1))
                .andExpect(jsonPath("$.cache_performance.hit_ratio").value(75.0))
                .andExpect(jsonPath("$.anomaly_detections").value(1))
                .andExpect(jsonPath("$.current_cache_size").value(1))
                .andExpect(jsonPath("$.alerts_sent.warning").value(2))
                .andExpect(jsonPath("$.alerts_sent.critical").value(1))
                .andExpect(jsonPath("$.throttled_requests").value(4))
                .andExpect(jsonPath("$.stored_alert_configs").value(7))
                .andExpect(jsonPath("$.uptime_seconds").isNumber());
    }

    @Test
    void summary_noLookups_hitRatioIsZero() throws Exception {
        mockMvc.perform(get("/api/v1/metrics/summary").header("X-API-Key", "test-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cache_performance.hit_ratio").value(0.0));
    }

    @Test
    void summary_requiresApiKey() throws Exception {
        mockMvc.perform(get("/api/v1/metrics/summary"))
                .andExpect(status().isForbidden());
    }
}
