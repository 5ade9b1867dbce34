package com.engagement.anomaly.service;

import com.engagement.anomaly.config.MetricsConfig;
import com.engagement.anomaly.engine.AlertEngine;
import com.engagement.anomaly.engine.OutlierScorer;
import com.engagement.anomaly.engine.isolationforest.FeatureExtractor;
import com.engagement.anomaly.model.AlertDecision;
import com.engagement.anomaly.model.CombinedDetectionResponse;
import com.engagement.anomaly.model.DetectionResult;
import com.engagement.anomaly.model.FeatureVector;
import com.engagement.anomaly.model.ScoreSeries;
import com.engagement.anomaly.repository.DetectionResultCache;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Orchestrates anomaly detection for a validated series.
 *
 * Flow:
 * 1. Fingerprint the series and look it up in the result cache
 * 2. On a miss, extract rolling features and fit the outlier model on this batch
 * 3. Store the result; concurrent requests for the same series share one computation
 * 4. With a customer id, hand the result to the AlertEngine
 */
@Service
public class DetectionService {

    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    private final DetectionResultCache cache;
    private final OutlierScorer scorer;
    private final AlertEngine alertEngine;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final Clock clock;

    public DetectionService(DetectionResultCache cache,
                            OutlierScorer scorer,
                            AlertEngine alertEngine,
                            MetricsConfig metricsConfig,
                            ObjectProvider<Tracer> tracer,
                            Clock clock) {
        this.cache = cache;
        this.scorer = scorer;
        this.alertEngine = alertEngine;
        this.metricsConfig = metricsConfig;
        // Tests and tracing-disabled profiles run without a tracer bean
        this.tracer = tracer.getIfAvailable(() -> Tracer.NOOP);
        this.clock = clock;
    }

    @Observed(name = "detection.detect", contextualName = "detect-anomalies")
    public DetectionResult detect(ScoreSeries series) {
        String fingerprint = DetectionResultCache.fingerprint(series);
        return cache.getOrCompute(fingerprint, () -> compute(series, fingerprint));
    }

    /**
     * Detect, then evaluate alerting for the customer. Cached results still go through
     * alert evaluation; the cooldown keeps repeats from re-notifying.
     */
    public CombinedDetectionResponse detectForCustomer(ScoreSeries series, String customerId) {
        DetectionResult result = detect(series);
        AlertDecision decision = alertEngine.evaluate(customerId, result);
        return new CombinedDetectionResponse(result, decision);
    }

    private DetectionResult compute(ScoreSeries series, String fingerprint) {
        double[] values = series.valuesArray();

        Span span = tracer.nextSpan()
                .name("model.fit")
                .tag("series.points", String.valueOf(values.length))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<FeatureVector> features = FeatureExtractor.extract(values);
            List<Boolean> flags = scorer.score(features);
            DetectionResult result = DetectionResult.of(flags, values, clock.instant());

            span.tag("anomaly.count", String.valueOf(result.getMetadata().getAnomalyCount()));
            metricsConfig.recordDetection();
            log.info("Scored series fingerprint={} points={} anomalies={}",
                    fingerprint, values.length, result.getMetadata().getAnomalyCount());
            return result;
        } catch (RuntimeException e) {
            span.error(e);
            log.error("Detection failed for fingerprint={} points={}: {}",
                    fingerprint, values.length, e.getMessage(), e);
            throw new DetectionException("Error processing anomaly detection: " + e.getMessage(), fingerprint, e);
        } finally {
            span.end();
        }
    }
}
