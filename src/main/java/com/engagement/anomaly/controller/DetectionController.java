package com.engagement.anomaly.controller;

import com.engagement.anomaly.model.DetectionRequest;
import com.engagement.anomaly.model.ValidationResult;
import com.engagement.anomaly.service.DetectionService;
import com.engagement.anomaly.service.SeriesValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Detection", description = "Score a series for anomalous points and optionally evaluate alerts")
public class DetectionController {

    private static final Logger log = LoggerFactory.getLogger(DetectionController.class);

    private final DetectionService detectionService;
    private final SeriesValidator seriesValidator;

    public DetectionController(DetectionService detectionService, SeriesValidator seriesValidator) {
        this.detectionService = detectionService;
        this.seriesValidator = seriesValidator;
    }

    @Operation(summary = "Detect anomalies in a score series",
            description = "Fits a seeded Isolation Forest on rolling features of the submitted series and flags " +
                    "outlying points. Identical series within the cache TTL return the cached result. " +
                    "With customer_id, the response also carries the alert decision for that customer.")
    @PostMapping("/detect")
    public ResponseEntity<?> detect(
            @RequestBody DetectionRequest request,
            @Parameter(description = "Customer to evaluate alerts for", example = "CUST-042")
            @RequestParam(name = "customer_id", required = false) String customerId) {

        ValidationResult validation = seriesValidator.validate(request);
        if (!validation.isValid()) {
            log.debug("Rejected detection request: {} on {}", validation.failure(), validation.field());
            return badRequest(validation.failure().name().toLowerCase(), validation.field(), validation.detail());
        }

        if (customerId == null || customerId.isBlank()) {
            return ResponseEntity.ok(detectionService.detect(validation.series()));
        }
        return ResponseEntity.ok(detectionService.detectForCustomer(validation.series(), customerId));
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("field", field);
        body.put("detail", detail);
        return ResponseEntity.badRequest().body(body);
    }
}
