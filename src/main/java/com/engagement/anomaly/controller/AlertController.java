package com.engagement.anomaly.controller;

import com.engagement.anomaly.model.AlertConfig;
import com.engagement.anomaly.model.AlertRecord;
import com.engagement.anomaly.model.FieldViolation;
import com.engagement.anomaly.repository.AlertHistoryRepository;
import com.engagement.anomaly.service.AlertConfigService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Per-customer alert configuration and delivered alert history")
public class AlertController {

    private final AlertConfigService configService;
    private final AlertHistoryRepository historyRepository;

    public AlertController(AlertConfigService configService, AlertHistoryRepository historyRepository) {
        this.configService = configService;
        this.historyRepository = historyRepository;
    }

    @Operation(summary = "Get the effective alert config for a customer",
            description = "Returns the stored config, or the system default when none was set.")
    @GetMapping("/config/{customerId}")
    public ResponseEntity<AlertConfig> getConfig(
            @Parameter(description = "Customer ID", example = "CUST-042")
            @PathVariable String customerId) {
        return ResponseEntity.ok(configService.getEffectiveConfig(customerId));
    }

    @Operation(summary = "Store the alert config for a customer",
            description = "Validates thresholds and recipients, then persists the config. " +
                    "Omitting last_alert_time keeps the customer's current cooldown.")
    @PostMapping("/config/{customerId}")
    public ResponseEntity<?> setConfig(
            @Parameter(description = "Customer ID", example = "CUST-042")
            @PathVariable String customerId,
            @RequestBody AlertConfig config) {
        Optional<FieldViolation> violation = configService.validate(config);
        if (violation.isPresent()) {
            return badRequest("invalid_config", violation.get().field(), violation.get().detail());
        }
        AlertConfig stored = configService.updateConfig(customerId, config);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("message", "Alert configuration updated for customer " + customerId);
        body.put("config", stored);
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "List delivered alerts",
            description = "Most recent first, optionally filtered by customer.")
    @GetMapping("/history")
    public ResponseEntity<?> getHistory(
            @Parameter(description = "Only alerts for this customer", example = "CUST-042")
            @RequestParam(name = "customer_id", required = false) String customerId,
            @Parameter(description = "Maximum number of records", example = "100")
            @RequestParam(defaultValue = "100") int limit) {
        if (limit < 0) {
            return badRequest("invalid_parameter", "limit", "limit must be >= 0");
        }
        List<AlertRecord> records = historyRepository.findRecent(customerId, limit);
        return ResponseEntity.ok(records);
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("field", field);
        body.put("detail", detail);
        return ResponseEntity.badRequest().body(body);
    }
}
