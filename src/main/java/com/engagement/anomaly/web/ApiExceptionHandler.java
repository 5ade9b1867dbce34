package com.engagement.anomaly.web;

import com.engagement.anomaly.service.DetectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(DetectionException.class)
    public ResponseEntity<Map<String, String>> handleDetectionFailure(DetectionException e) {
        log.error("Detection request failed (fingerprint={}): {}", e.getFingerprint(), e.getMessage());
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", "detection_failed");
        body.put("detail", e.getMessage());
        return ResponseEntity.internalServerError().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException e) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", "malformed_body");
        body.put("field", "body");
        body.put("detail", "Request body is not valid JSON for this endpoint");
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", "invalid_parameter");
        body.put("field", e.getName());
        body.put("detail", "Invalid value: " + e.getValue());
        return ResponseEntity.badRequest().body(body);
    }
}
