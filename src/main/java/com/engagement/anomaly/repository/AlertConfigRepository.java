package com.engagement.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.engagement.anomaly.config.AerospikeConfig;
import com.engagement.anomaly.model.AlertConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key-value store for per-customer alert configuration.
 * One Aerospike record per customer in the {@code alert_configs} set, with the config serialized as JSON.
 */
@Repository
public class AlertConfigRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertConfigRepository.class);

    static final String BIN_CUSTOMER_ID = "customerId";
    static final String BIN_CONFIG = "config";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AlertConfigRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * All stored configs by customer id. Unreadable records are skipped; an unreachable
     * cluster yields an empty map.
     */
    public Map<String, AlertConfig> loadAll() {
        Map<String, AlertConfig> configs = new ConcurrentHashMap<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERT_CONFIGS,
                    (key, record) -> {
                        String customerId = record.getString(BIN_CUSTOMER_ID);
                        try {
                            if (customerId != null) {
                                configs.put(customerId,
                                        objectMapper.readValue(record.getString(BIN_CONFIG), AlertConfig.class));
                            }
                        } catch (Exception e) {
                            log.warn("Skipping unreadable alert config for customer={}: {}", customerId, e.getMessage());
                        }
                    });
        } catch (Exception e) {
            log.error("Failed to load alert configs from Aerospike", e);
            return Map.of();
        }
        log.info("Loaded {} alert configs", configs.size());
        return configs;
    }

    /**
     * Writes every config. Returns false if any write failed; the caller's in-memory state stays authoritative.
     */
    public boolean saveAll(Map<String, AlertConfig> configs) {
        boolean allSaved = true;
        for (Map.Entry<String, AlertConfig> entry : configs.entrySet()) {
            allSaved &= save(entry.getKey(), entry.getValue());
        }
        return allSaved;
    }

    public boolean save(String customerId, AlertConfig config) {
        try {
            Key key = new Key(namespace, AerospikeConfig.SET_ALERT_CONFIGS, customerId);
            client.put(writePolicy, key,
                    new Bin(BIN_CUSTOMER_ID, customerId),
                    new Bin(BIN_CONFIG, objectMapper.writeValueAsString(config)));
            return true;
        } catch (Exception e) {
            log.error("Failed to persist alert config for customer={}", customerId, e);
            return false;
        }
    }
}
