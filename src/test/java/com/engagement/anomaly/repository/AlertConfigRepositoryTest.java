package com.engagement.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.engagement.anomaly.config.AerospikeConfig;
import com.engagement.anomaly.model.AlertConfig;
import com.engagement.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertConfigRepositoryTest {

    @Mock private AerospikeClient client;

    private final WritePolicy writePolicy = new WritePolicy();
    private AlertConfigRepository repository;

    @BeforeEach
    void setUp() {
        repository = new AlertConfigRepository(client, "test", writePolicy);
    }

    private static Record record(String customerId, String json) {
        Map<String, Object> bins = new LinkedHashMap<>();
        bins.put(AlertConfigRepository.BIN_CUSTOMER_ID, customerId);
        bins.put(AlertConfigRepository.BIN_CONFIG, json);
        return new Record(bins, 1, 0);
    }

    @Test
    void loadAll_readsJsonConfigPerCustomer() {
        doAnswer(inv -> {
            ScanCallback callback = inv.getArgument(3);
            callback.scanCallback(new Key("test", AerospikeConfig.SET_ALERT_CONFIGS, "C1"), record("C1",
                    "{\"enabled\":true,\"email_recipients\":[\"ops@example.com\"]," +
                    "\"thresholds\":{\"warning_threshold\":0.1,\"critical_threshold\":0.4," +
                    "\"min_anomaly_points\":2,\"cooldown_minutes\":15},\"last_alert_time\":1700000000000}"));
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq("test"), eq(AerospikeConfig.SET_ALERT_CONFIGS),
                any(ScanCallback.class), any(String[].class));

        Map<String, AlertConfig> configs = repository.loadAll();

        assertThat(configs).containsOnlyKeys("C1");
        AlertConfig config = configs.get("C1");
        assertThat(config.getRecipients()).containsExactly("ops@example.com");
        assertThat(config.getThresholds().getWarningThreshold()).isEqualTo(0.1);
        assertThat(config.getThresholds().getCooldownMinutes()).isEqualTo(15);
        assertThat(config.getLastAlertTime()).isEqualTo(1700000000000L);
    }

    @Test
    void loadAll_skipsUnreadableRecords() {
        doAnswer(inv -> {
            ScanCallback callback = inv.getArgument(3);
            callback.scanCallback(new Key("test", AerospikeConfig.SET_ALERT_CONFIGS, "BAD"), record("BAD", "not-json"));
            callback.scanCallback(new Key("test", AerospikeConfig.SET_ALERT_CONFIGS, "OK"), record("OK", "{}"));
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), anyString(), anyString(),
                any(ScanCallback.class), any(String[].class));

        assertThat(repository.loadAll()).containsOnlyKeys("OK");
    }

    @Test
    void loadAll_clusterUnavailable_returnsEmpty() {
        doThrow(new AerospikeException("cluster down")).when(client).scanAll(any(ScanPolicy.class),
                anyString(), anyString(), any(ScanCallback.class), any(String[].class));

        assertThat(repository.loadAll()).isEmpty();
    }

    @Test
    void save_writesOneRecordKeyedByCustomer() {
        boolean saved = repository.save("C1", TestDataFactory.createAlertConfig("ops@example.com", null));

        ArgumentCaptor<Key> key = ArgumentCaptor.forClass(Key.class);
        verify(client).put(eq(writePolicy), key.capture(), any(Bin[].class));
        assertThat(saved).isTrue();
        assertThat(key.getValue().userKey.toString()).isEqualTo("C1");
        assertThat(key.getValue().setName).isEqualTo(AerospikeConfig.SET_ALERT_CONFIGS);
    }

    @Test
    void saveAll_reportsFailureWithoutThrowing() {
        doThrow(new AerospikeException("write failed"))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        boolean saved = repository.saveAll(Map.of("C1", TestDataFactory.createAlertConfig("ops@example.com", null)));

        assertThat(saved).isFalse();
    }
}
