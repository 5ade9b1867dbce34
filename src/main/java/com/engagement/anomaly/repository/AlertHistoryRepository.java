package com.engagement.anomaly.repository;

import com.engagement.anomaly.model.AlertRecord;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, in-memory log of delivered alerts. Cleared on restart.
 */
@Repository
public class AlertHistoryRepository {

    private final List<AlertRecord> records = new CopyOnWriteArrayList<>();

    public void append(AlertRecord record) {
        records.add(record);
    }

    /**
     * Most recent records first, optionally restricted to one customer.
     *
     * @param customerId customer to filter on, or null for all customers
     * @param limit      maximum number of records returned
     */
    public List<AlertRecord> findRecent(String customerId, int limit) {
        List<AlertRecord> snapshot = new ArrayList<>(records);
        Collections.reverse(snapshot);
        return snapshot.stream()
                .filter(r -> customerId == null || customerId.equals(r.getCustomerId()))
                .limit(Math.max(0, limit))
                .toList();
    }

    public int size() {
        return records.size();
    }
}
