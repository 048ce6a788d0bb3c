package com.costwatch.anomaly.service;

import com.costwatch.anomaly.model.CostRecordToCheck;
import com.costwatch.anomaly.model.StoredAnomaly;

/**
 * Outbound channel for live anomaly alerts (email, chat, webhook).
 */
public interface AnomalyAlertPublisher {

    void publish(StoredAnomaly anomaly, CostRecordToCheck record);
}
