package com.costwatch.anomaly.repository;

import com.costwatch.anomaly.model.AnomalyStatus;
import com.costwatch.anomaly.model.DetectedAnomaly;
import com.costwatch.anomaly.model.StoredAnomaly;

import java.util.List;
import java.util.Optional;

/**
 * Storage for detected anomalies. At most one anomaly exists per (costRecordId, type).
 */
public interface AnomalyRepository {

    /**
     * Insert a new anomaly, or overwrite severity, message, details and backfill flag of the
     * existing one for the same record and type. Id, status and detection time are kept.
     */
    StoredAnomaly upsert(DetectedAnomaly anomaly);

    Optional<StoredAnomaly> findById(String anomalyId);

    List<StoredAnomaly> findByCostRecordId(String costRecordId);

    List<StoredAnomaly> findAll();

    Optional<StoredAnomaly> updateStatus(String anomalyId, AnomalyStatus status);
}
