package com.costwatch.anomaly.service;

import com.costwatch.anomaly.config.MetricsConfig;
import com.costwatch.anomaly.engine.AnomalyEngine;
import com.costwatch.anomaly.engine.CheckContext;
import com.costwatch.anomaly.model.AnomalySeverity;
import com.costwatch.anomaly.model.CheckExecution;
import com.costwatch.anomaly.model.DetectedAnomaly;
import com.costwatch.anomaly.model.DetectionOptions;
import com.costwatch.anomaly.model.DetectionRequest;
import com.costwatch.anomaly.model.DetectionResult;
import com.costwatch.anomaly.model.StoredAnomaly;
import com.costwatch.anomaly.repository.AnomalyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Main orchestrator for cost record evaluation.
 *
 * Flow:
 * 1. Build the immutable check context from the request
 * 2. Run the anomaly engine
 * 3. Store each anomaly (one per record and check type)
 * 4. Dispatch live alerts allowed by the alert policy
 * 5. Record metrics
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final AnomalyEngine engine;
    private final AnomalyRepository anomalyRepository;
    private final AlertPolicy alertPolicy;
    private final AnomalyAlertPublisher alertPublisher;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(AnomalyEngine engine,
                                   AnomalyRepository anomalyRepository,
                                   AlertPolicy alertPolicy,
                                   AnomalyAlertPublisher alertPublisher,
                                   MetricsConfig metricsConfig) {
        this.engine = engine;
        this.anomalyRepository = anomalyRepository;
        this.alertPolicy = alertPolicy;
        this.alertPublisher = alertPublisher;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Detect, store and alert. This is the entry point for newly ingested and backfilled records.
     */
    public DetectionResult process(DetectionRequest request) {
        DetectionResult result = detectOnly(request);

        for (DetectedAnomaly anomaly : result.getAnomalies()) {
            StoredAnomaly stored = anomalyRepository.upsert(anomaly);

            AlertDecision decision = alertPolicy.evaluate(stored);
            if (decision.isDispatch()) {
                alertPublisher.publish(stored, request.getRecord());
                metricsConfig.recordAlertDispatched(stored.getSeverity().getId());
            } else {
                metricsConfig.recordAlertSuppressed(decision.getReason());
                if (decision == AlertDecision.SUPPRESSED_DAILY_CAP) {
                    log.info("Daily alert cap reached, not alerting {} for cost record {}",
                            stored.getType(), stored.getCostRecordId());
                }
            }

            if (!anomaly.isBackfill() && anomaly.getSeverity() != AnomalySeverity.INFO) {
                log.warn("Anomaly detected for cost record={}: type={}, severity={}, message={}",
                        anomaly.getCostRecordId(), anomaly.getType(),
                        anomaly.getSeverity().getId(), anomaly.getMessage());
            }
        }

        log.info("Detection complete for cost record {}: {} anomalies (backfill={})",
                result.getCostRecordId(), result.getAnomalies().size(), result.isBackfill());
        return result;
    }

    /**
     * Run detection without storing anomalies or sending alerts.
     */
    public DetectionResult detectOnly(DetectionRequest request) {
        CheckContext context = CheckContext.builder()
                .location(request.getLocation())
                .supplier(request.getSupplier())
                .historicalRecords(request.getHistoricalRecords())
                .contract(request.getContract())
                .budget(request.getBudget())
                .settings(engine.getSettings())
                .build();

        DetectionOptions options = DetectionOptions.builder()
                .backfill(request.isBackfill())
                .checkIds(request.getCheckIds())
                .build();

        DetectionResult result = engine.detect(request.getRecord(), context, options);
        recordCheckMetrics(result);
        return result;
    }

    private void recordCheckMetrics(DetectionResult result) {
        metricsConfig.recordDetection(result.isBackfill(), result.getAnomalies().size());
        for (CheckExecution execution : result.getCheckResults()) {
            if (execution.isSkipped()) {
                String reason = execution.getSkipReason() != null && execution.getSkipReason().startsWith(AnomalyEngine.CHECK_FAILED_PREFIX)
                        ? "failed"
                        : "insufficient_history";
                metricsConfig.recordCheckSkipped(execution.getCheckId(), reason);
            } else if (execution.getResult().isReportable()) {
                metricsConfig.recordCheckTriggered(execution.getCheckId(),
                        execution.getResult().getSeverity().getId());
            }
        }
    }
}
