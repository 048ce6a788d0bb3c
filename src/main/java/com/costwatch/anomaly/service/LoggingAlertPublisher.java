package com.costwatch.anomaly.service;

import com.costwatch.anomaly.model.CostRecordToCheck;
import com.costwatch.anomaly.model.StoredAnomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default publisher: writes the alert to the log. Replace with a delivery channel bean.
 */
@Component
public class LoggingAlertPublisher implements AnomalyAlertPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertPublisher.class);

    @Override
    public void publish(StoredAnomaly anomaly, CostRecordToCheck record) {
        log.warn("ALERT [{}] {} for cost record {} (supplier={}, costType={}, amount={}): {}",
                anomaly.getSeverity().getId(), anomaly.getType(), record.getId(),
                record.getSupplierId(), record.getCostType().getId(), record.getAmount(),
                anomaly.getMessage());
    }
}
