package com.costwatch.anomaly.config;

import com.costwatch.anomaly.model.AlertThresholds;
import com.costwatch.anomaly.model.AnomalySettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyProperties {

    // Startup thresholds; changes at runtime go through the engine's settings, not here.
    private Thresholds alertThresholds = new Thresholds();

    private List<String> enabledChecks = new ArrayList<>(AnomalySettings.ALL_CHECK_IDS);

    // Alert fatigue protection
    private int maxAlertsPerDay = 50;

    private boolean digestEnabled = false;

    private int digestHour = 8;

    // Severity routing for live alerts
    private boolean notifyOnCritical = true;
    private boolean notifyOnWarning = true;
    private boolean notifyOnInfo = false;

    // Zone in which the daily alert cap resets
    private String alertZone = "Europe/Berlin";

    @Data
    public static class Thresholds {
        private double yoyDeviationPercent = 20.0;
        private double momDeviationPercent = 30.0;
        private double pricePerUnitDeviationPercent = 10.0;
        private double zScoreThreshold = 2.0;
        private double budgetExceededPercent = 10.0;
    }

    public AnomalySettings toSettings() {
        return AnomalySettings.builder()
                .alertThresholds(AlertThresholds.builder()
                        .yoyDeviationPercent(alertThresholds.getYoyDeviationPercent())
                        .momDeviationPercent(alertThresholds.getMomDeviationPercent())
                        .pricePerUnitDeviationPercent(alertThresholds.getPricePerUnitDeviationPercent())
                        .zScoreThreshold(alertThresholds.getZScoreThreshold())
                        .budgetExceededPercent(alertThresholds.getBudgetExceededPercent())
                        .build())
                .enabledChecks(enabledChecks.stream().distinct().toList())
                .maxAlertsPerDay(maxAlertsPerDay)
                .digestEnabled(digestEnabled)
                .digestHour(digestHour)
                .build();
    }
}
