package com.costwatch.anomaly.service;

import com.costwatch.anomaly.config.AnomalyProperties;
import com.costwatch.anomaly.engine.AnomalyEngine;
import com.costwatch.anomaly.engine.CheckRegistry;
import com.costwatch.anomaly.model.AnomalySettings;
import com.costwatch.anomaly.model.AnomalySeverity;
import com.costwatch.anomaly.model.StoredAnomaly;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static com.costwatch.anomaly.testutil.TestDataFactory.createStoredAnomaly;
import static org.assertj.core.api.Assertions.assertThat;

class AlertPolicyTest {

    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

    private MutableClock clock;
    private AnomalyProperties properties;
    private AlertPolicy policy;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-10T09:00:00Z"), BERLIN);
        properties = new AnomalyProperties();
        AnomalyEngine engine = new AnomalyEngine(CheckRegistry.defaultRegistry(),
                AnomalySettings.builder().maxAlertsPerDay(2).build());
        policy = new AlertPolicy(properties, engine, clock);
    }

    @Test
    void evaluate_backfill_neverDispatched() {
        StoredAnomaly anomaly = createStoredAnomaly("A-1", "yoy_deviation", AnomalySeverity.CRITICAL, true);

        assertThat(policy.evaluate(anomaly)).isEqualTo(AlertDecision.SUPPRESSED_BACKFILL);
        assertThat(policy.getDispatchedToday()).isZero();
    }

    @Test
    void evaluate_infoSuppressedByDefault() {
        StoredAnomaly anomaly = createStoredAnomaly("A-1", "missing_period", AnomalySeverity.INFO, false);

        assertThat(policy.evaluate(anomaly)).isEqualTo(AlertDecision.SUPPRESSED_SEVERITY);
    }

    @Test
    void evaluate_infoDispatchedWhenRouted() {
        properties.setNotifyOnInfo(true);
        StoredAnomaly anomaly = createStoredAnomaly("A-1", "missing_period", AnomalySeverity.INFO, false);

        assertThat(policy.evaluate(anomaly)).isEqualTo(AlertDecision.DISPATCH);
    }

    @Test
    void evaluate_dailyCapReached_suppresses() {
        StoredAnomaly anomaly = createStoredAnomaly("A-1", "yoy_deviation", AnomalySeverity.WARNING, false);

        assertThat(policy.evaluate(anomaly)).isEqualTo(AlertDecision.DISPATCH);
        assertThat(policy.evaluate(anomaly)).isEqualTo(AlertDecision.DISPATCH);
        assertThat(policy.evaluate(anomaly)).isEqualTo(AlertDecision.SUPPRESSED_DAILY_CAP);
        assertThat(policy.getDispatchedToday()).isEqualTo(2);
    }

    @Test
    void evaluate_capResetsOnNextDay() {
        StoredAnomaly anomaly = createStoredAnomaly("A-1", "yoy_deviation", AnomalySeverity.WARNING, false);
        policy.evaluate(anomaly);
        policy.evaluate(anomaly);

        clock.advance(Duration.ofDays(1));

        assertThat(policy.evaluate(anomaly)).isEqualTo(AlertDecision.DISPATCH);
        assertThat(policy.getDispatchedToday()).isEqualTo(1);
    }

    private static class MutableClock extends Clock {

        private Instant instant;
        private final ZoneId zone;

        MutableClock(Instant instant, ZoneId zone) {
            this.instant = instant;
            this.zone = zone;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return new MutableClock(instant, zone);
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
