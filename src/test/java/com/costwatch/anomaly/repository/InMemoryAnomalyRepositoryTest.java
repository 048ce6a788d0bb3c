package com.costwatch.anomaly.repository;

import com.costwatch.anomaly.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.costwatch.anomaly.testutil.TestDataFactory.createDetectedAnomaly;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryAnomalyRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-10T09:00:00Z");

    private InMemoryAnomalyRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAnomalyRepository(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void upsert_newAnomaly_assignsIdAndNewStatus() {
        StoredAnomaly stored = repository.upsert(
                createDetectedAnomaly("REC-1", "yoy_deviation", AnomalySeverity.WARNING, false));

        assertThat(stored.getId()).isNotBlank();
        assertThat(stored.getStatus()).isEqualTo(AnomalyStatus.NEW);
        assertThat(stored.getDetectedAt()).isEqualTo(NOW);
        assertThat(repository.findById(stored.getId())).contains(stored);
    }

    @Test
    void upsert_sameRecordAndType_updatesInPlace() {
        StoredAnomaly first = repository.upsert(
                createDetectedAnomaly("REC-1", "yoy_deviation", AnomalySeverity.WARNING, false));
        repository.updateStatus(first.getId(), AnomalyStatus.ACKNOWLEDGED);

        StoredAnomaly second = repository.upsert(
                createDetectedAnomaly("REC-1", "yoy_deviation", AnomalySeverity.CRITICAL, false));

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(second.getStatus()).isEqualTo(AnomalyStatus.ACKNOWLEDGED);
        assertThat(repository.findAll()).hasSize(1);
    }

    @Test
    void findByCostRecordId_returnsOnlyThatRecord() {
        repository.upsert(createDetectedAnomaly("REC-1", "yoy_deviation", AnomalySeverity.WARNING, false));
        repository.upsert(createDetectedAnomaly("REC-1", "budget_exceeded", AnomalySeverity.INFO, false));
        repository.upsert(createDetectedAnomaly("REC-2", "yoy_deviation", AnomalySeverity.WARNING, false));

        List<StoredAnomaly> found = repository.findByCostRecordId("REC-1");

        assertThat(found).extracting(StoredAnomaly::getType)
                .containsExactly("budget_exceeded", "yoy_deviation");
    }

    @Test
    void updateStatus_unknownId_returnsEmpty() {
        assertThat(repository.updateStatus("missing", AnomalyStatus.RESOLVED)).isEmpty();
    }

    @Test
    void returnedCopies_doNotLeakMutations() {
        StoredAnomaly stored = repository.upsert(
                createDetectedAnomaly("REC-1", "yoy_deviation", AnomalySeverity.WARNING, false));

        stored.setStatus(AnomalyStatus.FALSE_POSITIVE);

        assertThat(repository.findById(stored.getId()).orElseThrow().getStatus()).isEqualTo(AnomalyStatus.NEW);
    }
}
