package com.costwatch.anomaly.repository;

import com.costwatch.anomaly.model.AnomalyStatus;
import com.costwatch.anomaly.model.DetectedAnomaly;
import com.costwatch.anomaly.model.StoredAnomaly;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryAnomalyRepository implements AnomalyRepository {

    private final Map<String, StoredAnomaly> storage = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryAnomalyRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public StoredAnomaly upsert(DetectedAnomaly anomaly) {
        String key = key(anomaly.getCostRecordId(), anomaly.getType());
        StoredAnomaly stored = storage.compute(key, (k, existing) -> {
            StoredAnomaly.StoredAnomalyBuilder builder = existing != null
                    ? existing.toBuilder()
                    : StoredAnomaly.builder()
                            .id(UUID.randomUUID().toString())
                            .costRecordId(anomaly.getCostRecordId())
                            .type(anomaly.getType())
                            .status(AnomalyStatus.NEW)
                            .detectedAt(clock.instant());
            return builder
                    .severity(anomaly.getSeverity())
                    .message(anomaly.getMessage())
                    .details(anomaly.getDetails())
                    .backfill(anomaly.isBackfill())
                    .build();
        });
        return stored.toBuilder().build();
    }

    @Override
    public Optional<StoredAnomaly> findById(String anomalyId) {
        return storage.values().stream()
                .filter(a -> a.getId().equals(anomalyId))
                .findFirst()
                .map(a -> a.toBuilder().build());
    }

    @Override
    public List<StoredAnomaly> findByCostRecordId(String costRecordId) {
        return storage.values().stream()
                .filter(a -> a.getCostRecordId().equals(costRecordId))
                .sorted(Comparator.comparing(StoredAnomaly::getType))
                .map(a -> a.toBuilder().build())
                .toList();
    }

    @Override
    public List<StoredAnomaly> findAll() {
        return storage.values().stream()
                .sorted(Comparator.comparing(StoredAnomaly::getDetectedAt).reversed()
                        .thenComparing(StoredAnomaly::getCostRecordId)
                        .thenComparing(StoredAnomaly::getType))
                .map(a -> a.toBuilder().build())
                .toList();
    }

    @Override
    public Optional<StoredAnomaly> updateStatus(String anomalyId, AnomalyStatus status) {
        for (Map.Entry<String, StoredAnomaly> entry : storage.entrySet()) {
            if (entry.getValue().getId().equals(anomalyId)) {
                StoredAnomaly updated = storage.computeIfPresent(entry.getKey(),
                        (k, existing) -> existing.toBuilder().status(status).build());
                return Optional.ofNullable(updated).map(a -> a.toBuilder().build());
            }
        }
        return Optional.empty();
    }

    private static String key(String costRecordId, String type) {
        return costRecordId + ":" + type;
    }
}
