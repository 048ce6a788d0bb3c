package com.costwatch.anomaly.engine;

import com.costwatch.anomaly.engine.checks.BudgetExceededCheck;
import com.costwatch.anomaly.engine.checks.DuplicateDetectionCheck;
import com.costwatch.anomaly.engine.checks.MissingPeriodCheck;
import com.costwatch.anomaly.engine.checks.MomDeviationCheck;
import com.costwatch.anomaly.engine.checks.PricePerUnitSpikeCheck;
import com.costwatch.anomaly.engine.checks.SeasonalAnomalyCheck;
import com.costwatch.anomaly.engine.checks.StatisticalOutlierCheck;
import com.costwatch.anomaly.engine.checks.YoyDeviationCheck;
import com.costwatch.anomaly.model.CostType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, fixed set of anomaly checks. Registration order is execution order.
 */
@Component
public class CheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(CheckRegistry.class);

    private final Map<String, AnomalyCheck> checksById = new LinkedHashMap<>();

    public CheckRegistry(List<AnomalyCheck> checks) {
        for (AnomalyCheck check : checks) {
            if (checksById.putIfAbsent(check.getId(), check) != null) {
                throw new IllegalStateException("Duplicate anomaly check id: " + check.getId());
            }
            log.info("Registered anomaly check: {} -> {}", check.getId(), check.getClass().getSimpleName());
        }
    }

    /**
     * The standard catalogue, for use outside a Spring context.
     */
    public static CheckRegistry defaultRegistry() {
        return new CheckRegistry(List.of(
                new YoyDeviationCheck(),
                new MomDeviationCheck(),
                new PricePerUnitSpikeCheck(),
                new StatisticalOutlierCheck(),
                new DuplicateDetectionCheck(),
                new MissingPeriodCheck(),
                new SeasonalAnomalyCheck(),
                new BudgetExceededCheck()));
    }

    public List<AnomalyCheck> getAll() {
        return List.copyOf(checksById.values());
    }

    public List<String> getAllIds() {
        return List.copyOf(checksById.keySet());
    }

    public Optional<AnomalyCheck> getById(String checkId) {
        return Optional.ofNullable(checksById.get(checkId));
    }

    public boolean contains(String checkId) {
        return checksById.containsKey(checkId);
    }

    /**
     * Select the checks to run for a record: enabled ids first, then the optional
     * explicit id filter, then the cost type.
     *
     * @param costType   cost type of the record under evaluation
     * @param enabledIds ids enabled in the active settings
     * @param checkIds   optional explicit filter; null or empty means no filter
     */
    public List<AnomalyCheck> getChecksToRun(CostType costType, Collection<String> enabledIds,
                                             Collection<String> checkIds) {
        boolean filterByIds = checkIds != null && !checkIds.isEmpty();
        return checksById.values().stream()
                .filter(check -> enabledIds.contains(check.getId()))
                .filter(check -> !filterByIds || checkIds.contains(check.getId()))
                .filter(check -> check.appliesTo(costType))
                .toList();
    }
}
