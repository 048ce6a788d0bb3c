package com.costwatch.anomaly.engine;

import com.costwatch.anomaly.model.CheckResult;
import com.costwatch.anomaly.model.CostRecordToCheck;
import com.costwatch.anomaly.model.CostType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Interface for all anomaly checks.
 * Implementations are stateless: the result must depend only on the record and the context.
 */
public interface AnomalyCheck {

    Set<CostType> ALL_COST_TYPES = Collections.unmodifiableSet(EnumSet.allOf(CostType.class));

    /**
     * Stable identifier, also used as the anomaly type.
     */
    String getId();

    String getName();

    String getDescription();

    /**
     * Cost types this check applies to. Defaults to every type.
     */
    default Set<CostType> getApplicableCostTypes() {
        return ALL_COST_TYPES;
    }

    /**
     * Months of history required before the engine runs this check. 0 means no requirement.
     */
    default int getMinHistoricalMonths() {
        return 0;
    }

    default boolean appliesTo(CostType costType) {
        return getApplicableCostTypes().contains(costType);
    }

    /**
     * Evaluate a cost record against this check.
     *
     * @param record  the record under evaluation
     * @param context historical and reference data, plus the active settings
     * @return the result; {@link CheckResult#notTriggered()} when the condition is not met
     */
    CheckResult check(CostRecordToCheck record, CheckContext context);
}
