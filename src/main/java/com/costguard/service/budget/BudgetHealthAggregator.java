package com.costguard.service.budget;

import com.costguard.model.budget.BudgetHealth;
import com.costguard.model.budget.BudgetSummary;
import com.costguard.model.budget.ExtendedBudgetSummary;
import com.costguard.model.budget.ScopedBudgetResult;
import com.costguard.model.budget.ScopedBudgetStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeMap;

/**
 * Health thresholds and worst-wins aggregation across budget scopes.
 *
 * Ordering: UNSPECIFIED < OK < WARNING < CRITICAL < EXCEEDED.
 */
@Slf4j
public final class BudgetHealthAggregator {

    public static final double WARNING_THRESHOLD = 80.0;
    public static final double CRITICAL_THRESHOLD = 90.0;
    public static final double EXCEEDED_THRESHOLD = 100.0;

    private BudgetHealthAggregator() {
    }

    /**
     * Map a utilization percentage to a health state. Lower bounds are inclusive.
     * Negative percentages are OK.
     */
    public static BudgetHealth calculateHealthFromPercentage(double percentage) {
        if (percentage >= EXCEEDED_THRESHOLD) {
            return BudgetHealth.EXCEEDED;
        }
        if (percentage >= CRITICAL_THRESHOLD) {
            return BudgetHealth.CRITICAL;
        }
        if (percentage >= WARNING_THRESHOLD) {
            return BudgetHealth.WARNING;
        }
        return BudgetHealth.OK;
    }

    /**
     * Most severe state in the list, UNSPECIFIED if the list is empty.
     */
    public static BudgetHealth aggregateHealthStatuses(Collection<BudgetHealth> statuses) {
        BudgetHealth worst = BudgetHealth.UNSPECIFIED;
        if (statuses == null) {
            return worst;
        }
        for (BudgetHealth status : statuses) {
            if (status != null && status.isWorseThan(worst)) {
                worst = status;
            }
        }
        return worst;
    }

    /**
     * Worst health across global, provider, tag and type statuses of a result.
     */
    public static BudgetHealth calculateOverallHealth(ScopedBudgetResult result) {
        if (result == null) {
            return BudgetHealth.UNSPECIFIED;
        }

        List<BudgetHealth> statuses = new ArrayList<>();
        for (ScopedBudgetStatus status : scopesOf(result)) {
            if (status != null) {
                statuses.add(status.getHealth());
            }
        }

        return aggregateHealthStatuses(statuses);
    }

    /**
     * Identifiers of scopes whose health is CRITICAL or EXCEEDED.
     * Order: global, providers by key, tags in result order, types by key.
     */
    public static List<String> identifyCriticalScopes(ScopedBudgetResult result) {
        List<String> critical = new ArrayList<>();
        if (result == null) {
            return critical;
        }

        scopesOf(result).forEach(status -> addIfCritical(critical, status));

        return critical;
    }

    /**
     * Count scopes per health state. Scopes with no status or an UNSPECIFIED health
     * count toward the total only, and are logged.
     */
    public static BudgetSummary summarize(ScopedBudgetResult result) {
        BudgetSummary summary = new BudgetSummary();
        for (ScopedBudgetStatus status : scopesOf(result)) {
            BudgetHealth health = status == null ? null : status.getHealth();
            if (health == null || health == BudgetHealth.UNSPECIFIED) {
                log.warn("Budget scope {} has no health status, excluded from health counts",
                        status == null ? "<null>" : status.getScopeIdentifier());
            }
            summary.record(health);
        }
        return summary;
    }

    /**
     * Summary broken down by scope type and currency, plus critical scopes and overall health.
     */
    public static ExtendedBudgetSummary summarizeExtended(ScopedBudgetResult result) {
        ExtendedBudgetSummary extended = ExtendedBudgetSummary.builder()
                .summary(summarize(result))
                .criticalScopes(identifyCriticalScopes(result))
                .overallHealth(calculateOverallHealth(result))
                .build();

        for (ScopedBudgetStatus status : scopesOf(result)) {
            if (status == null || status.getScopeType() == null) {
                continue;
            }
            extended.getByScopeType()
                    .computeIfAbsent(status.getScopeType().getPrefix(), k -> new BudgetSummary())
                    .record(status.getHealth());

            String currency = status.getCurrency();
            if (currency != null && !currency.isEmpty()) {
                extended.getByCurrency()
                        .computeIfAbsent(currency, k -> new BudgetSummary())
                        .record(status.getHealth());
            }
        }

        log.debug("Budget summary: total={}, critical={}, overall={}",
                extended.getSummary().getTotalBudgets(), extended.getCriticalScopes().size(),
                extended.getOverallHealth());
        return extended;
    }

    /**
     * Every scope slot of the result, nulls included: global, providers by key, tags, types by key.
     */
    private static List<ScopedBudgetStatus> scopesOf(ScopedBudgetResult result) {
        List<ScopedBudgetStatus> scopes = new ArrayList<>();
        if (result == null) {
            return scopes;
        }
        if (result.getGlobal() != null) {
            scopes.add(result.getGlobal());
        }
        if (result.getByProvider() != null) {
            scopes.addAll(new TreeMap<>(result.getByProvider()).values());
        }
        if (result.getByTag() != null) {
            scopes.addAll(result.getByTag());
        }
        if (result.getByType() != null) {
            scopes.addAll(new TreeMap<>(result.getByType()).values());
        }
        return scopes;
    }

    private static void addIfCritical(List<String> critical, ScopedBudgetStatus status) {
        if (status != null && status.getHealth() != null && status.getHealth().isCriticalOrExceeded()) {
            critical.add(status.getScopeIdentifier());
        }
    }
}
