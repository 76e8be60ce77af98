package com.costguard.service.budget;

import com.costguard.exception.InvalidBudgetConfigException;
import com.costguard.model.budget.AlertConfig;
import com.costguard.model.budget.BudgetsConfig;
import com.costguard.model.budget.ScopedBudget;
import com.costguard.model.budget.TagBudget;
import com.costguard.model.budget.TagSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Validates a budget hierarchy before evaluation.
 * Structural problems throw {@link InvalidBudgetConfigException}; suspicious but
 * usable settings (duplicate tag priorities) come back as warnings.
 */
@Slf4j
@Component
public class BudgetConfigValidator {

    private static final Pattern CURRENCY_PATTERN = Pattern.compile("^[A-Z]{3}$");
    private static final double MAX_ALERT_THRESHOLD = 1000.0;

    public List<String> validate(BudgetsConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }

        if (config.getGlobal() != null) {
            validateBudget("global", config.getGlobal(), null);
        }

        if (config.hasScopedBudgets() && !config.hasGlobalBudget()) {
            throw new InvalidBudgetConfigException(
                    "scoped budgets (providers, tags, types) require a global budget with a positive amount");
        }

        String globalCurrency = config.globalCurrency();

        if (config.getProviders() != null) {
            for (Map.Entry<String, ScopedBudget> entry : new TreeMap<>(config.getProviders()).entrySet()) {
                if (entry.getKey() == null || entry.getKey().isBlank()) {
                    throw new InvalidBudgetConfigException("provider budget name cannot be empty");
                }
                validateBudget("provider " + entry.getKey(), entry.getValue(), globalCurrency);
            }
        }

        if (config.getTypes() != null) {
            for (Map.Entry<String, ScopedBudget> entry : new TreeMap<>(config.getTypes()).entrySet()) {
                if (entry.getKey() == null || entry.getKey().isBlank()) {
                    throw new InvalidBudgetConfigException("resource type budget key cannot be empty");
                }
                validateBudget("type " + entry.getKey(), entry.getValue(), globalCurrency);
            }
        }

        if (config.getTags() != null) {
            warnings.addAll(validateTags(config.getTags(), globalCurrency));
        }

        warnings.forEach(warning -> log.warn("Budget configuration: {}", warning));
        return warnings;
    }

    private List<String> validateTags(List<TagBudget> tags, String globalCurrency) {
        Map<Integer, List<String>> byPriority = new TreeMap<>();
        Set<String> seenSelectors = new HashSet<>();

        for (TagBudget tag : tags) {
            try {
                TagSelector.parse(tag.getSelector());
            } catch (IllegalArgumentException e) {
                throw new InvalidBudgetConfigException(e.getMessage());
            }
            if (!seenSelectors.add(tag.getSelector())) {
                throw new InvalidBudgetConfigException("duplicate tag budget selector: " + tag.getSelector());
            }
            if (tag.getBudget() == null) {
                throw new InvalidBudgetConfigException("tag budget " + tag.getSelector() + " has no budget");
            }
            validateBudget("tag " + tag.getSelector(), tag.getBudget(), globalCurrency);
            byPriority.computeIfAbsent(tag.getPriority(), p -> new ArrayList<>()).add(tag.getSelector());
        }

        List<String> warnings = new ArrayList<>();
        byPriority.forEach((priority, selectors) -> {
            if (selectors.size() > 1) {
                warnings.add(String.format(
                        "tag budgets %s share priority %d; overlapping resources go to the first alphabetically",
                        selectors, priority));
            }
        });
        return warnings;
    }

    private void validateBudget(String scope, ScopedBudget budget, String globalCurrency) {
        if (budget == null) {
            throw new InvalidBudgetConfigException(scope + ": budget cannot be null");
        }
        if (budget.getAmount() < 0) {
            throw new InvalidBudgetConfigException(scope + ": amount cannot be negative: " + budget.getAmount());
        }

        String period = budget.getPeriod();
        if (period != null && !period.isEmpty() && !ScopedBudget.DEFAULT_PERIOD.equals(period)) {
            throw new InvalidBudgetConfigException(scope + ": unsupported period \"" + period
                    + "\", only \"" + ScopedBudget.DEFAULT_PERIOD + "\" is supported");
        }

        String currency = budget.getCurrency();
        if (currency != null && !currency.isEmpty()) {
            if (!CURRENCY_PATTERN.matcher(currency).matches()) {
                throw new InvalidBudgetConfigException(scope + ": invalid currency code \"" + currency + "\"");
            }
            if (globalCurrency != null && !globalCurrency.isEmpty() && !globalCurrency.equals(currency)) {
                throw new InvalidBudgetConfigException(scope + ": currency " + currency
                        + " does not match global currency " + globalCurrency);
            }
        }

        if (budget.getAlerts() != null) {
            for (AlertConfig alert : budget.getAlerts()) {
                if (alert.getThreshold() < 0 || alert.getThreshold() > MAX_ALERT_THRESHOLD) {
                    throw new InvalidBudgetConfigException(scope + ": alert threshold must be between 0 and "
                            + (int) MAX_ALERT_THRESHOLD + ": " + alert.getThreshold());
                }
                if (alert.getType() == null) {
                    throw new InvalidBudgetConfigException(scope + ": alert type is required");
                }
            }
        }
    }
}
