package com.costguard.service.budget;

import com.costguard.model.CostLineItem;
import com.costguard.model.budget.AlertConfig;
import com.costguard.model.budget.AlertType;
import com.costguard.model.budget.BudgetAllocation;
import com.costguard.model.budget.BudgetsConfig;
import com.costguard.model.budget.ScopeType;
import com.costguard.model.budget.ScopedBudget;
import com.costguard.model.budget.ScopedBudgetResult;
import com.costguard.model.budget.ScopedBudgetStatus;
import com.costguard.model.budget.TagBudget;
import com.costguard.model.budget.TagSelector;
import com.costguard.model.budget.ThresholdStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps resource costs onto every budget scope they match and evaluates per-scope status.
 *
 * Scopes a cost is allocated to:
 * - "global" whenever a global budget is configured
 * - "provider:{name}" if the resource's provider has a budget (case-insensitive)
 * - "tag:{selector}" for the single highest-priority matching tag budget
 * - "type:{resourceType}" if that exact type has a budget (case-sensitive)
 *
 * Read-only over its configuration after construction; safe to share across threads.
 * Nothing here throws for missing budgets: absence means nothing is allocated at that scope.
 */
@Slf4j
public class ScopedBudgetEvaluator {

    static final double APPROACHING_BUFFER = 5.0;

    private static final List<AlertConfig> DEFAULT_ALERTS = List.of(
            AlertConfig.actual(50.0),
            AlertConfig.actual(80.0),
            AlertConfig.actual(100.0)
    );

    private final BudgetsConfig config;
    private final Clock clock;
    private final Map<String, ScopedBudget> providerIndex;
    private final List<ParsedTagBudget> tagBudgets;
    private final Map<String, ScopedBudget> typeIndex;

    public ScopedBudgetEvaluator(BudgetsConfig config) {
        this(config, Clock.systemUTC());
    }

    public ScopedBudgetEvaluator(BudgetsConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.providerIndex = new HashMap<>();
        this.typeIndex = new HashMap<>();

        if (config == null) {
            this.tagBudgets = List.of();
            return;
        }

        if (config.getProviders() != null) {
            config.getProviders().forEach((name, budget) -> {
                if (budget != null) {
                    providerIndex.put(name.toLowerCase(Locale.ROOT), budget);
                }
            });
        }

        if (config.getTypes() != null) {
            config.getTypes().forEach((type, budget) -> {
                if (budget != null) {
                    typeIndex.put(type, budget);
                }
            });
        }

        this.tagBudgets = parseTagBudgets(config.getTags());
    }

    /**
     * Parse selectors once, sorted by priority (descending, stable). Invalid selectors are skipped,
     * and for a selector listed twice only the highest-priority (first listed on a tie) entry is kept.
     */
    private static List<ParsedTagBudget> parseTagBudgets(List<TagBudget> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }

        List<ParsedTagBudget> parsed = new ArrayList<>(tags.size());
        for (TagBudget tag : tags) {
            try {
                parsed.add(new ParsedTagBudget(tag, TagSelector.parse(tag.getSelector())));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid tag selector '{}' - this budget will not be applied: {}",
                        tag.getSelector(), e.getMessage());
            }
        }

        parsed.sort(Comparator.comparingInt((ParsedTagBudget p) -> p.budget().getPriority()).reversed());

        // One budget per selector: spend is accumulated by selector
        Set<String> seen = new HashSet<>();
        List<ParsedTagBudget> unique = new ArrayList<>(parsed.size());
        for (ParsedTagBudget candidate : parsed) {
            if (seen.add(candidate.budget().getSelector())) {
                unique.add(candidate);
            } else {
                log.warn("Ignoring duplicate tag budget '{}' with priority {}; a higher-priority budget uses it",
                        candidate.budget().getSelector(), candidate.budget().getPriority());
            }
        }
        return Collections.unmodifiableList(unique);
    }

    /**
     * Budget for a provider, matched case-insensitively.
     */
    public Optional<ScopedBudget> getProviderBudget(String provider) {
        if (provider == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providerIndex.get(provider.toLowerCase(Locale.ROOT)));
    }

    /**
     * Budget for a resource type, exact case-sensitive match.
     */
    public Optional<ScopedBudget> getTypeBudget(String resourceType) {
        if (resourceType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(typeIndex.get(resourceType));
    }

    /**
     * Provider prefix of a resource type, lower-cased.
     * "aws:ec2/instance" → "aws", "unknown" → "unknown", "" → "", ":x" → "".
     */
    public static String extractProvider(String resourceType) {
        if (resourceType == null) {
            return "";
        }
        int idx = resourceType.indexOf(':');
        if (idx == 0) {
            return "";
        }
        String prefix = idx > 0 ? resourceType.substring(0, idx) : resourceType;
        return prefix.toLowerCase(Locale.ROOT);
    }

    /**
     * All tag budgets whose selector matches the tags, highest priority first.
     */
    public List<TagBudget> matchTagBudgets(Map<String, String> tags) {
        if (tags == null || tags.isEmpty() || tagBudgets.isEmpty()) {
            return List.of();
        }

        return tagBudgets.stream()
                .filter(parsed -> parsed.selector().matches(tags))
                .map(ParsedTagBudget::budget)
                .collect(Collectors.toList());
    }

    /**
     * Pick the highest-priority match. Ties go to the selector that sorts first,
     * with one warning naming the tied priority.
     *
     * @param matches matches in descending priority order, as returned by {@link #matchTagBudgets}
     */
    public TagSelection selectHighestPriorityTagBudget(List<TagBudget> matches) {
        if (matches == null || matches.isEmpty()) {
            return new TagSelection(null, List.of());
        }

        int topPriority = matches.stream().mapToInt(TagBudget::getPriority).max().getAsInt();
        List<TagBudget> tied = matches.stream()
                .filter(match -> match.getPriority() == topPriority)
                .sorted(Comparator.comparing(TagBudget::getSelector))
                .collect(Collectors.toList());

        TagBudget selected = tied.get(0);
        if (tied.size() == 1) {
            return new TagSelection(selected, List.of());
        }

        List<String> selectors = tied.stream().map(TagBudget::getSelector).collect(Collectors.toList());
        String warning = String.format("overlapping tag budgets with same priority %d: %s - selected \"%s\"",
                topPriority, selectors, selected.getSelector());

        log.warn("Overlapping tag budgets without unique priority: priority={}, selectors={}, selected={}",
                topPriority, selectors, selected.getSelector());

        return new TagSelection(selected, List.of(warning));
    }

    /**
     * Provider scope contribution of one resource.
     */
    public BudgetAllocation allocateCostToProvider(String resourceType, double cost) {
        BudgetAllocation allocation = newAllocation(resourceType, cost);
        String provider = allocation.getProvider();

        if (!provider.isEmpty() && getProviderBudget(provider).isPresent()) {
            allocation.getAllocatedScopes().add(ScopeType.PROVIDER.identifier(provider));
            log.debug("Allocated {} to provider budget {} (type={})", cost, provider, resourceType);
        }
        return allocation;
    }

    /**
     * Tag scope contribution of one resource: all matches are recorded, only the selected one is allocated.
     */
    public BudgetAllocation allocateCostToTag(String resourceType, Map<String, String> tags, double cost) {
        BudgetAllocation allocation = newAllocation(resourceType, cost);

        List<TagBudget> matches = matchTagBudgets(tags);
        if (matches.isEmpty()) {
            return allocation;
        }

        matches.forEach(match -> allocation.getMatchedTags().add(match.getSelector()));

        TagSelection selection = selectHighestPriorityTagBudget(matches);
        selection.getSelected().ifPresent(selected -> {
            allocation.setSelectedTagBudget(selected.getSelector());
            allocation.getAllocatedScopes().add(ScopeType.TAG.identifier(selected.getSelector()));
            allocation.getWarnings().addAll(selection.getWarnings());

            log.debug("Allocated {} to tag budget {} (priority={}, matched={})",
                    cost, selected.getSelector(), selected.getPriority(), allocation.getMatchedTags());
        });
        return allocation;
    }

    /**
     * Type scope contribution of one resource.
     */
    public BudgetAllocation allocateCostToType(String resourceType, double cost) {
        BudgetAllocation allocation = newAllocation(resourceType, cost);

        if (getTypeBudget(resourceType).isPresent()) {
            allocation.getAllocatedScopes().add(ScopeType.TYPE.identifier(resourceType));
            log.debug("Allocated {} to type budget {}", cost, resourceType);
        }
        return allocation;
    }

    /**
     * Allocate a resource's cost to every applicable scope.
     */
    public BudgetAllocation allocateCosts(String resourceType, Map<String, String> tags, double cost) {
        BudgetAllocation allocation = newAllocation(resourceType, cost);

        if (config != null && config.hasGlobalBudget()) {
            allocation.getAllocatedScopes().add(ScopeType.GLOBAL.identifier(null));
        }

        allocation.getAllocatedScopes().addAll(allocateCostToProvider(resourceType, cost).getAllocatedScopes());

        if (tags != null && !tags.isEmpty() && !tagBudgets.isEmpty()) {
            BudgetAllocation tagAllocation = allocateCostToTag(resourceType, tags, cost);
            if (tagAllocation.getSelectedTagBudget() != null) {
                allocation.getAllocatedScopes().addAll(tagAllocation.getAllocatedScopes());
                allocation.setMatchedTags(tagAllocation.getMatchedTags());
                allocation.setSelectedTagBudget(tagAllocation.getSelectedTagBudget());
                allocation.getWarnings().addAll(tagAllocation.getWarnings());
            }
        }

        allocation.getAllocatedScopes().addAll(allocateCostToType(resourceType, cost).getAllocatedScopes());

        log.debug("Allocated {} for {} to scopes {}", cost, resourceType, allocation.getAllocatedScopes());
        return allocation;
    }

    public BudgetAllocation allocateCosts(CostLineItem item) {
        BudgetAllocation allocation = allocateCosts(item.getResourceType(), item.getTags(), item.getMonthlyCost());
        allocation.setResourceId(item.getResourceId());
        return allocation;
    }

    /**
     * Allocate every line item and evaluate all configured scopes.
     * Every configured scope gets a status, even with zero spend.
     */
    public ScopedBudgetResult evaluate(List<CostLineItem> items) {
        ScopeAccumulator global = new ScopeAccumulator();
        Map<String, ScopeAccumulator> byProvider = new HashMap<>();
        Map<String, ScopeAccumulator> byTag = new HashMap<>();
        Map<String, ScopeAccumulator> byType = new HashMap<>();
        List<BudgetAllocation> allocations = new ArrayList<>();
        Set<String> warnings = new LinkedHashSet<>();

        for (CostLineItem item : items == null ? List.<CostLineItem>of() : items) {
            BudgetAllocation allocation = allocateCosts(item);
            allocations.add(allocation);
            warnings.addAll(allocation.getWarnings());

            for (String scope : allocation.getAllocatedScopes()) {
                if (scope.equals(ScopeType.GLOBAL.identifier(null))) {
                    global.add(allocation.getCost());
                } else if (scope.startsWith(ScopeType.PROVIDER.getPrefix() + ":")) {
                    byProvider.computeIfAbsent(allocation.getProvider(), k -> new ScopeAccumulator())
                            .add(allocation.getCost());
                } else if (scope.startsWith(ScopeType.TAG.getPrefix() + ":")) {
                    byTag.computeIfAbsent(allocation.getSelectedTagBudget(), k -> new ScopeAccumulator())
                            .add(allocation.getCost());
                } else if (scope.startsWith(ScopeType.TYPE.getPrefix() + ":")) {
                    byType.computeIfAbsent(allocation.getResourceType(), k -> new ScopeAccumulator())
                            .add(allocation.getCost());
                }
            }
        }

        ScopedBudgetResult result = ScopedBudgetResult.builder()
                .allocations(allocations)
                .build();

        if (config != null && config.hasGlobalBudget()) {
            result.setGlobal(withCount(calculateGlobalBudgetStatus(config.getGlobal(), global.spend), global));
        }

        Map<String, ScopedBudgetStatus> providerStatuses = new LinkedHashMap<>();
        providerIndex.keySet().stream().sorted().forEach(provider -> {
            ScopeAccumulator acc = byProvider.getOrDefault(provider, new ScopeAccumulator());
            providerStatuses.put(provider, withCount(
                    calculateProviderBudgetStatus(provider, providerIndex.get(provider), acc.spend), acc));
        });
        result.setByProvider(providerStatuses);

        List<ScopedBudgetStatus> tagStatuses = new ArrayList<>();
        for (ParsedTagBudget parsed : tagBudgets) {
            ScopeAccumulator acc = byTag.getOrDefault(parsed.budget().getSelector(), new ScopeAccumulator());
            tagStatuses.add(withCount(calculateTagBudgetStatus(parsed.budget(), acc.spend), acc));
        }
        result.setByTag(tagStatuses);

        Map<String, ScopedBudgetStatus> typeStatuses = new LinkedHashMap<>();
        typeIndex.keySet().stream().sorted().forEach(type -> {
            ScopeAccumulator acc = byType.getOrDefault(type, new ScopeAccumulator());
            typeStatuses.put(type, withCount(calculateTypeBudgetStatus(type, typeIndex.get(type), acc.spend), acc));
        });
        result.setByType(typeStatuses);

        result.setOverallHealth(BudgetHealthAggregator.calculateOverallHealth(result));
        result.setCriticalScopes(BudgetHealthAggregator.identifyCriticalScopes(result));
        result.setWarnings(new ArrayList<>(warnings));
        result.setSummary(BudgetHealthAggregator.summarizeExtended(result));

        log.debug("Evaluated {} line items: overall={}, critical={}",
                allocations.size(), result.getOverallHealth(), result.getCriticalScopes());
        return result;
    }

    public ScopedBudgetStatus calculateGlobalBudgetStatus(ScopedBudget budget, double currentSpend) {
        return buildStatus(ScopeType.GLOBAL, "", budget, currentSpend);
    }

    public ScopedBudgetStatus calculateProviderBudgetStatus(String provider, ScopedBudget budget, double currentSpend) {
        return buildStatus(ScopeType.PROVIDER, provider, budget, currentSpend);
    }

    public ScopedBudgetStatus calculateTagBudgetStatus(TagBudget tagBudget, double currentSpend) {
        ScopedBudget budget = tagBudget.getBudget() != null ? tagBudget.getBudget() : new ScopedBudget();
        return buildStatus(ScopeType.TAG, tagBudget.getSelector(), budget, currentSpend);
    }

    public ScopedBudgetStatus calculateTypeBudgetStatus(String resourceType, ScopedBudget budget, double currentSpend) {
        return buildStatus(ScopeType.TYPE, resourceType, budget, currentSpend);
    }

    private ScopedBudgetStatus buildStatus(ScopeType type, String key, ScopedBudget budget, double currentSpend) {
        double percentage = percentageOf(currentSpend, budget.getAmount());

        ScopedBudgetStatus status = ScopedBudgetStatus.builder()
                .scopeType(type)
                .scopeKey(key)
                .budget(budget)
                .currentSpend(currentSpend)
                .percentage(percentage)
                .health(BudgetHealthAggregator.calculateHealthFromPercentage(percentage))
                .currency(resolveCurrency(budget))
                .build();

        enrichStatus(status, budget);
        return status;
    }

    /**
     * Linear month-to-date forecast and alert threshold evaluation.
     */
    private void enrichStatus(ScopedBudgetStatus status, ScopedBudget budget) {
        if (budget.getAmount() <= 0) {
            return;
        }

        LocalDate today = LocalDate.now(clock);
        double dailyRate = status.getCurrentSpend() / today.getDayOfMonth();
        status.setForecastedSpend(dailyRate * today.lengthOfMonth());
        status.setForecastPercentage(percentageOf(status.getForecastedSpend(), budget.getAmount()));

        List<AlertConfig> alerts = budget.getAlerts() == null || budget.getAlerts().isEmpty()
                ? DEFAULT_ALERTS
                : budget.getAlerts();

        List<ThresholdStatus> evaluated = new ArrayList<>(alerts.size());
        for (AlertConfig alert : alerts) {
            double pct = alert.getType() == AlertType.FORECASTED
                    ? status.getForecastPercentage()
                    : status.getPercentage();
            evaluated.add(ThresholdStatus.builder()
                    .threshold(alert.getThreshold())
                    .type(alert.getType())
                    .status(evaluateThreshold(alert.getThreshold(), pct))
                    .build());
        }
        status.setAlerts(evaluated);
    }

    /**
     * EXCEEDED at or above the threshold; APPROACHING within 5 points below it
     * (only for thresholds above 5, to avoid false positives near zero).
     */
    static ThresholdStatus.State evaluateThreshold(double threshold, double percentage) {
        if (percentage >= threshold) {
            return ThresholdStatus.State.EXCEEDED;
        }
        if (threshold > APPROACHING_BUFFER && percentage >= threshold - APPROACHING_BUFFER) {
            return ThresholdStatus.State.APPROACHING;
        }
        return ThresholdStatus.State.OK;
    }

    private static double percentageOf(double spend, double amount) {
        if (amount <= 0) {
            return 0;
        }
        return spend / amount * 100.0;
    }

    private String resolveCurrency(ScopedBudget budget) {
        if (budget.getCurrency() != null && !budget.getCurrency().isEmpty()) {
            return budget.getCurrency();
        }
        return config == null ? null : config.globalCurrency();
    }

    private static ScopedBudgetStatus withCount(ScopedBudgetStatus status, ScopeAccumulator acc) {
        status.setMatchedResources(acc.resources);
        return status;
    }

    private BudgetAllocation newAllocation(String resourceType, double cost) {
        return BudgetAllocation.builder()
                .resourceType(resourceType)
                .provider(extractProvider(resourceType))
                .cost(cost)
                .build();
    }

    /**
     * Result of tag priority selection: the winner (if any) and tie warnings.
     */
    public static class TagSelection {
        private final TagBudget selected;
        private final List<String> warnings;

        TagSelection(TagBudget selected, List<String> warnings) {
            this.selected = selected;
            this.warnings = warnings;
        }

        public Optional<TagBudget> getSelected() {
            return Optional.ofNullable(selected);
        }

        public List<String> getWarnings() {
            return warnings;
        }
    }

    private static class ParsedTagBudget {
        private final TagBudget budget;
        private final TagSelector selector;

        ParsedTagBudget(TagBudget budget, TagSelector selector) {
            this.budget = budget;
            this.selector = selector;
        }

        TagBudget budget() {
            return budget;
        }

        TagSelector selector() {
            return selector;
        }
    }

    private static class ScopeAccumulator {
        private double spend;
        private int resources;

        void add(double cost) {
            spend += cost;
            resources++;
        }
    }
}
