package com.costguard.service.budget;

import com.costguard.exception.InvalidBudgetConfigException;
import com.costguard.model.budget.AlertConfig;
import com.costguard.model.budget.BudgetsConfig;
import com.costguard.model.budget.ScopedBudget;
import com.costguard.model.budget.TagBudget;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BudgetConfigValidatorTest {

    private final BudgetConfigValidator validator = new BudgetConfigValidator();

    private BudgetsConfig.BudgetsConfigBuilder validConfig() {
        return BudgetsConfig.builder()
                .global(ScopedBudget.of(10000, "USD"))
                .providers(Map.of("aws", ScopedBudget.of(5000, "USD")))
                .types(Map.of("aws:ec2/instance", ScopedBudget.of(2000, "")))
                .tags(List.of(TagBudget.of("team:platform", 100, 3000, "USD")));
    }

    @Test
    void testValidConfigHasNoWarnings() {
        assertTrue(validator.validate(validConfig().build()).isEmpty());
        assertTrue(validator.validate(null).isEmpty());
    }

    @Test
    void testScopedBudgetsRequireGlobal() {
        assertThrows(InvalidBudgetConfigException.class,
                () -> validator.validate(validConfig().global(null).build()));
        assertThrows(InvalidBudgetConfigException.class,
                () -> validator.validate(validConfig().global(ScopedBudget.of(0, "USD")).build()));
    }

    @Test
    void testNegativeAmountRejected() {
        BudgetsConfig config = validConfig()
                .providers(Map.of("aws", ScopedBudget.of(-1, "USD")))
                .build();
        assertThrows(InvalidBudgetConfigException.class, () -> validator.validate(config));
    }

    @Test
    void testOnlyMonthlyPeriodSupported() {
        ScopedBudget weekly = ScopedBudget.builder().amount(10).currency("USD").period("weekly").build();
        assertThrows(InvalidBudgetConfigException.class,
                () -> validator.validate(validConfig().providers(Map.of("aws", weekly)).build()));

        ScopedBudget monthly = ScopedBudget.builder().amount(10).currency("USD").period("monthly").build();
        assertDoesNotThrow(() -> validator.validate(validConfig().providers(Map.of("aws", monthly)).build()));
    }

    @Test
    void testCurrencyRules() {
        assertThrows(InvalidBudgetConfigException.class,
                () -> validator.validate(validConfig().providers(Map.of("aws", ScopedBudget.of(1, "usd"))).build()));
        assertThrows(InvalidBudgetConfigException.class,
                () -> validator.validate(validConfig().providers(Map.of("aws", ScopedBudget.of(1, "EUR"))).build()));
    }

    @Test
    void testAlertThresholdRange() {
        ScopedBudget budget = ScopedBudget.builder()
                .amount(10)
                .currency("USD")
                .alerts(List.of(AlertConfig.actual(1001)))
                .build();
        assertThrows(InvalidBudgetConfigException.class,
                () -> validator.validate(validConfig().providers(Map.of("aws", budget)).build()));
    }

    @Test
    void testInvalidTagSelectorRejected() {
        BudgetsConfig config = validConfig()
                .tags(List.of(TagBudget.of("team=platform", 1, 100, "USD")))
                .build();
        InvalidBudgetConfigException e = assertThrows(InvalidBudgetConfigException.class,
                () -> validator.validate(config));
        assertTrue(e.getMessage().contains("team=platform"));
    }

    @Test
    void testDuplicateSelectorRejected() {
        BudgetsConfig config = validConfig()
                .tags(List.of(
                        TagBudget.of("team:platform", 10, 100, "USD"),
                        TagBudget.of("team:platform", 20, 100, "USD")))
                .build();

        InvalidBudgetConfigException e = assertThrows(InvalidBudgetConfigException.class,
                () -> validator.validate(config));
        assertTrue(e.getMessage().contains("duplicate"));
    }

    @Test
    void testDuplicatePrioritiesAreWarnings() {
        BudgetsConfig config = validConfig()
                .tags(List.of(
                        TagBudget.of("team:platform", 100, 100, "USD"),
                        TagBudget.of("team:backend", 100, 100, "USD"),
                        TagBudget.of("env:*", 1, 100, "USD")))
                .build();

        List<String> warnings = validator.validate(config);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("100"));
    }
}
