package com.costguard.model.budget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Threshold percentage of a budget at which an alert fires.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertConfig {

    /**
     * Percentage of the budget, e.g. 80.0.
     */
    private double threshold;

    @Builder.Default
    private AlertType type = AlertType.ACTUAL;

    public static AlertConfig actual(double threshold) {
        return new AlertConfig(threshold, AlertType.ACTUAL);
    }
}
