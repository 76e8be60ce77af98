package com.costguard.model.budget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Evaluated state of one alert threshold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdStatus {

    private double threshold;

    private AlertType type;

    private State status;

    public enum State {
        OK,
        APPROACHING,
        EXCEEDED
    }
}
