package com.costguard.model.budget;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {
    ACTUAL("actual"),
    FORECASTED("forecasted");

    private final String value;

    AlertType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
