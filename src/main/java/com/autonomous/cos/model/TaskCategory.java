package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskCategory {
    SELF_IMPROVEMENT("selfImprovement"),
    APP_IMPROVEMENT("appImprovement");

    private final String value;

    TaskCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TaskCategory fromValue(String value) {
        for (TaskCategory category : values()) {
            if (category.value.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown task category: " + value);
    }
}
