package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum TaskPosition {
    TOP,
    BOTTOM;

    @JsonCreator
    public static TaskPosition fromValue(String value) {
        if (value == null || value.isBlank()) {
            return BOTTOM;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
