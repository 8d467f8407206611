package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

public enum IntervalType {
    ROTATION("rotation", null),
    DAILY("daily", Duration.ofDays(1)),
    WEEKLY("weekly", Duration.ofDays(7)),
    ONCE("once", null),
    ON_DEMAND("on-demand", null),
    CUSTOM("custom", Duration.ofDays(1));

    private final String value;
    private final Duration defaultInterval;

    IntervalType(String value, Duration defaultInterval) {
        this.value = value;
        this.defaultInterval = defaultInterval;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Fixed recurrence length, or null for types that are not time-gated. */
    public Duration getDefaultInterval() {
        return defaultInterval;
    }

    @JsonCreator
    public static IntervalType fromValue(String value) {
        for (IntervalType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown interval type: " + value);
    }
}
