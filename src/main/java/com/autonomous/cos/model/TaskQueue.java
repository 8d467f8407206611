package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two task queues. Membership is fixed when a task is created.
 */
public enum TaskQueue {
    USER("user", "task-"),
    SYSTEM("system", "sys-");

    private final String value;
    private final String idPrefix;

    TaskQueue(String value, String idPrefix) {
        this.value = value;
        this.idPrefix = idPrefix;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    @JsonCreator
    public static TaskQueue fromValue(String value) {
        for (TaskQueue queue : values()) {
            if (queue.value.equalsIgnoreCase(value) || queue.name().equalsIgnoreCase(value)) {
                return queue;
            }
        }
        // "internal" is what the dashboard calls the system queue
        if ("internal".equalsIgnoreCase(value) || "cos".equalsIgnoreCase(value)) {
            return SYSTEM;
        }
        throw new IllegalArgumentException("Unknown task queue: " + value);
    }
}
