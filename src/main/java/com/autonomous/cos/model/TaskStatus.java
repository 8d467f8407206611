package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {
    PENDING("pending", "[ ]", "Pending"),
    IN_PROGRESS("in_progress", "[~]", "In Progress"),
    BLOCKED("blocked", "[!]", "Blocked"),
    COMPLETED("completed", "[x]", "Completed");

    private final String value;
    private final String checkbox;
    private final String sectionTitle;

    TaskStatus(String value, String checkbox, String sectionTitle) {
        this.value = value;
        this.checkbox = checkbox;
        this.sectionTitle = sectionTitle;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getCheckbox() {
        return checkbox;
    }

    public String getSectionTitle() {
        return sectionTitle;
    }

    /**
     * Whether a task may move from this status to {@code target}.
     * Same-status updates are always allowed.
     */
    public boolean canTransitionTo(TaskStatus target) {
        if (this == target) {
            return true;
        }
        return switch (this) {
            case PENDING -> target == IN_PROGRESS;
            case IN_PROGRESS -> true;
            case BLOCKED, COMPLETED -> target == PENDING;
        };
    }

    @JsonCreator
    public static TaskStatus fromValue(String value) {
        for (TaskStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }

    public static TaskStatus fromCheckbox(String checkbox) {
        for (TaskStatus status : values()) {
            if (status.checkbox.equals(checkbox)) {
                return status;
            }
        }
        return PENDING;
    }
}
