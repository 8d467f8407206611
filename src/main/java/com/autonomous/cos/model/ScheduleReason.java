package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScheduleReason {
    DISABLED("disabled"),
    ON_DEMAND_ONLY("on-demand-only"),
    ON_DEMAND_REQUESTED("on-demand-requested"),
    ONCE_COMPLETED("once-completed"),
    ROTATION("rotation"),
    READY("ready"),
    NOT_DUE("not-due"),
    SKIP_FAILING("skip-failing");

    private final String value;

    ScheduleReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
