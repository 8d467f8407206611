package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentRunStatus {
    SPAWNING("spawning", false),
    RUNNING("running", false),
    COMPLETED("completed", true),
    FAILED("failed", true),
    ERROR("error", true),
    CANCELLED("cancelled", true);

    private final String value;
    private final boolean terminal;

    AgentRunStatus(String value, boolean terminal) {
        this.value = value;
        this.terminal = terminal;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
