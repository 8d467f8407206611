package com.autonomous.cos.event;

import com.autonomous.cos.model.AgentRun;

/**
 * Published once per run when it reaches a terminal state through process exit.
 */
public record AgentCompletedEvent(AgentRun run) {
}
