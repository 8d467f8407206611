package com.autonomous.cos.service;

import com.autonomous.cos.model.TaskPriority;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Starts worker processes for agent runs.
 */
public interface ProcessLauncher {

    /**
     * Starts the worker and returns without waiting for it. Output lines are handed to
     * {@code outputSink} as they arrive, from a thread owned by the launcher.
     *
     * @throws IOException if the process could not be started
     */
    AgentProcess launch(LaunchRequest request, Consumer<String> outputSink) throws IOException;

    /**
     * @param provider provider id, or null for the configured default
     * @param model model name or alias, or null to pick one from the task's priority and description
     */
    record LaunchRequest(String agentId, String prompt, String workspace, String provider, String model,
                         TaskPriority priority, String description) {
    }
}
