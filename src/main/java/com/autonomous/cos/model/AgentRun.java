package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One execution attempt of a worker process against a task.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentRun {
    private String id;
    private Long pid;
    private String taskId;

    // Task snapshot taken at spawn time
    private TaskQueue queue;
    private String taskDescription;
    private String app;
    private String provider;
    private String model;
    private String taskType;

    @Builder.Default
    private AgentRunStatus status = AgentRunStatus.SPAWNING;
    private Instant startedAt;
    private Instant completedAt;

    @Builder.Default
    private List<String> output = new ArrayList<>();
    private AgentResult result;

    @JsonIgnore
    public boolean isActive() {
        return !status.isTerminal();
    }

    public AgentRun copy() {
        AgentRun copy = toBuilder().output(new ArrayList<>(output)).build();
        if (result != null) {
            copy.setResult(AgentResult.builder()
                .success(result.isSuccess())
                .error(result.getError())
                .exitCode(result.getExitCode())
                .durationMs(result.getDurationMs())
                .build());
        }
        return copy;
    }
}
