package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Continuation bundle built from a finished run. Used to seed a new task.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeContext {
    private String agentId;
    private String taskId;
    private String originalDescription;
    private AgentRunStatus previousStatus;
    private AgentResult previousResult;
    private List<String> recentOutput;
    private String app;
    private String provider;
    private String model;
}
