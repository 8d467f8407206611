package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CosStatus {
    private boolean running;
    private boolean paused;
    private String pauseReason;
    private String level;
    private long evaluationIntervalMs;
    private int maxConcurrentAgents;
    private int activeAgents;
    private int pendingUserTasks;
    private int pendingSystemTasks;
    private int awaitingApproval;
    private Instant lastEvaluation;
    private long evaluationCount;
    private long spawnedCount;
    private String lastError;
}
