package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Runtime-mutable Chief of Staff configuration. Defaults match the "manager" autonomy level.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CosConfig {

    // Autonomy bundle
    @Builder.Default
    private long evaluationIntervalMs = 120_000;
    @Builder.Default
    private int maxConcurrentAgents = 2;
    @Builder.Default
    private boolean selfImprovementEnabled = true;
    @Builder.Default
    private boolean appImprovementEnabled = true;
    @Builder.Default
    private boolean proactiveMode = true;
    private boolean idleReviewEnabled;
    private boolean immediateExecution;
    private boolean comprehensiveAppImprovement;
    @Builder.Default
    private boolean spawnEnabled = true;
    private boolean autoApprove;

    // Resource bounds
    @Builder.Default
    private long healthCheckIntervalMs = 900_000;
    @Builder.Default
    private int maxProcessMemoryMb = 2048;
    @Builder.Default
    private int maxTotalProcesses = 50;
    @Builder.Default
    private long appReviewCooldownMs = 3_600_000;

    @JsonIgnore
    public boolean isApprovalGateBypassed() {
        return immediateExecution && autoApprove;
    }

    @JsonIgnore
    public String getLevelName() {
        return AutonomyLevel.detect(this).map(AutonomyLevel::getValue).orElse("custom");
    }

    public CosConfig copy() {
        return toBuilder().build();
    }
}
