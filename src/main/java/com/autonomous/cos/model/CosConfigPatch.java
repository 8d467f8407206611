package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial config update; null fields are left as they are.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CosConfigPatch {
    private Long evaluationIntervalMs;
    private Integer maxConcurrentAgents;
    private Boolean selfImprovementEnabled;
    private Boolean appImprovementEnabled;
    private Boolean proactiveMode;
    private Boolean idleReviewEnabled;
    private Boolean immediateExecution;
    private Boolean comprehensiveAppImprovement;
    private Boolean spawnEnabled;
    private Boolean autoApprove;
    private Long healthCheckIntervalMs;
    private Integer maxProcessMemoryMb;
    private Integer maxTotalProcesses;
    private Long appReviewCooldownMs;
}
