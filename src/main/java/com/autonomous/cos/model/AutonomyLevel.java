package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named autonomy bundles. Applying a level only touches the autonomy fields of a
 * {@link CosConfig}; resource bounds are left alone.
 */
public enum AutonomyLevel {
    //       eval ms  max  self   app    proact idle   immed  compr  spawn  autoApprove
    STANDBY("standby", 600_000, 1, false, false, false, false, false, false, false, false),
    ASSISTANT("assistant", 300_000, 1, false, false, false, false, false, false, true, false),
    MANAGER("manager", 120_000, 2, true, true, true, false, false, false, true, false),
    YOLO("yolo", 60_000, 3, true, true, true, true, true, true, true, true);

    private final String value;
    private final long evaluationIntervalMs;
    private final int maxConcurrentAgents;
    private final boolean selfImprovement;
    private final boolean appImprovement;
    private final boolean proactive;
    private final boolean idleReview;
    private final boolean immediateExecution;
    private final boolean comprehensiveAppImprovement;
    private final boolean spawnEnabled;
    private final boolean autoApprove;

    AutonomyLevel(String value, long evaluationIntervalMs, int maxConcurrentAgents,
                  boolean selfImprovement, boolean appImprovement, boolean proactive,
                  boolean idleReview, boolean immediateExecution, boolean comprehensiveAppImprovement,
                  boolean spawnEnabled, boolean autoApprove) {
        this.value = value;
        this.evaluationIntervalMs = evaluationIntervalMs;
        this.maxConcurrentAgents = maxConcurrentAgents;
        this.selfImprovement = selfImprovement;
        this.appImprovement = appImprovement;
        this.proactive = proactive;
        this.idleReview = idleReview;
        this.immediateExecution = immediateExecution;
        this.comprehensiveAppImprovement = comprehensiveAppImprovement;
        this.spawnEnabled = spawnEnabled;
        this.autoApprove = autoApprove;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public long getEvaluationIntervalMs() {
        return evaluationIntervalMs;
    }

    public int getMaxConcurrentAgents() {
        return maxConcurrentAgents;
    }

    public CosConfig applyTo(CosConfig config) {
        return config.toBuilder()
            .evaluationIntervalMs(evaluationIntervalMs)
            .maxConcurrentAgents(maxConcurrentAgents)
            .selfImprovementEnabled(selfImprovement)
            .appImprovementEnabled(appImprovement)
            .proactiveMode(proactive)
            .idleReviewEnabled(idleReview)
            .immediateExecution(immediateExecution)
            .comprehensiveAppImprovement(comprehensiveAppImprovement)
            .spawnEnabled(spawnEnabled)
            .autoApprove(autoApprove)
            .build();
    }

    public boolean matches(CosConfig config) {
        return config.getEvaluationIntervalMs() == evaluationIntervalMs
            && config.getMaxConcurrentAgents() == maxConcurrentAgents
            && config.isSelfImprovementEnabled() == selfImprovement
            && config.isAppImprovementEnabled() == appImprovement
            && config.isProactiveMode() == proactive
            && config.isIdleReviewEnabled() == idleReview
            && config.isImmediateExecution() == immediateExecution
            && config.isComprehensiveAppImprovement() == comprehensiveAppImprovement
            && config.isSpawnEnabled() == spawnEnabled
            && config.isAutoApprove() == autoApprove;
    }

    public static Optional<AutonomyLevel> detect(CosConfig config) {
        return Arrays.stream(values()).filter(level -> level.matches(config)).findFirst();
    }

    @JsonCreator
    public static AutonomyLevel fromValue(String value) {
        for (AutonomyLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown autonomy level: " + value);
    }
}
