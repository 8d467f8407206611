package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskTypeConfig {
    private String taskType;
    private TaskCategory category;
    private boolean enabled;

    @Builder.Default
    private IntervalType intervalType = IntervalType.ROTATION;

    // Only read for custom intervals
    private Long intervalMs;
    private LocalTime scheduledTime;

    private String providerId;
    private String model;
    private String prompt;

    @Builder.Default
    private TaskPriority priority = TaskPriority.MEDIUM;

    private Instant lastRun;
    private int runCount;

    @Builder.Default
    private Map<String, AppOverride> appOverrides = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, ExecutionRecord> appExecutions = new LinkedHashMap<>();

    @JsonIgnore
    public boolean isAppScoped() {
        return category == TaskCategory.APP_IMPROVEMENT;
    }

    /**
     * Execution history relevant for the given app, or the global record when appId is null.
     */
    public ExecutionRecord executionFor(String appId) {
        if (appId == null) {
            return new ExecutionRecord(lastRun, runCount);
        }
        ExecutionRecord record = appExecutions == null ? null : appExecutions.get(appId);
        return record == null ? new ExecutionRecord() : new ExecutionRecord(record.getLastRun(), record.getRunCount());
    }

    public AppOverride overrideFor(String appId) {
        if (appId == null || appOverrides == null) {
            return null;
        }
        return appOverrides.get(appId);
    }

    public void recordRun(String appId, Instant at) {
        lastRun = at;
        runCount++;
        if (appId != null) {
            ExecutionRecord record = appExecutions.computeIfAbsent(appId, k -> new ExecutionRecord());
            record.setLastRun(at);
            record.setRunCount(record.getRunCount() + 1);
        }
    }

    public void resetHistory(String appId) {
        if (appId == null) {
            lastRun = null;
            runCount = 0;
            appExecutions.clear();
        } else {
            appExecutions.remove(appId);
        }
    }

    public TaskTypeConfig copy() {
        Map<String, AppOverride> overrides = new LinkedHashMap<>();
        if (appOverrides != null) {
            appOverrides.forEach((app, o) -> overrides.put(app, new AppOverride(o.getEnabled(), o.getInterval())));
        }
        Map<String, ExecutionRecord> executions = new LinkedHashMap<>();
        if (appExecutions != null) {
            appExecutions.forEach((app, e) -> executions.put(app, new ExecutionRecord(e.getLastRun(), e.getRunCount())));
        }
        return toBuilder()
            .appOverrides(overrides)
            .appExecutions(executions)
            .build();
    }
}
