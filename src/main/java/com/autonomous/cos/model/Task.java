package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {
    private String id;
    private TaskQueue queue;
    private String description;
    private String context;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    @Builder.Default
    private TaskPriority priority = TaskPriority.MEDIUM;

    // Position among the pending tasks of the queue; lower runs first
    private int order;

    private String app;
    private String provider;
    private String model;

    @Builder.Default
    private List<String> attachments = new ArrayList<>();

    private String blocker;

    @Builder.Default
    private boolean autoApproved = true;

    // Set when the task was materialized from a task type schedule
    private String taskType;
    private String agentId;
    private Instant createdAt;
    private Instant completedAt;

    // Metadata keys we do not model explicitly, kept so a save/load cycle is lossless
    @Builder.Default
    private Map<String, String> extra = new LinkedHashMap<>();

    @JsonIgnore
    public boolean isPending() {
        return status == TaskStatus.PENDING;
    }

    @JsonIgnore
    public boolean isAwaitingApproval() {
        return status == TaskStatus.PENDING && !autoApproved;
    }

    public Task copy() {
        return toBuilder()
            .attachments(attachments == null ? new ArrayList<>() : new ArrayList<>(attachments))
            .extra(extra == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extra))
            .build();
    }
}
