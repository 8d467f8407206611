package com.autonomous.cos.dto;

import com.autonomous.cos.model.Task;
import com.autonomous.cos.model.TaskPosition;
import com.autonomous.cos.model.TaskPriority;
import com.autonomous.cos.model.TaskQueue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddTaskRequest {
    private TaskQueue queue;
    private String description;
    private String context;
    private TaskPriority priority;
    private String app;
    private String provider;
    private String model;
    private List<String> attachments;
    private TaskPosition position;

    // Only meaningful for the system queue; user tasks never need approval
    private Boolean approvalRequired;

    public Task toTask() {
        TaskQueue target = queue == null ? TaskQueue.USER : queue;
        return Task.builder()
            .queue(target)
            .description(description)
            .context(context)
            .priority(priority == null ? TaskPriority.MEDIUM : priority)
            .app(app)
            .provider(provider)
            .model(model)
            .attachments(attachments == null ? new ArrayList<>() : new ArrayList<>(attachments))
            .autoApproved(target == TaskQueue.USER || !Boolean.TRUE.equals(approvalRequired))
            .build();
    }

    public TaskPosition positionOrDefault() {
        return position == null ? TaskPosition.BOTTOM : position;
    }
}
