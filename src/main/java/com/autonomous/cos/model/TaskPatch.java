package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial update of a task. Null fields are left untouched; an empty string clears
 * an optional text field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPatch {
    private String description;
    private String context;
    private TaskPriority priority;
    private TaskStatus status;
    private String app;
    private String provider;
    private String model;
    private List<String> attachments;
    private String blocker;
}
