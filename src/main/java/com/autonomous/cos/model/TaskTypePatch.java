package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

/**
 * Partial update of a task type. Null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskTypePatch {
    private Boolean enabled;
    private IntervalType intervalType;
    private Long intervalMs;
    private LocalTime scheduledTime;
    private Boolean clearScheduledTime;
    private String providerId;
    private String model;
    private String prompt;
    private TaskPriority priority;
}
