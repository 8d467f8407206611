package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A learning bucket held back for failing, and when it may run again.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkippedTaskType {
    private String bucket;
    private int successRate;
    private int completed;
    private Instant lastCompleted;
    private Instant eligibleAt;
    private boolean eligibleForRehabilitation;
    private int daysUntilEligible;
}
