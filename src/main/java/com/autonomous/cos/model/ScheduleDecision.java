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
public class ScheduleDecision {
    private boolean shouldRun;
    private ScheduleReason reason;
    private Instant nextDueAt;
    private Long intervalMs;
    // Learning multiplier applied to intervalMs
    private Double multiplier;

    public static ScheduleDecision run(ScheduleReason reason) {
        return ScheduleDecision.builder().shouldRun(true).reason(reason).build();
    }

    public static ScheduleDecision hold(ScheduleReason reason) {
        return ScheduleDecision.builder().shouldRun(false).reason(reason).build();
    }
}
