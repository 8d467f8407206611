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
public class UpcomingTask {
    private String taskType;
    private IntervalType intervalType;
    private String status; // ready | scheduled
    private Instant eligibleAt;
    private Instant lastRun;
    private int runCount;
}
