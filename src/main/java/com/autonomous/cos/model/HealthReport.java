package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthReport {
    private Instant checkedAt;
    private int processCount;
    private long totalMemoryMb;

    @Builder.Default
    private List<HealthIssue> issues = new ArrayList<>();

    public boolean isHealthy() {
        return issues.isEmpty();
    }
}
