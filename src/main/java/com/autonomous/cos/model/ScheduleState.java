package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted schedule record: task type configs, queued on-demand requests and
 * the bookkeeping used to rotate fairly across apps and rotation types.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleState {
    @Builder.Default
    private int version = 1;
    private Instant lastUpdated;

    @Builder.Default
    private Map<String, TaskTypeConfig> tasks = new LinkedHashMap<>();

    @Builder.Default
    private List<OnDemandRequest> onDemandRequests = new ArrayList<>();

    @Builder.Default
    private Map<String, Instant> appLastServed = new LinkedHashMap<>();

    private String lastRotationType;
}
