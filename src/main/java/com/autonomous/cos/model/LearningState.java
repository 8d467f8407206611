package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearningState {
    public static final String OVERALL = "_overall";

    @Builder.Default
    private int version = 1;
    private Instant lastUpdated;

    @Builder.Default
    private Map<String, DurationStat> buckets = new LinkedHashMap<>();

    /** Descriptions of typed tasks seen at completion, mapped to the bucket they recorded into. */
    @Builder.Default
    private Map<String, String> typedDescriptions = new LinkedHashMap<>();
}
