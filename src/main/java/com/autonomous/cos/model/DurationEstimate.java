package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DurationEstimate {
    private Double estimatedMin;
    private Double avgMin;
    private int basedOnCount;
    private Integer successRate;
    private String bucket;
    private boolean fromOverall;
}
