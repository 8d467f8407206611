package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResult {
    private boolean success;
    private String error;
    private Integer exitCode;
    private long durationMs;
}
