package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthIssue {

    public enum Severity { WARNING, ERROR }

    private Severity severity;
    private String category;   // processes | memory | probe
    private String process;
    private String message;
}
