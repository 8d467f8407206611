package com.autonomous.cos.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time view of one managed process.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessSample {
    private String name;
    private String status;
    private long memoryBytes;
    private double cpuPercent;
    private int restarts;

    public long getMemoryMb() {
        return memoryBytes / (1024 * 1024);
    }

    public boolean isErrored() {
        return "errored".equalsIgnoreCase(status);
    }
}
