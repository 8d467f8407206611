package com.autonomous.cos.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate completion statistics for one learning bucket. Keeps every duration
 * sample in sorted order so the 80th percentile is exact.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DurationStat {
    private int completed;
    private int succeeded;
    private int failed;
    private long totalDurationMs;
    private Instant lastCompleted;
    private List<Long> durations = new ArrayList<>();

    public void record(long durationMs, boolean success, Instant at) {
        completed++;
        if (success) {
            succeeded++;
        } else {
            failed++;
        }
        totalDurationMs += durationMs;
        lastCompleted = at;
        int idx = Collections.binarySearch(durations, durationMs);
        durations.add(idx < 0 ? -idx - 1 : idx, durationMs);
    }

    /**
     * Removes another stat's contribution, used when a bucket is reset and
     * must be taken out of the overall aggregate.
     */
    public void subtract(DurationStat other) {
        completed = Math.max(0, completed - other.completed);
        succeeded = Math.max(0, succeeded - other.succeeded);
        failed = Math.max(0, failed - other.failed);
        totalDurationMs = Math.max(0, totalDurationMs - other.totalDurationMs);
        for (Long sample : other.durations) {
            durations.remove(sample);
        }
    }

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public long getAvgDurationMs() {
        return completed == 0 ? 0 : Math.round((double) totalDurationMs / completed);
    }

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public double getAvgDurationMin() {
        return Math.round(getAvgDurationMs() / 6000.0) / 10.0;
    }

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public long getP80DurationMs() {
        if (durations.isEmpty()) {
            return 0;
        }
        int rank = (int) Math.ceil(0.8 * durations.size());
        return durations.get(Math.max(0, rank - 1));
    }

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public int getSuccessRate() {
        return completed == 0 ? 0 : (int) Math.round(succeeded * 100.0 / completed);
    }

    public DurationStat copy() {
        DurationStat copy = new DurationStat();
        copy.completed = completed;
        copy.succeeded = succeeded;
        copy.failed = failed;
        copy.totalDurationMs = totalDurationMs;
        copy.lastCompleted = lastCompleted;
        copy.durations = new ArrayList<>(durations);
        return copy;
    }
}
