package com.autonomous.cos.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DurationStatTest {

    private static final Instant AT = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldComputeNearestRankP80() {
        DurationStat stat = new DurationStat();
        for (long ms : new long[] {50_000, 10_000, 40_000, 20_000, 30_000}) {
            stat.record(ms, true, AT);
        }

        // ceil(0.8 * 5) = 4th smallest
        assertEquals(40_000, stat.getP80DurationMs());
        assertEquals(30_000, stat.getAvgDurationMs());
        assertEquals(0.5, stat.getAvgDurationMin());
    }

    @Test
    void shouldComputeSuccessRateAsRoundedPercent() {
        DurationStat stat = new DurationStat();
        stat.record(1000, true, AT);
        stat.record(1000, true, AT);
        stat.record(1000, false, AT);

        assertEquals(3, stat.getCompleted());
        assertEquals(2, stat.getSucceeded());
        assertEquals(1, stat.getFailed());
        assertEquals(67, stat.getSuccessRate());
    }

    @Test
    void shouldSubtractAnotherStat() {
        DurationStat overall = new DurationStat();
        DurationStat bucket = new DurationStat();
        overall.record(1000, true, AT);
        overall.record(5000, false, AT);
        bucket.record(5000, false, AT);

        overall.subtract(bucket);

        assertEquals(1, overall.getCompleted());
        assertEquals(0, overall.getFailed());
        assertEquals(1000, overall.getTotalDurationMs());
        assertEquals(1000, overall.getP80DurationMs());
    }

    @Test
    void shouldReportZerosWhenEmpty() {
        DurationStat stat = new DurationStat();

        assertEquals(0, stat.getP80DurationMs());
        assertEquals(0, stat.getAvgDurationMs());
        assertEquals(0, stat.getSuccessRate());
    }
}
