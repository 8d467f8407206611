package com.autonomous.cos.service;

import com.autonomous.cos.model.AppOverride;
import com.autonomous.cos.model.ExecutionRecord;
import com.autonomous.cos.model.IntervalType;
import com.autonomous.cos.model.ScheduleDecision;
import com.autonomous.cos.model.ScheduleReason;
import com.autonomous.cos.model.TaskTypeConfig;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Decides whether a task type is due. Pure: the result depends only on the arguments
 * and the zone used to interpret {@code scheduledTime}.
 */
@Component
public class SchedulePolicy {

    private static final long DEFAULT_CUSTOM_INTERVAL_MS = Duration.ofDays(1).toMillis();

    private final ZoneId zone;

    public SchedulePolicy(ZoneId zone) {
        this.zone = zone;
    }

    public ScheduleDecision computeShouldRun(TaskTypeConfig config, String appId, Instant now) {
        return computeShouldRun(config, appId, false, 1.0, now);
    }

    public ScheduleDecision computeShouldRun(TaskTypeConfig config, String appId, boolean onDemandRequested,
                                             double intervalMultiplier, Instant now) {
        AppOverride override = config.overrideFor(appId);
        boolean enabled = override != null && override.getEnabled() != null ? override.getEnabled() : config.isEnabled();
        IntervalType interval = effectiveInterval(config, appId);

        if (!enabled) {
            return ScheduleDecision.hold(ScheduleReason.DISABLED);
        }
        if (interval == IntervalType.ON_DEMAND) {
            return onDemandRequested
                ? ScheduleDecision.run(ScheduleReason.ON_DEMAND_REQUESTED)
                : ScheduleDecision.hold(ScheduleReason.ON_DEMAND_ONLY);
        }

        ExecutionRecord execution = config.executionFor(appId);
        if (interval == IntervalType.ONCE && execution.getRunCount() > 0) {
            return ScheduleDecision.hold(ScheduleReason.ONCE_COMPLETED);
        }
        if (interval == IntervalType.ROTATION) {
            return ScheduleDecision.run(ScheduleReason.ROTATION);
        }

        long intervalMs = Math.round(baseIntervalMs(config, interval) * intervalMultiplier);
        if (execution.getLastRun() == null) {
            return ScheduleDecision.builder()
                .shouldRun(true)
                .reason(ScheduleReason.READY)
                .intervalMs(intervalMs)
                .build();
        }

        Instant nextDueAt = snapToScheduledTime(execution.getLastRun().plusMillis(intervalMs), config.getScheduledTime());
        return ScheduleDecision.builder()
            .shouldRun(!now.isBefore(nextDueAt))
            .reason(now.isBefore(nextDueAt) ? ScheduleReason.NOT_DUE : ScheduleReason.READY)
            .nextDueAt(nextDueAt)
            .intervalMs(intervalMs)
            .build();
    }

    public IntervalType effectiveInterval(TaskTypeConfig config, String appId) {
        AppOverride override = config.overrideFor(appId);
        return override != null && override.getInterval() != null ? override.getInterval() : config.getIntervalType();
    }

    long baseIntervalMs(TaskTypeConfig config, IntervalType interval) {
        if (interval == IntervalType.CUSTOM) {
            Long custom = config.getIntervalMs();
            return custom != null && custom > 0 ? custom : DEFAULT_CUSTOM_INTERVAL_MS;
        }
        // once (first run) shares the daily spacing
        Duration length = interval.getDefaultInterval();
        return length == null ? IntervalType.DAILY.getDefaultInterval().toMillis() : length.toMillis();
    }

    private Instant snapToScheduledTime(Instant due, LocalTime scheduledTime) {
        if (scheduledTime == null) {
            return due;
        }
        ZonedDateTime dueAt = due.atZone(zone);
        ZonedDateTime candidate = dueAt.with(scheduledTime);
        if (candidate.isBefore(dueAt)) {
            candidate = candidate.plusDays(1).with(scheduledTime);
        }
        return candidate.toInstant();
    }
}
