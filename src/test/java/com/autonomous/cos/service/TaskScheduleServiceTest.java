package com.autonomous.cos.service;

import com.autonomous.cos.config.CosProperties;
import com.autonomous.cos.exception.ResourceNotFoundException;
import com.autonomous.cos.model.AppOverride;
import com.autonomous.cos.model.IntervalType;
import com.autonomous.cos.model.OnDemandRequest;
import com.autonomous.cos.model.ScheduleDecision;
import com.autonomous.cos.model.ScheduleReason;
import com.autonomous.cos.model.TaskCategory;
import com.autonomous.cos.model.TaskTypeConfig;
import com.autonomous.cos.model.TaskTypePatch;
import com.autonomous.cos.model.UpcomingTask;
import com.autonomous.cos.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskScheduleServiceTest {

    @TempDir
    Path dataDir;

    private CosProperties properties;
    private MutableClock clock;
    private TaskLearningService learning;
    private TaskScheduleService schedule;

    @BeforeEach
    void setUp() {
        properties = new CosProperties();
        properties.setDataPath(dataDir.toString());
        properties.setApps(List.of("portal", "shop"));
        properties.setAppWorkspaces(Map.of("portal", "/srv/portal"));
        clock = new MutableClock(Instant.parse("2026-03-10T12:00:00Z"));
        learning = new TaskLearningService(properties, new TaskClassifier(), clock);
        learning.load();
        schedule = newSchedule();
        schedule.register(TaskTypeConfig.builder()
            .taskType("nightly-audit")
            .category(TaskCategory.APP_IMPROVEMENT)
            .enabled(true)
            .intervalType(IntervalType.DAILY)
            .prompt("[Improvement: {appName}] Audit\nRepository: {repoPath}")
            .build());
        schedule.register(TaskTypeConfig.builder()
            .taskType("one-shot")
            .category(TaskCategory.SELF_IMPROVEMENT)
            .enabled(true)
            .intervalType(IntervalType.ONCE)
            .build());
    }

    private TaskScheduleService newSchedule() {
        TaskScheduleService service = new TaskScheduleService(properties, new SchedulePolicy(ZoneOffset.UTC),
            learning, new ConfiguredAppCatalog(properties), clock);
        service.load();
        return service;
    }

    @Test
    void shouldLoadBuiltInTaskTypesDisabled() {
        List<TaskTypeConfig> types = schedule.list();

        TaskTypeConfig security = schedule.get("security");
        assertEquals(TaskCategory.SELF_IMPROVEMENT, security.getCategory());
        assertFalse(security.isEnabled());
        assertTrue(types.size() > 2);
    }

    @Test
    void shouldPersistChangesOverBuiltInDefaults() {
        schedule.update("security", TaskTypePatch.builder().enabled(true).intervalType(IntervalType.DAILY).build());

        TaskScheduleService reloaded = newSchedule();

        TaskTypeConfig security = reloaded.get("security");
        assertTrue(security.isEnabled());
        assertEquals(IntervalType.DAILY, security.getIntervalType());
        assertNotNull(reloaded.get("nightly-audit"));
    }

    @Test
    void shouldRejectUnknownTaskType() {
        assertThrows(ResourceNotFoundException.class, () -> schedule.get("nope"));
        assertThrows(ResourceNotFoundException.class, () -> schedule.shouldRun("nope", null));
    }

    @Test
    void shouldRejectInvalidPatch() {
        assertThrows(IllegalArgumentException.class,
            () -> schedule.update("nightly-audit", TaskTypePatch.builder().intervalMs(0L).build()));
    }

    @Test
    void shouldKeepHistoryPerApp() {
        schedule.recordExecution("nightly-audit", "portal");

        assertEquals(ScheduleReason.NOT_DUE, schedule.shouldRun("nightly-audit", "portal").getReason());
        assertEquals(ScheduleReason.READY, schedule.shouldRun("nightly-audit", "shop").getReason());

        clock.advance(Duration.ofHours(25));
        assertTrue(schedule.shouldRun("nightly-audit", "portal").isShouldRun());
    }

    @Test
    void shouldMakeOnceTypeEligibleAgainAfterReset() {
        schedule.recordExecution("one-shot", null);
        assertEquals(ScheduleReason.ONCE_COMPLETED, schedule.shouldRun("one-shot", null).getReason());

        schedule.reset("one-shot", null);

        ScheduleDecision decision = schedule.shouldRun("one-shot", null);
        assertTrue(decision.isShouldRun());
        assertEquals(0, schedule.get("one-shot").getRunCount());
    }

    @Test
    void shouldApplyOverrideToOneAppOnly() {
        schedule.setAppOverride("nightly-audit", "portal", new AppOverride(false, null));

        assertEquals(ScheduleReason.DISABLED, schedule.shouldRun("nightly-audit", "portal").getReason());
        assertTrue(schedule.shouldRun("nightly-audit", "shop").isShouldRun());
        assertTrue(schedule.getAppOverride("nightly-audit", "portal").isPresent());

        schedule.clearAppOverride("nightly-audit", "portal");

        assertTrue(schedule.getAppOverride("nightly-audit", "portal").isEmpty());
        assertTrue(schedule.shouldRun("nightly-audit", "portal").isShouldRun());
    }

    @Test
    void shouldRejectOverridesForUnknownAppsOrSelfTypes() {
        assertThrows(IllegalArgumentException.class,
            () -> schedule.setAppOverride("nightly-audit", "unknown", new AppOverride(false, null)));
        assertThrows(IllegalArgumentException.class,
            () -> schedule.setAppOverride("one-shot", "portal", new AppOverride(false, null)));
    }

    @Test
    void shouldQueueTriggerOnceAndConsumeItOnExecution() {
        schedule.update("nightly-audit", TaskTypePatch.builder().intervalType(IntervalType.ON_DEMAND).build());
        assertEquals(ScheduleReason.ON_DEMAND_ONLY, schedule.shouldRun("nightly-audit", "portal").getReason());

        OnDemandRequest first = schedule.trigger("nightly-audit", "portal");
        OnDemandRequest second = schedule.trigger("nightly-audit", "portal");

        assertEquals(first.getId(), second.getId());
        assertEquals(1, schedule.onDemandRequests().size());
        assertEquals(ScheduleReason.ON_DEMAND_REQUESTED, schedule.shouldRun("nightly-audit", "portal").getReason());
        // scoped to portal
        assertEquals(ScheduleReason.ON_DEMAND_ONLY, schedule.shouldRun("nightly-audit", "shop").getReason());

        schedule.recordExecution("nightly-audit", "portal");

        assertTrue(schedule.onDemandRequests().isEmpty());
        assertEquals(ScheduleReason.ON_DEMAND_ONLY, schedule.shouldRun("nightly-audit", "portal").getReason());
    }

    @Test
    void shouldMatchUnscopedTriggerForAnyApp() {
        schedule.update("nightly-audit", TaskTypePatch.builder().intervalType(IntervalType.ON_DEMAND).build());

        schedule.trigger("nightly-audit", null);

        assertTrue(schedule.shouldRun("nightly-audit", "portal").isShouldRun());
        assertTrue(schedule.shouldRun("nightly-audit", "shop").isShouldRun());
    }

    @Test
    void shouldRejectAppTriggerForSelfType() {
        assertThrows(IllegalArgumentException.class, () -> schedule.trigger("one-shot", "portal"));
        assertThrows(IllegalArgumentException.class, () -> schedule.trigger("nightly-audit", "unknown"));
    }

    @Test
    void shouldTrackRotationAndServedApps() {
        schedule.update("nightly-audit", TaskTypePatch.builder().intervalType(IntervalType.ROTATION).build());

        schedule.recordExecution("nightly-audit", "shop");

        assertEquals("nightly-audit", schedule.snapshot().getLastRotationType());
        assertEquals(clock.instant(), schedule.snapshot().getAppLastServed().get("shop"));
    }

    @Test
    void shouldSkipTypesThatKeepFailing() {
        for (int i = 0; i < 5; i++) {
            learning.recordCompletion("task:nightly-audit", 60_000, false);
        }

        ScheduleDecision decision = schedule.shouldRun("nightly-audit", "portal");

        assertFalse(decision.isShouldRun());
        assertEquals(ScheduleReason.SKIP_FAILING, decision.getReason());
    }

    @Test
    void shouldReturnFailingTypeToRotationAfterAWeek() {
        for (int i = 0; i < 5; i++) {
            learning.recordCompletion("task:nightly-audit", 60_000, false);
        }
        clock.advance(Duration.ofDays(7));

        assertEquals(List.of("task:nightly-audit"), schedule.rehabilitateSkipped());

        assertTrue(schedule.shouldRun("nightly-audit", "portal").isShouldRun());
        assertTrue(learning.stat("task:nightly-audit").isEmpty());
    }

    @Test
    void shouldShortenIntervalForReliableTypes() {
        for (int i = 0; i < 3; i++) {
            learning.recordCompletion("task:nightly-audit", 60_000, true);
        }
        schedule.recordExecution("nightly-audit", "portal");
        clock.advance(Duration.ofHours(17));

        ScheduleDecision decision = schedule.shouldRun("nightly-audit", "portal");

        assertTrue(decision.isShouldRun());
        assertEquals(0.7, decision.getMultiplier());
    }

    @Test
    void shouldRenderPromptPlaceholders() {
        TaskTypeConfig audit = schedule.get("nightly-audit");
        TaskTypeConfig oneShot = schedule.get("one-shot");

        assertEquals("[Improvement: portal] Audit\nRepository: /srv/portal", schedule.renderPrompt(audit, "portal"));
        assertEquals("[Self-Improvement] one-shot", schedule.renderPrompt(oneShot, null));
    }

    @Test
    void shouldListUpcomingWithReadyFirst() {
        schedule.recordExecution("nightly-audit", null);

        List<UpcomingTask> upcoming = schedule.upcoming(10);

        assertEquals("one-shot", upcoming.get(0).getTaskType());
        assertEquals("ready", upcoming.get(0).getStatus());
        UpcomingTask audit = upcoming.stream().filter(u -> u.getTaskType().equals("nightly-audit")).findFirst().orElseThrow();
        assertEquals("scheduled", audit.getStatus());
        assertEquals(clock.instant().plus(Duration.ofDays(1)), audit.getEligibleAt());
    }
}
