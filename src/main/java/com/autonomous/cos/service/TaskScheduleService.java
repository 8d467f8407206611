package com.autonomous.cos.service;

import com.autonomous.cos.config.CosProperties;
import com.autonomous.cos.exception.ResourceNotFoundException;
import com.autonomous.cos.model.AppOverride;
import com.autonomous.cos.model.CooldownAdjustment;
import com.autonomous.cos.model.IntervalType;
import com.autonomous.cos.model.OnDemandRequest;
import com.autonomous.cos.model.ScheduleDecision;
import com.autonomous.cos.model.ScheduleReason;
import com.autonomous.cos.model.ScheduleState;
import com.autonomous.cos.model.TaskTypeConfig;
import com.autonomous.cos.model.TaskTypePatch;
import com.autonomous.cos.model.UpcomingTask;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Schedule registry: task type configs, per-app overrides, on-demand requests and
 * execution history. Due-ness is delegated to {@link SchedulePolicy}, with the interval
 * stretched or shrunk by the learning cooldown for the type.
 */
@Slf4j
@Service
public class TaskScheduleService {

    static final String DEFAULTS_RESOURCE = "default-task-types.yaml";

    private final CosProperties properties;
    private final SchedulePolicy policy;
    private final TaskLearningService learning;
    private final AppCatalog appCatalog;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ObjectMapper yamlMapper;
    private final ReentrantLock lock = new ReentrantLock();

    private ScheduleState state = new ScheduleState();

    public TaskScheduleService(CosProperties properties, SchedulePolicy policy, TaskLearningService learning,
                               AppCatalog appCatalog, Clock clock) {
        this.properties = properties;
        this.policy = policy;
        this.learning = learning;
        this.appCatalog = appCatalog;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.registerModule(new JavaTimeModule());
    }

    @PostConstruct
    public void load() {
        lock.lock();
        try {
            ScheduleState loaded = readState();
            Map<String, TaskTypeConfig> merged = new LinkedHashMap<>();
            for (TaskTypeConfig config : readDefaults()) {
                merged.put(config.getTaskType(), config);
            }
            merged.putAll(loaded.getTasks());
            loaded.setTasks(merged);
            state = loaded;
            log.info("Loaded schedule with {} task types", merged.size());
        } finally {
            lock.unlock();
        }
    }

    public List<TaskTypeConfig> list() {
        lock.lock();
        try {
            return state.getTasks().values().stream().map(TaskTypeConfig::copy).toList();
        } finally {
            lock.unlock();
        }
    }

    public TaskTypeConfig get(String taskType) {
        lock.lock();
        try {
            return require(taskType).copy();
        } finally {
            lock.unlock();
        }
    }

    public TaskTypeConfig register(TaskTypeConfig config) {
        if (config.getTaskType() == null || !config.getTaskType().matches("[\\w-]+")) {
            throw new IllegalArgumentException("Invalid task type name: " + config.getTaskType());
        }
        if (config.getCategory() == null) {
            throw new IllegalArgumentException("Task type category is required");
        }
        lock.lock();
        try {
            if (state.getTasks().containsKey(config.getTaskType())) {
                throw new IllegalArgumentException("Task type already exists: " + config.getTaskType());
            }
            TaskTypeConfig stored = config.copy();
            stored.setLastRun(null);
            stored.setRunCount(0);
            stored.getAppExecutions().clear();
            state.getTasks().put(stored.getTaskType(), stored);
            persist();
            return stored.copy();
        } finally {
            lock.unlock();
        }
    }

    public TaskTypeConfig update(String taskType, TaskTypePatch patch) {
        if (patch.getIntervalMs() != null && patch.getIntervalMs() <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive");
        }
        lock.lock();
        try {
            TaskTypeConfig config = require(taskType);
            if (patch.getEnabled() != null) {
                config.setEnabled(patch.getEnabled());
            }
            if (patch.getIntervalType() != null) {
                config.setIntervalType(patch.getIntervalType());
            }
            if (patch.getIntervalMs() != null) {
                config.setIntervalMs(patch.getIntervalMs());
            }
            if (Boolean.TRUE.equals(patch.getClearScheduledTime())) {
                config.setScheduledTime(null);
            } else if (patch.getScheduledTime() != null) {
                config.setScheduledTime(patch.getScheduledTime());
            }
            if (patch.getProviderId() != null) {
                config.setProviderId(patch.getProviderId().isEmpty() ? null : patch.getProviderId());
            }
            if (patch.getModel() != null) {
                config.setModel(patch.getModel().isEmpty() ? null : patch.getModel());
            }
            if (patch.getPrompt() != null) {
                config.setPrompt(patch.getPrompt().isEmpty() ? null : patch.getPrompt());
            }
            if (patch.getPriority() != null) {
                config.setPriority(patch.getPriority());
            }
            persist();
            log.info("Updated task type {}", taskType);
            return config.copy();
        } finally {
            lock.unlock();
        }
    }

    public Optional<AppOverride> getAppOverride(String taskType, String appId) {
        lock.lock();
        try {
            AppOverride override = require(taskType).overrideFor(appId);
            return Optional.ofNullable(override).map(o -> new AppOverride(o.getEnabled(), o.getInterval()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the per-app override. An override with no fields set removes it.
     */
    public TaskTypeConfig setAppOverride(String taskType, String appId, AppOverride override) {
        requireApp(appId);
        lock.lock();
        try {
            TaskTypeConfig config = require(taskType);
            if (!config.isAppScoped()) {
                throw new IllegalArgumentException("Task type " + taskType + " does not run per app");
            }
            if (override == null || (override.getEnabled() == null && override.getInterval() == null)) {
                config.getAppOverrides().remove(appId);
            } else {
                config.getAppOverrides().put(appId, new AppOverride(override.getEnabled(), override.getInterval()));
            }
            persist();
            return config.copy();
        } finally {
            lock.unlock();
        }
    }

    public TaskTypeConfig clearAppOverride(String taskType, String appId) {
        return setAppOverride(taskType, appId, null);
    }

    /**
     * Queues an on-demand run. Without an app id the request is satisfied by the next
     * run of the type for any app. Repeating an identical trigger returns the queued request.
     */
    public OnDemandRequest trigger(String taskType, String appId) {
        if (appId != null) {
            requireApp(appId);
        }
        lock.lock();
        try {
            TaskTypeConfig config = require(taskType);
            if (appId != null && !config.isAppScoped()) {
                throw new IllegalArgumentException("Task type " + taskType + " does not run per app");
            }
            for (OnDemandRequest existing : state.getOnDemandRequests()) {
                if (existing.getTaskType().equals(taskType) && Objects.equals(existing.getAppId(), appId)) {
                    return copy(existing);
                }
            }
            OnDemandRequest request = OnDemandRequest.builder()
                .id(UUID.randomUUID().toString().substring(0, 8))
                .taskType(taskType)
                .appId(appId)
                .requestedAt(clock.instant())
                .build();
            state.getOnDemandRequests().add(request);
            persist();
            log.info("Queued on-demand run of {}{}", taskType, appId == null ? "" : " for " + appId);
            return copy(request);
        } finally {
            lock.unlock();
        }
    }

    public List<OnDemandRequest> onDemandRequests() {
        lock.lock();
        try {
            return state.getOnDemandRequests().stream().map(this::copy).toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears execution history so once-tasks become eligible again. With an app id only
     * that app's record is cleared.
     */
    public TaskTypeConfig reset(String taskType, String appId) {
        lock.lock();
        try {
            TaskTypeConfig config = require(taskType);
            config.resetHistory(appId);
            persist();
            log.info("Reset history of {}{}", taskType, appId == null ? "" : " for " + appId);
            return config.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a spawn of the task type: bumps run history, marks the app as served,
     * advances rotation and consumes the matching on-demand request.
     */
    public void recordExecution(String taskType, String appId) {
        lock.lock();
        try {
            TaskTypeConfig config = require(taskType);
            Instant now = clock.instant();
            config.recordRun(appId, now);
            if (appId != null) {
                state.getAppLastServed().put(appId, now);
            }
            if (policy.effectiveInterval(config, appId) == IntervalType.ROTATION) {
                state.setLastRotationType(taskType);
            }
            state.getOnDemandRequests().stream()
                .filter(r -> r.matches(taskType, appId))
                .findFirst()
                .ifPresent(r -> state.getOnDemandRequests().remove(r));
            persist();
        } finally {
            lock.unlock();
        }
    }

    public ScheduleDecision shouldRun(String taskType, String appId) {
        ScheduleState view = snapshot();
        TaskTypeConfig config = view.getTasks().get(taskType);
        if (config == null) {
            throw new ResourceNotFoundException("Unknown task type: " + taskType);
        }
        return decide(config, appId, view.getOnDemandRequests(), clock.instant());
    }

    /**
     * Resets the learning data of types skipped for failing once they have sat out the grace period.
     */
    public List<String> rehabilitateSkipped() {
        List<String> rehabilitated = learning.rehabilitateSkipped();
        if (!rehabilitated.isEmpty()) {
            log.info("Task types back in rotation: {}", rehabilitated);
        }
        return rehabilitated;
    }

    /**
     * Decision for one type/app against an already-taken snapshot.
     */
    public ScheduleDecision decide(TaskTypeConfig config, String appId, List<OnDemandRequest> requests, Instant now) {
        boolean requested = requests.stream().anyMatch(r -> r.matches(config.getTaskType(), appId));
        CooldownAdjustment adjustment = learning.cooldownAdjustment("task:" + config.getTaskType());
        double multiplier = adjustment.isSkip() ? 1.0 : adjustment.getMultiplier();

        ScheduleDecision decision = policy.computeShouldRun(config, appId, requested, multiplier, now);
        boolean intervalGated = decision.getReason() == ScheduleReason.READY || decision.getReason() == ScheduleReason.NOT_DUE;
        if (intervalGated && adjustment.isSkip()) {
            return ScheduleDecision.hold(ScheduleReason.SKIP_FAILING);
        }
        if (intervalGated) {
            decision.setMultiplier(multiplier);
        }
        return decision;
    }

    /**
     * Next task types to become eligible: ready ones first, then by eligible time.
     * Disabled, on-demand and finished once-types are left out.
     */
    public List<UpcomingTask> upcoming(int limit) {
        ScheduleState view = snapshot();
        Instant now = clock.instant();
        List<UpcomingTask> upcoming = new ArrayList<>();
        for (TaskTypeConfig config : view.getTasks().values()) {
            ScheduleDecision decision = decide(config, null, view.getOnDemandRequests(), now);
            ScheduleReason reason = decision.getReason();
            if (reason == ScheduleReason.DISABLED || reason == ScheduleReason.ON_DEMAND_ONLY
                || reason == ScheduleReason.ONCE_COMPLETED || reason == ScheduleReason.SKIP_FAILING) {
                continue;
            }
            upcoming.add(UpcomingTask.builder()
                .taskType(config.getTaskType())
                .intervalType(config.getIntervalType())
                .status(decision.isShouldRun() ? "ready" : "scheduled")
                .eligibleAt(decision.isShouldRun() ? now : decision.getNextDueAt())
                .lastRun(config.getLastRun())
                .runCount(config.getRunCount())
                .build());
        }
        upcoming.sort(Comparator.comparing((UpcomingTask u) -> !"ready".equals(u.getStatus()))
            .thenComparing(UpcomingTask::getEligibleAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return upcoming.stream().limit(Math.max(0, limit)).toList();
    }

    /**
     * Fills the prompt template of a type for the given app ({@code {appName}}, {@code {repoPath}}).
     */
    public String renderPrompt(TaskTypeConfig config, String appId) {
        String template = config.getPrompt();
        if (template == null || template.isBlank()) {
            template = appId == null
                ? "[Self-Improvement] " + config.getTaskType()
                : "[Improvement: {appName}] " + config.getTaskType();
        }
        String repoPath = appCatalog.workspaceFor(appId).orElse(properties.getDefaultWorkspace());
        return template
            .replace("{appName}", appId == null ? "self" : appId)
            .replace("{repoPath}", repoPath == null ? "." : repoPath);
    }

    public ScheduleState snapshot() {
        lock.lock();
        try {
            Map<String, TaskTypeConfig> tasks = new LinkedHashMap<>();
            state.getTasks().forEach((k, v) -> tasks.put(k, v.copy()));
            return ScheduleState.builder()
                .version(state.getVersion())
                .lastUpdated(state.getLastUpdated())
                .tasks(tasks)
                .onDemandRequests(new ArrayList<>(state.getOnDemandRequests().stream().map(this::copy).toList()))
                .appLastServed(new LinkedHashMap<>(state.getAppLastServed()))
                .lastRotationType(state.getLastRotationType())
                .build();
        } finally {
            lock.unlock();
        }
    }

    private TaskTypeConfig require(String taskType) {
        TaskTypeConfig config = state.getTasks().get(taskType);
        if (config == null) {
            throw new ResourceNotFoundException("Unknown task type: " + taskType);
        }
        return config;
    }

    private void requireApp(String appId) {
        if (appId == null || !appCatalog.contains(appId)) {
            throw new IllegalArgumentException("Unknown app: " + appId);
        }
    }

    private OnDemandRequest copy(OnDemandRequest request) {
        return OnDemandRequest.builder()
            .id(request.getId())
            .taskType(request.getTaskType())
            .appId(request.getAppId())
            .requestedAt(request.getRequestedAt())
            .build();
    }

    private ScheduleState readState() {
        Path file = file();
        if (!Files.exists(file)) {
            return new ScheduleState();
        }
        try {
            ScheduleState loaded = objectMapper.readValue(file.toFile(), ScheduleState.class);
            if (loaded.getTasks() == null) {
                loaded.setTasks(new LinkedHashMap<>());
            }
            if (loaded.getOnDemandRequests() == null) {
                loaded.setOnDemandRequests(new ArrayList<>());
            }
            if (loaded.getAppLastServed() == null) {
                loaded.setAppLastServed(new LinkedHashMap<>());
            }
            loaded.getTasks().forEach((name, config) -> {
                config.setTaskType(name);
                if (config.getAppOverrides() == null) {
                    config.setAppOverrides(new LinkedHashMap<>());
                }
                if (config.getAppExecutions() == null) {
                    config.setAppExecutions(new LinkedHashMap<>());
                }
            });
            return loaded;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private List<TaskTypeConfig> readDefaults() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                log.warn("No {} on the classpath, starting without default task types", DEFAULTS_RESOURCE);
                return List.of();
            }
            DefaultTaskTypes defaults = yamlMapper.readValue(in, DefaultTaskTypes.class);
            return defaults.getTaskTypes() == null ? List.of() : defaults.getTaskTypes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
    }

    private void persist() {
        state.setLastUpdated(clock.instant());
        try {
            StateFileWriter.write(file(), objectMapper.writeValueAsString(state));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save schedule", e);
        }
    }

    private Path file() {
        return Path.of(properties.getDataPath(), properties.getScheduleFile());
    }

    @Data
    static class DefaultTaskTypes {
        private List<TaskTypeConfig> taskTypes;
    }
}
