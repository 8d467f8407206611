package com.autonomous.cos.service;

import com.autonomous.cos.config.CosProperties;
import com.autonomous.cos.event.AgentCompletedEvent;
import com.autonomous.cos.event.CosConfigChangedEvent;
import com.autonomous.cos.event.TaskQueueChangedEvent;
import com.autonomous.cos.model.AgentRun;
import com.autonomous.cos.model.CosConfig;
import com.autonomous.cos.model.CosStatus;
import com.autonomous.cos.model.OnDemandRequest;
import com.autonomous.cos.model.ScheduleDecision;
import com.autonomous.cos.model.ScheduleReason;
import com.autonomous.cos.model.ScheduleState;
import com.autonomous.cos.model.Task;
import com.autonomous.cos.model.TaskCategory;
import com.autonomous.cos.model.TaskPosition;
import com.autonomous.cos.model.TaskQueue;
import com.autonomous.cos.model.TaskStatus;
import com.autonomous.cos.model.TaskTypeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The Chief of Staff loop. Each tick picks the best eligible work and hands it to the
 * spawner, never exceeding the concurrency cap of the active config.
 */
@Slf4j
@Service
public class TaskEvaluatorService {

    static final String TICK = "evaluator";

    enum Source { USER, SYSTEM, SCHEDULED, ROTATION, IDLE }

    /** Unit of work considered in one tick; scheduled candidates have no task yet. */
    record Candidate(Task task, Source source, TaskTypeConfig taskType, String appId) {

        static Candidate of(Task task, Source source) {
            return new Candidate(task, source, null, task.getApp());
        }

        boolean scheduled() {
            return taskType != null;
        }
    }

    private static final Comparator<Candidate> RANKING = Comparator
        .comparingInt((Candidate c) -> -c.task().getPriority().getWeight())
        .thenComparing(Candidate::source)
        .thenComparingInt(c -> c.task().isPending() && !c.scheduled() ? c.task().getOrder() : Integer.MAX_VALUE)
        .thenComparing(c -> c.task().getCreatedAt(), Comparator.nullsLast(Comparator.naturalOrder()));

    private final TaskStoreService taskStore;
    private final TaskScheduleService scheduleService;
    private final AgentSpawnerService spawner;
    private final ApprovalGateService approvalGate;
    private final AutonomyConfigService configService;
    private final HealthMonitorService healthMonitor;
    private final AppCatalog appCatalog;
    private final List<IdleTaskProducer> idleProducers;
    private final TickSource tickSource;
    private final CosProperties properties;
    private final Clock clock;

    private volatile boolean running;
    private volatile boolean paused;
    private volatile String pauseReason;
    private volatile boolean evaluating;
    private volatile Instant lastEvaluation;
    private volatile String lastError;
    private final AtomicLong evaluationCount = new AtomicLong();
    private final AtomicLong spawnedCount = new AtomicLong();

    public TaskEvaluatorService(TaskStoreService taskStore, TaskScheduleService scheduleService,
                                AgentSpawnerService spawner, ApprovalGateService approvalGate,
                                AutonomyConfigService configService, HealthMonitorService healthMonitor,
                                AppCatalog appCatalog, List<IdleTaskProducer> idleProducers,
                                TickSource tickSource, CosProperties properties, Clock clock) {
        this.taskStore = taskStore;
        this.scheduleService = scheduleService;
        this.spawner = spawner;
        this.approvalGate = approvalGate;
        this.configService = configService;
        this.healthMonitor = healthMonitor;
        this.appCatalog = appCatalog;
        this.idleProducers = idleProducers == null ? List.of() : List.copyOf(idleProducers);
        this.tickSource = tickSource;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isAutoStart()) {
            start();
        }
    }

    public synchronized CosStatus start() {
        if (running) {
            return status();
        }
        taskStore.resetOrphaned(spawner.activeTaskIds());
        running = true;
        paused = false;
        pauseReason = null;
        long interval = configService.getConfig().getEvaluationIntervalMs();
        tickSource.schedule(TICK, this::tick, 0, interval);
        healthMonitor.start();
        log.info("Chief of Staff started (level {}, every {}ms)", configService.levelName(), interval);
        return status();
    }

    public synchronized CosStatus stop() {
        running = false;
        tickSource.cancel(TICK);
        healthMonitor.stop();
        log.info("Chief of Staff stopped");
        return status();
    }

    public CosStatus pause(String reason) {
        paused = true;
        pauseReason = reason;
        log.info("Chief of Staff paused: {}", reason);
        return status();
    }

    public CosStatus resume() {
        paused = false;
        pauseReason = null;
        log.info("Chief of Staff resumed");
        return status();
    }

    /**
     * Queues an immediate evaluation on the evaluator lane, whether or not the loop is running.
     */
    public void evaluateNow() {
        tickSource.submit(TICK, () -> evaluate(true));
    }

    /**
     * One scheduled evaluation. Never throws; failures are logged and the next tick runs as usual.
     */
    public List<AgentRun> tick() {
        return evaluate(false);
    }

    public CosStatus status() {
        CosConfig config = configService.getConfig();
        Map<TaskQueue, List<Task>> tasks = taskStore.snapshot();
        return CosStatus.builder()
            .running(running)
            .paused(paused)
            .pauseReason(pauseReason)
            .level(config.getLevelName())
            .evaluationIntervalMs(config.getEvaluationIntervalMs())
            .maxConcurrentAgents(config.getMaxConcurrentAgents())
            .activeAgents(spawner.activeCount())
            .pendingUserTasks(countPending(tasks.get(TaskQueue.USER)))
            .pendingSystemTasks(countPending(tasks.get(TaskQueue.SYSTEM)))
            .awaitingApproval((int) tasks.values().stream().flatMap(List::stream).filter(Task::isAwaitingApproval).count())
            .lastEvaluation(lastEvaluation)
            .evaluationCount(evaluationCount.get())
            .spawnedCount(spawnedCount.get())
            .lastError(lastError)
            .build();
    }

    public boolean isRunning() {
        return running;
    }

    @EventListener
    public void onTaskQueueChanged(TaskQueueChangedEvent event) {
        if ("added".equals(event.action()) || "approved".equals(event.action()) || "requeued".equals(event.action())) {
            triggerImmediate("task " + event.action());
        }
    }

    @EventListener
    public void onAgentCompleted(AgentCompletedEvent event) {
        triggerImmediate("agent " + event.run().getId() + " finished");
    }

    @EventListener
    public synchronized void onConfigChanged(CosConfigChangedEvent event) {
        if (running && event.evaluationIntervalChanged()) {
            long interval = event.current().getEvaluationIntervalMs();
            tickSource.schedule(TICK, this::tick, interval, interval);
            log.info("Evaluation interval changed to {}ms", interval);
        }
    }

    private void triggerImmediate(String cause) {
        if (!running || paused || evaluating || !configService.getConfig().isImmediateExecution()) {
            return;
        }
        log.debug("Immediate evaluation: {}", cause);
        tickSource.submit(TICK, this::tick);
    }

    private List<AgentRun> evaluate(boolean forced) {
        evaluating = true;
        try {
            return evaluateOnce(forced);
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.error("Evaluation failed", e);
            return List.of();
        } finally {
            evaluating = false;
        }
    }

    private List<AgentRun> evaluateOnce(boolean forced) {
        if ((!running && !forced) || paused) {
            return List.of();
        }
        CosConfig config = configService.getConfig();
        if (!config.isSpawnEnabled()) {
            log.debug("Spawning disabled at level {}", config.getLevelName());
            return List.of();
        }
        Instant now = clock.instant();
        lastEvaluation = now;
        evaluationCount.incrementAndGet();

        int slots = config.getMaxConcurrentAgents() - spawner.activeCount();
        if (slots <= 0) {
            log.debug("At concurrency cap ({}), skipping evaluation", config.getMaxConcurrentAgents());
            return List.of();
        }

        Map<TaskQueue, List<Task>> tasks = taskStore.snapshot();
        List<Candidate> candidates = new ArrayList<>();
        for (Task task : approvalGate.admit(pending(tasks.get(TaskQueue.USER)), config)) {
            candidates.add(Candidate.of(task, Source.USER));
        }
        for (Task task : approvalGate.admit(pending(tasks.get(TaskQueue.SYSTEM)), config)) {
            candidates.add(Candidate.of(task, Source.SYSTEM));
        }
        if (config.isProactiveMode()) {
            candidates.addAll(scheduledCandidates(config, tasks.get(TaskQueue.SYSTEM), now));
        }
        if (candidates.isEmpty() && config.isIdleReviewEnabled()) {
            candidates.addAll(idleCandidates(config));
        }
        if (candidates.isEmpty()) {
            return List.of();
        }

        candidates.sort(RANKING);
        List<AgentRun> spawned = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (slots <= 0) {
                break;
            }
            AgentRun run = launch(candidate);
            if (run == null) {
                continue;
            }
            spawned.add(run);
            spawnedCount.incrementAndGet();
            if (run.isActive()) {
                slots--;
            }
        }
        if (!spawned.isEmpty()) {
            log.info("Evaluation spawned {} agent(s), {} slot(s) left", spawned.size(), slots);
        }
        return spawned;
    }

    private AgentRun launch(Candidate candidate) {
        Task task = candidate.task();
        try {
            if (candidate.scheduled()) {
                task = taskStore.add(task, TaskPosition.BOTTOM);
            }
            AgentRun run = spawner.spawn(task);
            if (candidate.scheduled()) {
                scheduleService.recordExecution(candidate.taskType().getTaskType(), candidate.appId());
            }
            return run;
        } catch (IllegalStateException | IllegalArgumentException e) {
            log.warn("Skipping candidate {}: {}", task.getId() != null ? task.getId() : task.getTaskType(), e.getMessage());
            return null;
        }
    }

    List<Candidate> scheduledCandidates(CosConfig config, List<Task> systemTasks, Instant now) {
        scheduleService.rehabilitateSkipped();
        ScheduleState schedule = scheduleService.snapshot();
        List<OnDemandRequest> requests = schedule.getOnDemandRequests();
        Set<String> busy = new HashSet<>();
        for (Task task : systemTasks) {
            if (task.getTaskType() != null
                && (task.getStatus() == TaskStatus.PENDING || task.getStatus() == TaskStatus.IN_PROGRESS)) {
                busy.add(key(task.getTaskType(), task.getApp()));
            }
        }
        List<String> apps = appsByLeastRecentlyServed(schedule);

        List<Candidate> candidates = new ArrayList<>();
        Map<String, List<Candidate>> rotation = new LinkedHashMap<>();
        for (TaskTypeConfig type : schedule.getTasks().values()) {
            if (type.getCategory() == TaskCategory.SELF_IMPROVEMENT) {
                if (!config.isSelfImprovementEnabled() || busy.contains(key(type.getTaskType(), null))) {
                    continue;
                }
                ScheduleDecision decision = scheduleService.decide(type, null, requests, now);
                if (decision.isShouldRun()) {
                    collect(decision, materialize(type, null, decision, now), candidates, rotation);
                }
            } else if (type.getCategory() == TaskCategory.APP_IMPROVEMENT) {
                if (!config.isAppImprovementEnabled()) {
                    continue;
                }
                for (String app : apps) {
                    if (busy.contains(key(type.getTaskType(), app))) {
                        continue;
                    }
                    ScheduleDecision decision = scheduleService.decide(type, app, requests, now);
                    if (!decision.isShouldRun()) {
                        continue;
                    }
                    if (decision.getReason() != ScheduleReason.ON_DEMAND_REQUESTED
                        && inCooldown(schedule, app, config, now)) {
                        continue;
                    }
                    collect(decision, materialize(type, app, decision, now), candidates, rotation);
                    if (!config.isComprehensiveAppImprovement()) {
                        break;
                    }
                }
            }
        }

        Candidate next = nextInRotation(rotation, schedule.getLastRotationType());
        if (next != null) {
            candidates.add(next);
        }
        return candidates;
    }

    private void collect(ScheduleDecision decision, Candidate candidate,
                         List<Candidate> candidates, Map<String, List<Candidate>> rotation) {
        if (decision.getReason() == ScheduleReason.ROTATION) {
            rotation.computeIfAbsent(candidate.taskType().getTaskType(), k -> new ArrayList<>()).add(candidate);
        } else {
            candidates.add(candidate);
        }
    }

    // The type after the last one served, wrapping around; its least-recently-served app wins.
    private Candidate nextInRotation(Map<String, List<Candidate>> rotation, String lastRotationType) {
        if (rotation.isEmpty()) {
            return null;
        }
        List<String> types = new ArrayList<>(rotation.keySet());
        int start = 0;
        if (lastRotationType != null) {
            int idx = types.indexOf(lastRotationType);
            if (idx >= 0) {
                start = idx + 1;
            } else {
                for (int i = 0; i < types.size(); i++) {
                    if (types.get(i).compareTo(lastRotationType) > 0) {
                        start = i;
                        break;
                    }
                }
            }
        }
        String chosen = types.get(start % types.size());
        return rotation.get(chosen).get(0);
    }

    private Candidate materialize(TaskTypeConfig type, String appId, ScheduleDecision decision, Instant now) {
        String prompt = scheduleService.renderPrompt(type, appId);
        int newline = prompt.indexOf('\n');
        String description = newline < 0 ? prompt : prompt.substring(0, newline).trim();
        String context = newline < 0 ? null : prompt.substring(newline + 1).trim();
        Task task = Task.builder()
            .queue(TaskQueue.SYSTEM)
            .description(description)
            .context(context == null || context.isEmpty() ? null : context)
            .priority(type.getPriority())
            .app(appId)
            .provider(type.getProviderId())
            .model(type.getModel())
            .taskType(type.getTaskType())
            .autoApproved(true)
            .createdAt(now)
            .build();
        Source source = decision.getReason() == ScheduleReason.ROTATION ? Source.ROTATION : Source.SCHEDULED;
        return new Candidate(task, source, type, appId);
    }

    private List<Candidate> idleCandidates(CosConfig config) {
        List<Candidate> candidates = new ArrayList<>();
        for (IdleTaskProducer producer : idleProducers) {
            try {
                for (Task produced : producer.produceIdleTasks(config)) {
                    Task task = produced.copy();
                    task.setQueue(TaskQueue.SYSTEM);
                    Task added = taskStore.add(task, TaskPosition.BOTTOM);
                    if (!approvalGate.isHeld(added, config)) {
                        candidates.add(Candidate.of(added, Source.IDLE));
                    }
                }
            } catch (RuntimeException e) {
                log.warn("Idle task producer {} failed", producer.getClass().getSimpleName(), e);
            }
        }
        return candidates;
    }

    private List<String> appsByLeastRecentlyServed(ScheduleState schedule) {
        Map<String, Instant> served = schedule.getAppLastServed();
        return appCatalog.activeApps().stream()
            .sorted(Comparator.comparing((String app) -> served.get(app), Comparator.nullsFirst(Comparator.naturalOrder())))
            .toList();
    }

    private boolean inCooldown(ScheduleState schedule, String app, CosConfig config, Instant now) {
        Instant served = schedule.getAppLastServed().get(app);
        return served != null && Duration.between(served, now).toMillis() < config.getAppReviewCooldownMs();
    }

    private static List<Task> pending(List<Task> tasks) {
        return tasks.stream()
            .filter(Task::isPending)
            .sorted(Comparator.comparingInt(Task::getOrder))
            .toList();
    }

    private static int countPending(List<Task> tasks) {
        return (int) tasks.stream().filter(Task::isPending).count();
    }

    private static String key(String taskType, String app) {
        return taskType + "|" + (app == null ? "" : app);
    }
}
