package com.autonomous.cos.service;

import com.autonomous.cos.config.CosProperties;
import com.autonomous.cos.event.AgentCompletedEvent;
import com.autonomous.cos.exception.ResourceNotFoundException;
import com.autonomous.cos.model.AgentResult;
import com.autonomous.cos.model.AgentRun;
import com.autonomous.cos.model.AgentRunStatus;
import com.autonomous.cos.model.Task;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Launches agent runs for tasks and settles the task, learning data and run record
 * when the process exits. Spawning never waits on the process.
 */
@Slf4j
@Service
public class AgentSpawnerService {

    private final TaskStoreService taskStore;
    private final TaskLearningService learning;
    private final ProcessLauncher launcher;
    private final AppCatalog appCatalog;
    private final ApplicationEventPublisher events;
    private final CosProperties properties;
    private final Clock clock;

    private final Map<String, AgentRun> runs = new LinkedHashMap<>();
    private final Map<String, AgentProcess> processes = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public AgentSpawnerService(TaskStoreService taskStore, TaskLearningService learning, ProcessLauncher launcher,
                               AppCatalog appCatalog, ApplicationEventPublisher events, CosProperties properties,
                               Clock clock) {
        this.taskStore = taskStore;
        this.learning = learning;
        this.launcher = launcher;
        this.appCatalog = appCatalog;
        this.events = events;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Starts an agent for a pending task. The returned run is either running or, if the
     * process could not be started, already in {@code error} with the task blocked.
     *
     * @throws IllegalStateException if the task already has an active run or is not pending
     */
    public AgentRun spawn(Task task) {
        String agentId = "agent-" + UUID.randomUUID().toString().substring(0, 8);
        AgentRun run = AgentRun.builder()
            .id(agentId)
            .taskId(task.getId())
            .queue(task.getQueue())
            .taskDescription(task.getDescription())
            .app(task.getApp())
            .provider(task.getProvider())
            .model(task.getModel())
            .taskType(task.getTaskType())
            .status(AgentRunStatus.SPAWNING)
            .startedAt(clock.instant())
            .build();

        lock.lock();
        try {
            if (hasActiveRunLocked(task.getId())) {
                throw new IllegalStateException("Task " + task.getId() + " already has an active agent");
            }
            runs.put(agentId, run);
        } finally {
            lock.unlock();
        }

        try {
            taskStore.markInProgress(task.getId(), agentId);
        } catch (RuntimeException e) {
            lock.lock();
            try {
                runs.remove(agentId);
            } finally {
                lock.unlock();
            }
            throw e;
        }

        AgentProcess process;
        try {
            process = launcher.launch(launchRequest(agentId, task), line -> appendOutput(agentId, line));
        } catch (Exception e) {
            return failSpawn(agentId, task, e);
        }

        lock.lock();
        try {
            run.setPid(process.pid());
            run.setStatus(AgentRunStatus.RUNNING);
            processes.put(agentId, process);
        } finally {
            lock.unlock();
        }
        log.info("Spawned {} for task {} (pid {})", agentId, task.getId(), process.pid());

        process.onExit().whenComplete((code, error) -> handleExit(agentId, code, error));
        return get(agentId);
    }

    public AgentRun terminate(String agentId, boolean deleteTask) {
        return stop(agentId, deleteTask, false);
    }

    public AgentRun kill(String agentId, boolean deleteTask) {
        return stop(agentId, deleteTask, true);
    }

    public List<AgentRun> list() {
        lock.lock();
        try {
            return runs.values().stream()
                .sorted(Comparator.comparing(AgentRun::getStartedAt).reversed())
                .map(AgentRun::copy)
                .toList();
        } finally {
            lock.unlock();
        }
    }

    public List<AgentRun> listActive() {
        lock.lock();
        try {
            return runs.values().stream().filter(AgentRun::isActive).map(AgentRun::copy).toList();
        } finally {
            lock.unlock();
        }
    }

    public AgentRun get(String agentId) {
        lock.lock();
        try {
            return require(agentId).copy();
        } finally {
            lock.unlock();
        }
    }

    public AgentRun delete(String agentId) {
        lock.lock();
        try {
            AgentRun run = require(agentId);
            if (run.isActive()) {
                throw new IllegalStateException("Agent " + agentId + " is still " + run.getStatus().getValue());
            }
            runs.remove(agentId);
            return run.copy();
        } finally {
            lock.unlock();
        }
    }

    public int clearCompleted() {
        lock.lock();
        try {
            List<String> done = runs.values().stream()
                .filter(r -> r.getStatus() == AgentRunStatus.COMPLETED)
                .map(AgentRun::getId)
                .toList();
            done.forEach(runs::remove);
            return done.size();
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return (int) runs.values().stream().filter(AgentRun::isActive).count();
        } finally {
            lock.unlock();
        }
    }

    public Set<String> activeTaskIds() {
        lock.lock();
        try {
            return runs.values().stream()
                .filter(AgentRun::isActive)
                .map(AgentRun::getTaskId)
                .collect(Collectors.toSet());
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        List<AgentProcess> live;
        lock.lock();
        try {
            live = new ArrayList<>(processes.values());
        } finally {
            lock.unlock();
        }
        if (!live.isEmpty()) {
            log.warn("Killing {} live agent processes on shutdown", live.size());
        }
        live.forEach(AgentProcess::destroyForcibly);
    }

    /**
     * Last non-blank line mentioning an error, else the last non-blank line, else a
     * generic exit-code message.
     */
    static String extractError(List<String> output, int exitCode) {
        String last = null;
        for (int i = output.size() - 1; i >= 0; i--) {
            String line = output.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            if (last == null) {
                last = line.trim();
            }
            if (line.toLowerCase().contains("error")) {
                return line.trim();
            }
        }
        return last != null ? last : "Agent exited with code " + exitCode;
    }

    private AgentRun stop(String agentId, boolean deleteTask, boolean force) {
        AgentRun snapshot;
        AgentProcess process;
        lock.lock();
        try {
            AgentRun run = require(agentId);
            if (!run.isActive()) {
                throw new IllegalStateException("Agent " + agentId + " is already " + run.getStatus().getValue());
            }
            Instant now = clock.instant();
            run.setStatus(AgentRunStatus.CANCELLED);
            run.setCompletedAt(now);
            run.setResult(AgentResult.builder()
                .success(false)
                .error(force ? "Killed" : "Terminated")
                .durationMs(Duration.between(run.getStartedAt(), now).toMillis())
                .build());
            process = processes.remove(agentId);
            snapshot = run.copy();
        } finally {
            lock.unlock();
        }

        if (process != null) {
            if (force) {
                process.destroyForcibly();
            } else {
                process.destroy();
                long grace = properties.getAgent().getKillGraceMs();
                CompletableFuture.delayedExecutor(grace, TimeUnit.MILLISECONDS).execute(() -> {
                    if (process.isAlive()) {
                        log.warn("Agent {} ignored termination, killing", agentId);
                        process.destroyForcibly();
                    }
                });
            }
        }

        if (deleteTask) {
            taskStore.findTask(snapshot.getTaskId()).ifPresent(t -> taskStore.delete(t.getId(), t.getQueue()));
        } else {
            taskStore.returnToPending(snapshot.getTaskId());
        }
        log.info("{} agent {} (task {})", force ? "Killed" : "Terminated", agentId, snapshot.getTaskId());
        return snapshot;
    }

    private AgentRun failSpawn(String agentId, Task task, Exception cause) {
        String reason = "Failed to start agent: " + cause.getMessage();
        log.error("Spawn of {} for task {} failed", agentId, task.getId(), cause);
        AgentRun snapshot;
        lock.lock();
        try {
            AgentRun run = runs.get(agentId);
            Instant now = clock.instant();
            run.setStatus(AgentRunStatus.ERROR);
            run.setCompletedAt(now);
            run.setResult(AgentResult.builder()
                .success(false)
                .error(reason)
                .durationMs(Duration.between(run.getStartedAt(), now).toMillis())
                .build());
            snapshot = run.copy();
        } finally {
            lock.unlock();
        }
        taskStore.markBlocked(task.getId(), reason);
        return snapshot;
    }

    /**
     * Settles the task and the learning table first, then commits the run's terminal state
     * exactly once. A run cancelled while its process was exiting is left as it is.
     */
    private void handleExit(String agentId, Integer exitCode, Throwable error) {
        AgentRun view;
        lock.lock();
        try {
            processes.remove(agentId);
            AgentRun run = runs.get(agentId);
            if (run == null || !run.isActive()) {
                // cancelled or deleted while the process was winding down
                return;
            }
            view = run.copy();
        } finally {
            lock.unlock();
        }

        Instant now = clock.instant();
        long durationMs = Duration.between(view.getStartedAt(), now).toMillis();
        AgentRunStatus status;
        AgentResult result = AgentResult.builder().exitCode(exitCode).durationMs(durationMs).build();
        if (error != null) {
            status = AgentRunStatus.ERROR;
            result.setError(rootMessage(error));
        } else if (exitCode != null && exitCode == 0) {
            status = AgentRunStatus.COMPLETED;
            result.setSuccess(true);
        } else {
            status = AgentRunStatus.FAILED;
            result.setError(extractError(view.getOutput(), exitCode == null ? -1 : exitCode));
        }

        try {
            if (result.isSuccess()) {
                taskStore.markCompleted(view.getTaskId());
            } else {
                taskStore.markBlocked(view.getTaskId(), result.getError());
            }
            Task learningView = Task.builder()
                .description(view.getTaskDescription())
                .taskType(view.getTaskType())
                .build();
            learning.recordCompletion(learningView, durationMs, result.isSuccess());
        } catch (RuntimeException e) {
            log.error("Completion handling for {} failed", agentId, e);
            status = AgentRunStatus.ERROR;
            result.setSuccess(false);
            result.setError("Completion handling failed: " + e.getMessage());
        }

        AgentRun snapshot;
        lock.lock();
        try {
            AgentRun run = runs.get(agentId);
            if (run == null || !run.isActive()) {
                log.info("Agent {} was settled elsewhere while exiting; keeping its state", agentId);
                return;
            }
            run.setStatus(status);
            run.setCompletedAt(now);
            run.setResult(result);
            snapshot = run.copy();
        } finally {
            lock.unlock();
        }

        log.info("Agent {} finished: {} in {}ms", agentId, snapshot.getStatus().getValue(), durationMs);
        events.publishEvent(new AgentCompletedEvent(snapshot));
    }

    private void appendOutput(String agentId, String line) {
        int max = properties.getAgent().getMaxOutputLines();
        lock.lock();
        try {
            AgentRun run = runs.get(agentId);
            if (run == null || !run.isActive()) {
                return;
            }
            List<String> output = run.getOutput();
            output.add(line);
            if (output.size() > max) {
                output.subList(0, output.size() - max).clear();
            }
        } finally {
            lock.unlock();
        }
    }

    private ProcessLauncher.LaunchRequest launchRequest(String agentId, Task task) {
        StringBuilder prompt = new StringBuilder(task.getDescription());
        if (task.getContext() != null && !task.getContext().isBlank()) {
            prompt.append("\n\nContext:\n").append(task.getContext());
        }
        if (task.getAttachments() != null && !task.getAttachments().isEmpty()) {
            prompt.append("\n\nAttachments:\n");
            task.getAttachments().forEach(a -> prompt.append("- ").append(a).append('\n'));
        }
        String workspace = appCatalog.workspaceFor(task.getApp()).orElse(properties.getDefaultWorkspace());
        return new ProcessLauncher.LaunchRequest(agentId, prompt.toString(), workspace, task.getProvider(),
            task.getModel(), task.getPriority(), task.getDescription());
    }

    private boolean hasActiveRunLocked(String taskId) {
        return runs.values().stream().anyMatch(r -> r.isActive() && taskId.equals(r.getTaskId()));
    }

    private AgentRun require(String agentId) {
        AgentRun run = runs.get(agentId);
        if (run == null) {
            throw new ResourceNotFoundException("Agent not found: " + agentId);
        }
        return run;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
