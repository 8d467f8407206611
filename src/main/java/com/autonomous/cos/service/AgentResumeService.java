package com.autonomous.cos.service;

import com.autonomous.cos.config.CosProperties;
import com.autonomous.cos.model.AgentRun;
import com.autonomous.cos.model.ResumeContext;
import com.autonomous.cos.model.Task;
import com.autonomous.cos.model.TaskPosition;
import com.autonomous.cos.model.TaskPriority;
import com.autonomous.cos.model.TaskQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds continuation tasks from finished agent runs. The original run is never modified.
 */
@Slf4j
@Service
public class AgentResumeService {

    private final AgentSpawnerService spawner;
    private final TaskStoreService taskStore;
    private final CosProperties properties;

    public AgentResumeService(AgentSpawnerService spawner, TaskStoreService taskStore, CosProperties properties) {
        this.spawner = spawner;
        this.taskStore = taskStore;
        this.properties = properties;
    }

    public ResumeContext buildResumeContext(String agentId) {
        AgentRun run = spawner.get(agentId);
        if (run.isActive()) {
            throw new IllegalStateException("Agent " + agentId + " is still " + run.getStatus().getValue());
        }
        List<String> output = run.getOutput();
        int keep = Math.max(0, properties.getAgent().getResumeOutputLines());
        List<String> recent = new ArrayList<>(output.subList(Math.max(0, output.size() - keep), output.size()));
        return ResumeContext.builder()
            .agentId(run.getId())
            .taskId(run.getTaskId())
            .originalDescription(run.getTaskDescription())
            .previousStatus(run.getStatus())
            .previousResult(run.getResult())
            .recentOutput(recent)
            .app(run.getApp())
            .provider(run.getProvider())
            .model(run.getModel())
            .build();
    }

    /**
     * Queues a new task that carries the context of a finished run. It goes to the top of
     * the run's queue so it is picked up next.
     */
    public Task resume(String agentId, String extraInstructions) {
        ResumeContext context = buildResumeContext(agentId);
        AgentRun run = spawner.get(agentId);
        TaskPriority priority = taskStore.findTask(context.getTaskId())
            .map(Task::getPriority)
            .orElse(TaskPriority.MEDIUM);

        Task task = Task.builder()
            .queue(run.getQueue() == null ? TaskQueue.USER : run.getQueue())
            .description(context.getOriginalDescription())
            .context(formatContext(context, extraInstructions))
            .priority(priority)
            .app(context.getApp())
            .provider(context.getProvider())
            .model(context.getModel())
            .build();
        Task created = taskStore.add(task, TaskPosition.TOP);
        log.info("Queued {} to resume {}", created.getId(), agentId);
        return created;
    }

    String formatContext(ResumeContext context, String extraInstructions) {
        StringBuilder out = new StringBuilder();
        out.append("Resuming from agent ").append(context.getAgentId())
            .append(" (task ").append(context.getTaskId()).append(", ")
            .append(context.getPreviousStatus().getValue()).append(")\n");
        if (context.getPreviousResult() != null && context.getPreviousResult().getError() != null) {
            out.append("Previous error: ").append(context.getPreviousResult().getError()).append('\n');
        }
        if (!context.getRecentOutput().isEmpty()) {
            out.append("\nLast output:\n");
            context.getRecentOutput().forEach(line -> out.append(line).append('\n'));
        }
        if (extraInstructions != null && !extraInstructions.isBlank()) {
            out.append("\nAdditional instructions:\n").append(extraInstructions).append('\n');
        }
        return out.toString().stripTrailing();
    }
}
