package com.autonomous.cos.controller;

import com.autonomous.cos.dto.AddTaskRequest;
import com.autonomous.cos.dto.LevelRequest;
import com.autonomous.cos.dto.PauseRequest;
import com.autonomous.cos.dto.ReorderRequest;
import com.autonomous.cos.dto.ResumeRequest;
import com.autonomous.cos.dto.TriggerRequest;
import com.autonomous.cos.exception.ResourceNotFoundException;
import com.autonomous.cos.model.AgentRun;
import com.autonomous.cos.model.AppOverride;
import com.autonomous.cos.model.CosConfig;
import com.autonomous.cos.model.CosConfigPatch;
import com.autonomous.cos.model.CosStatus;
import com.autonomous.cos.model.DurationEstimate;
import com.autonomous.cos.model.DurationStat;
import com.autonomous.cos.model.HealthReport;
import com.autonomous.cos.model.OnDemandRequest;
import com.autonomous.cos.model.ScheduleDecision;
import com.autonomous.cos.model.SkippedTaskType;
import com.autonomous.cos.model.Task;
import com.autonomous.cos.model.TaskPatch;
import com.autonomous.cos.model.TaskQueue;
import com.autonomous.cos.model.TaskStatus;
import com.autonomous.cos.model.TaskTypeConfig;
import com.autonomous.cos.model.TaskTypePatch;
import com.autonomous.cos.model.UpcomingTask;
import com.autonomous.cos.service.AgentResumeService;
import com.autonomous.cos.service.AgentSpawnerService;
import com.autonomous.cos.service.ApprovalGateService;
import com.autonomous.cos.service.AutonomyConfigService;
import com.autonomous.cos.service.HealthMonitorService;
import com.autonomous.cos.service.TaskEvaluatorService;
import com.autonomous.cos.service.TaskLearningService;
import com.autonomous.cos.service.TaskScheduleService;
import com.autonomous.cos.service.TaskStoreService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/cos")
public class ChiefOfStaffController {

    private final TaskStoreService taskStore;
    private final TaskScheduleService scheduleService;
    private final TaskLearningService learningService;
    private final AgentSpawnerService spawner;
    private final AgentResumeService resumeService;
    private final ApprovalGateService approvalGate;
    private final AutonomyConfigService configService;
    private final TaskEvaluatorService evaluator;
    private final HealthMonitorService healthMonitor;

    public ChiefOfStaffController(TaskStoreService taskStore, TaskScheduleService scheduleService,
                                  TaskLearningService learningService, AgentSpawnerService spawner,
                                  AgentResumeService resumeService, ApprovalGateService approvalGate,
                                  AutonomyConfigService configService, TaskEvaluatorService evaluator,
                                  HealthMonitorService healthMonitor) {
        this.taskStore = taskStore;
        this.scheduleService = scheduleService;
        this.learningService = learningService;
        this.spawner = spawner;
        this.resumeService = resumeService;
        this.approvalGate = approvalGate;
        this.configService = configService;
        this.evaluator = evaluator;
        this.healthMonitor = healthMonitor;
    }

    // Tasks

    @GetMapping("/tasks")
    public List<Task> listTasks(@RequestParam(defaultValue = "user") String queue,
                                @RequestParam(required = false) String status) {
        return taskStore.listByStatus(TaskQueue.fromValue(queue), status == null ? null : TaskStatus.fromValue(status));
    }

    @GetMapping("/tasks/awaiting-approval")
    public List<Task> awaitingApproval() {
        return approvalGate.awaitingApproval();
    }

    @GetMapping("/tasks/{id}")
    public Task getTask(@PathVariable String id) {
        return taskStore.get(id);
    }

    @PostMapping("/tasks")
    public ResponseEntity<Task> addTask(@RequestBody AddTaskRequest request) {
        Task created = taskStore.add(request.toTask(), request.positionOrDefault());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PatchMapping("/tasks/{id}")
    public Task updateTask(@PathVariable String id, @RequestBody TaskPatch patch) {
        return taskStore.update(id, patch);
    }

    @DeleteMapping("/tasks/{id}")
    public Task deleteTask(@PathVariable String id, @RequestParam(required = false) String queue) {
        return taskStore.delete(id, queue == null ? null : TaskQueue.fromValue(queue));
    }

    @PostMapping("/tasks/reorder")
    public List<Task> reorder(@RequestParam(defaultValue = "user") String queue, @RequestBody ReorderRequest request) {
        return taskStore.reorder(TaskQueue.fromValue(queue), request.getTaskIds());
    }

    @PostMapping("/tasks/{id}/approve")
    public Task approve(@PathVariable String id) {
        return approvalGate.approve(id);
    }

    @PostMapping("/tasks/{id}/reject")
    public Task reject(@PathVariable String id) {
        return approvalGate.reject(id);
    }

    // Schedule

    @GetMapping("/schedule")
    public List<TaskTypeConfig> listTaskTypes() {
        return scheduleService.list();
    }

    @GetMapping("/schedule/upcoming")
    public List<UpcomingTask> upcoming(@RequestParam(defaultValue = "10") int limit) {
        return scheduleService.upcoming(limit);
    }

    @GetMapping("/schedule/on-demand")
    public List<OnDemandRequest> onDemandRequests() {
        return scheduleService.onDemandRequests();
    }

    @GetMapping("/schedule/{taskType}")
    public TaskTypeConfig getTaskType(@PathVariable String taskType) {
        return scheduleService.get(taskType);
    }

    @PutMapping("/schedule/{taskType}")
    public TaskTypeConfig updateTaskType(@PathVariable String taskType, @RequestBody TaskTypePatch patch) {
        return scheduleService.update(taskType, patch);
    }

    @GetMapping("/schedule/{taskType}/decision")
    public ScheduleDecision decision(@PathVariable String taskType, @RequestParam(required = false) String appId) {
        return scheduleService.shouldRun(taskType, appId);
    }

    @GetMapping("/schedule/{taskType}/apps/{appId}")
    public AppOverride getAppOverride(@PathVariable String taskType, @PathVariable String appId) {
        return scheduleService.getAppOverride(taskType, appId)
            .orElseThrow(() -> new ResourceNotFoundException("No override for " + taskType + " on " + appId));
    }

    @PutMapping("/schedule/{taskType}/apps/{appId}")
    public TaskTypeConfig setAppOverride(@PathVariable String taskType, @PathVariable String appId,
                                         @RequestBody AppOverride override) {
        return scheduleService.setAppOverride(taskType, appId, override);
    }

    @DeleteMapping("/schedule/{taskType}/apps/{appId}")
    public TaskTypeConfig clearAppOverride(@PathVariable String taskType, @PathVariable String appId) {
        return scheduleService.clearAppOverride(taskType, appId);
    }

    @PostMapping("/schedule/{taskType}/trigger")
    public OnDemandRequest trigger(@PathVariable String taskType, @RequestBody(required = false) TriggerRequest request) {
        OnDemandRequest created = scheduleService.trigger(taskType, request == null ? null : request.getAppId());
        if (evaluator.isRunning()) {
            evaluator.evaluateNow();
        }
        return created;
    }

    @PostMapping("/schedule/{taskType}/reset")
    public TaskTypeConfig resetHistory(@PathVariable String taskType, @RequestParam(required = false) String appId) {
        return scheduleService.reset(taskType, appId);
    }

    // Agents

    @GetMapping("/agents")
    public List<AgentRun> listAgents(@RequestParam(defaultValue = "false") boolean active) {
        return active ? spawner.listActive() : spawner.list();
    }

    @GetMapping("/agents/{id}")
    public AgentRun getAgent(@PathVariable String id) {
        return spawner.get(id);
    }

    @PostMapping("/agents/{id}/terminate")
    public AgentRun terminate(@PathVariable String id, @RequestParam(defaultValue = "false") boolean deleteTask) {
        return spawner.terminate(id, deleteTask);
    }

    @PostMapping("/agents/{id}/kill")
    public AgentRun kill(@PathVariable String id, @RequestParam(defaultValue = "false") boolean deleteTask) {
        return spawner.kill(id, deleteTask);
    }

    @DeleteMapping("/agents/{id}")
    public AgentRun deleteAgent(@PathVariable String id) {
        return spawner.delete(id);
    }

    @PostMapping("/agents/clear-completed")
    public Map<String, Integer> clearCompleted() {
        return Map.of("cleared", spawner.clearCompleted());
    }

    @PostMapping("/agents/{id}/resume")
    public ResponseEntity<Task> resumeAgent(@PathVariable String id, @RequestBody(required = false) ResumeRequest request) {
        Task task = resumeService.resume(id, request == null ? null : request.getInstructions());
        return ResponseEntity.status(HttpStatus.CREATED).body(task);
    }

    // Learning

    @GetMapping("/learning/estimate")
    public DurationEstimate estimate(@RequestParam String description,
                                     @RequestParam(required = false) String taskType) {
        return learningService.estimate(Task.builder().description(description).taskType(taskType).build());
    }

    @GetMapping("/learning/skipped")
    public List<SkippedTaskType> skippedTaskTypes() {
        return learningService.skippedWithStatus();
    }

    @GetMapping("/learning/stats")
    public Map<String, DurationStat> learningStats() {
        return learningService.stats();
    }

    @DeleteMapping("/learning/{bucket}")
    public DurationStat resetBucket(@PathVariable String bucket) {
        return learningService.resetBucket(bucket);
    }

    // Config

    @GetMapping("/config")
    public CosConfig getConfig() {
        return configService.getConfig();
    }

    @PatchMapping("/config")
    public CosConfig updateConfig(@RequestBody CosConfigPatch patch) {
        return configService.update(patch);
    }

    @PostMapping("/config/level")
    public CosConfig applyLevel(@RequestBody LevelRequest request) {
        if (request.getLevel() == null) {
            throw new IllegalArgumentException("level is required");
        }
        return configService.applyLevel(request.getLevel());
    }

    // Daemon

    @GetMapping("/status")
    public CosStatus status() {
        return evaluator.status();
    }

    @PostMapping("/start")
    public CosStatus start() {
        return evaluator.start();
    }

    @PostMapping("/stop")
    public CosStatus stop() {
        return evaluator.stop();
    }

    @PostMapping("/pause")
    public CosStatus pause(@RequestBody(required = false) PauseRequest request) {
        return evaluator.pause(request == null || request.getReason() == null ? "manual" : request.getReason());
    }

    @PostMapping("/resume")
    public CosStatus resume() {
        return evaluator.resume();
    }

    @PostMapping("/evaluate")
    public ResponseEntity<CosStatus> evaluate() {
        evaluator.evaluateNow();
        return ResponseEntity.accepted().body(evaluator.status());
    }

    // Health

    @GetMapping("/health")
    public HealthReport health() {
        return healthMonitor.latest()
            .orElseThrow(() -> new ResourceNotFoundException("No health check has run yet"));
    }

    @PostMapping("/health/check")
    public HealthReport runHealthCheck() {
        return healthMonitor.runCheck();
    }
}
