package com.autonomous.cos.controller;

import com.autonomous.cos.model.CosStatus;
import com.autonomous.cos.model.Task;
import com.autonomous.cos.model.TaskPosition;
import com.autonomous.cos.model.TaskPriority;
import com.autonomous.cos.model.TaskQueue;
import com.autonomous.cos.service.ApprovalGateService;
import com.autonomous.cos.service.TaskEvaluatorService;
import com.autonomous.cos.service.TaskStoreService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@RestController
@RequestMapping("/slack")
public class SlackController {

    private static final Pattern PRIORITY_FLAG = Pattern.compile("--priority\\s+(\\w+)", Pattern.CASE_INSENSITIVE);

    @Autowired
    private TaskStoreService taskStore;

    @Autowired
    private ApprovalGateService approvalGate;

    @Autowired
    private TaskEvaluatorService evaluator;

    @PostMapping("/events")
    public ResponseEntity<?> handleSlackEvent(@RequestBody Map<String, Object> payload) {
        if (payload.containsKey("challenge")) {
            return ResponseEntity.ok(Map.of("challenge", payload.get("challenge")));
        }
        log.debug("Ignoring Slack event of type {}", payload.get("type"));
        return ResponseEntity.ok().build();
    }

    @PostMapping("/slash-commands")
    public ResponseEntity<?> handleSlashCommand(@RequestParam Map<String, String> params) {
        String command = params.getOrDefault("command", "");
        String text = params.getOrDefault("text", "").trim();

        String response;
        try {
            response = switch (command) {
                case "/cos-task" -> handleTask(text, params.get("user_id"));
                case "/cos-approve" -> handleApprove(text);
                case "/cos-status" -> handleStatus();
                case "/cos-stop" -> handleStop();
                default -> "Unknown command: " + command;
            };
        } catch (IllegalArgumentException | IllegalStateException e) {
            response = "Error: " + e.getMessage();
        }

        return ResponseEntity.ok(Map.of(
            "response_type", "in_channel",
            "text", response
        ));
    }

    private String handleTask(String text, String userId) {
        TaskPriority priority = TaskPriority.MEDIUM;
        Matcher matcher = PRIORITY_FLAG.matcher(text);
        if (matcher.find()) {
            priority = TaskPriority.fromValue(matcher.group(1));
            text = matcher.replaceFirst("").trim();
        }
        if (text.isEmpty()) {
            return "Usage: /cos-task [--priority high] <description>";
        }
        Task task = taskStore.add(Task.builder()
            .queue(TaskQueue.USER)
            .description(text)
            .priority(priority)
            .build(), TaskPosition.BOTTOM);
        log.info("Slack user {} queued {}", userId, task.getId());
        return String.format("Queued *%s* (%s): %s", task.getId(), task.getPriority(), task.getDescription());
    }

    private String handleApprove(String taskId) {
        if (taskId.isEmpty()) {
            return "Usage: /cos-approve <task-id>";
        }
        Task task = approvalGate.approve(taskId);
        return String.format("Approved *%s*: %s", task.getId(), task.getDescription());
    }

    private String handleStatus() {
        CosStatus status = evaluator.status();
        return String.format("Chief of Staff is *%s* (level %s)\nActive agents: %d/%d\nPending: %d user, %d system\nAwaiting approval: %d",
            status.isRunning() ? (status.isPaused() ? "paused" : "running") : "stopped",
            status.getLevel(),
            status.getActiveAgents(),
            status.getMaxConcurrentAgents(),
            status.getPendingUserTasks(),
            status.getPendingSystemTasks(),
            status.getAwaitingApproval());
    }

    private String handleStop() {
        if (!evaluator.isRunning()) {
            return "Chief of Staff is not running.";
        }
        evaluator.stop();
        return "Chief of Staff stopped.";
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }
}
