package com.autonomous.cos.service;

import com.autonomous.cos.config.CosProperties;
import com.autonomous.cos.event.AgentCompletedEvent;
import com.autonomous.cos.model.AgentRun;
import com.autonomous.cos.model.AgentRunStatus;
import com.autonomous.cos.model.HealthIssue;
import com.autonomous.cos.model.HealthReport;
import com.autonomous.cos.model.Task;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * User-visible alerts, posted to the configured Slack channel.
 */
@Slf4j
@Service
public class NotificationService {

    private final SlackService slackService;
    private final CosProperties properties;

    public NotificationService(SlackService slackService, CosProperties properties) {
        this.slackService = slackService;
        this.properties = properties;
    }

    public void notifyHealthIssues(HealthReport report) {
        StringBuilder message = new StringBuilder();
        message.append("*Health check found ").append(report.getIssues().size()).append(" issue(s)*\n\n");
        for (HealthIssue issue : report.getIssues()) {
            message.append("• [").append(issue.getSeverity()).append("] ").append(issue.getMessage()).append("\n");
        }
        send(message.toString().stripTrailing());
    }

    public void notifyAgentFailed(AgentRun run) {
        StringBuilder message = new StringBuilder();
        message.append("*Agent ").append(run.getStatus().getValue()).append("*\n\n");
        message.append("*Task:* ").append(run.getTaskId()).append(" ").append(run.getTaskDescription()).append("\n");
        if (run.getApp() != null) {
            message.append("*App:* ").append(run.getApp()).append("\n");
        }
        if (run.getResult() != null && run.getResult().getError() != null) {
            message.append("*Error:* ").append(run.getResult().getError());
        }
        send(message.toString().stripTrailing());
    }

    public void notifyAwaitingApproval(Task task) {
        send(String.format("*Approval needed*\n%s %s\nReply with `/cos-approve %s`",
            task.getId(), task.getDescription(), task.getId()));
    }

    @EventListener
    public void onAgentCompleted(AgentCompletedEvent event) {
        AgentRunStatus status = event.run().getStatus();
        if (status == AgentRunStatus.FAILED || status == AgentRunStatus.ERROR) {
            notifyAgentFailed(event.run());
        }
    }

    private void send(String message) {
        String channel = properties.getSlack().getAlertChannel();
        if (channel == null || channel.isBlank()) {
            log.info("Notification (no alert channel configured): {}", message);
            return;
        }
        slackService.postMessage(channel, message);
    }
}
