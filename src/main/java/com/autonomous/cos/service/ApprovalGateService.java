package com.autonomous.cos.service;

import com.autonomous.cos.model.CosConfig;
import com.autonomous.cos.model.Task;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Holds tasks that need a human decision. Approving releases the task to the
 * evaluator; rejecting deletes it.
 */
@Slf4j
@Service
public class ApprovalGateService {

    private final TaskStoreService taskStore;

    public ApprovalGateService(TaskStoreService taskStore) {
        this.taskStore = taskStore;
    }

    public boolean isHeld(Task task, CosConfig config) {
        return task.isAwaitingApproval() && !config.isApprovalGateBypassed();
    }

    public List<Task> admit(List<Task> candidates, CosConfig config) {
        return candidates.stream().filter(task -> !isHeld(task, config)).toList();
    }

    public List<Task> awaitingApproval() {
        return taskStore.awaitingApproval();
    }

    public Task approve(String taskId) {
        return taskStore.approve(taskId);
    }

    public Task reject(String taskId) {
        Task task = taskStore.get(taskId);
        if (!task.isAwaitingApproval()) {
            throw new IllegalArgumentException("Task is not awaiting approval: " + taskId);
        }
        log.info("Rejected task {}", taskId);
        return taskStore.delete(taskId, task.getQueue());
    }
}
