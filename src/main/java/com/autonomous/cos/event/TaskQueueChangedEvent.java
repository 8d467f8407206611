package com.autonomous.cos.event;

import com.autonomous.cos.model.TaskQueue;

public record TaskQueueChangedEvent(TaskQueue queue, String taskId, String action) {
}
