package com.autonomous.cos.service;

import com.autonomous.cos.model.CosConfig;
import com.autonomous.cos.model.Task;

import java.util.List;

/**
 * Supplies proactive work when nothing else is eligible and idle review is enabled.
 * Returned tasks are added to the system queue before they are considered.
 */
public interface IdleTaskProducer {

    List<Task> produceIdleTasks(CosConfig config);
}
