package com.autonomous.cos.service;

import com.autonomous.cos.config.CosProperties;
import com.autonomous.cos.event.TaskQueueChangedEvent;
import com.autonomous.cos.exception.ResourceNotFoundException;
import com.autonomous.cos.model.Task;
import com.autonomous.cos.model.TaskPatch;
import com.autonomous.cos.model.TaskPosition;
import com.autonomous.cos.model.TaskQueue;
import com.autonomous.cos.model.TaskStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Owns the user and system task queues. All mutations go through one lock and are
 * written to disk before the call returns; every read hands out copies.
 */
@Slf4j
@Service
public class TaskStoreService {

    private final CosProperties properties;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final TaskMarkdownCodec codec = new TaskMarkdownCodec(new ObjectMapper());

    private final Map<TaskQueue, List<Task>> queues = new EnumMap<>(TaskQueue.class);
    private final ReentrantLock lock = new ReentrantLock();

    public TaskStoreService(CosProperties properties, ApplicationEventPublisher events, Clock clock) {
        this.properties = properties;
        this.events = events;
        this.clock = clock;
        for (TaskQueue queue : TaskQueue.values()) {
            queues.put(queue, new ArrayList<>());
        }
    }

    @PostConstruct
    public void load() {
        lock.lock();
        try {
            for (TaskQueue queue : TaskQueue.values()) {
                Path file = fileFor(queue);
                List<Task> tasks = new ArrayList<>();
                if (Files.exists(file)) {
                    try {
                        tasks.addAll(codec.parse(Files.readString(file), queue));
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to read " + file, e);
                    }
                }
                queues.put(queue, tasks);
                normalizeOrder(queue);
                log.info("Loaded {} {} tasks from {}", tasks.size(), queue.getValue(), file);
            }
        } finally {
            lock.unlock();
        }
    }

    public Task add(Task task, TaskPosition position) {
        if (task.getDescription() == null || task.getDescription().isBlank()) {
            throw new IllegalArgumentException("Task description is required");
        }
        TaskQueue queue = task.getQueue() == null ? TaskQueue.USER : task.getQueue();
        Task stored = task.copy();
        stored.setQueue(queue);
        stored.setExtra(TaskMarkdownCodec.sanitizeExtra(task.getExtra()));
        if (stored.getStatus() == null) {
            stored.setStatus(TaskStatus.PENDING);
        }

        Task result;
        lock.lock();
        try {
            if (stored.getId() == null || stored.getId().isBlank()) {
                stored.setId(nextId(queue));
            } else if (!stored.getId().matches("[\\w-]+")) {
                throw new IllegalArgumentException("Invalid task id: " + stored.getId());
            } else if (find(stored.getId()).isPresent()) {
                throw new IllegalArgumentException("Task already exists: " + stored.getId());
            }
            if (stored.getCreatedAt() == null) {
                stored.setCreatedAt(clock.instant());
            }
            List<Task> tasks = queues.get(queue);
            if (stored.isPending()) {
                stored.setOrder(position == TaskPosition.TOP ? minPendingOrder(queue) - 1 : maxPendingOrder(queue) + 1);
            } else {
                stored.setOrder(0);
            }
            tasks.add(stored);
            persist(queue);
            result = stored.copy();
        } finally {
            lock.unlock();
        }
        log.info("Added {} task {} ({}, {})", queue.getValue(), result.getId(), result.getPriority(), position);
        publish(queue, result.getId(), "added");
        return result;
    }

    public Task update(String id, TaskPatch patch) {
        Task result;
        lock.lock();
        try {
            Task task = require(id);
            if (patch.getDescription() != null && patch.getDescription().isBlank()) {
                throw new IllegalArgumentException("Task description cannot be empty");
            }
            if (patch.getStatus() == TaskStatus.IN_PROGRESS && task.getStatus() != TaskStatus.IN_PROGRESS) {
                throw new IllegalArgumentException("Tasks move to in_progress only when an agent is spawned");
            }
            if (task.getStatus() == TaskStatus.IN_PROGRESS && patch.getStatus() != null
                    && patch.getStatus() != TaskStatus.IN_PROGRESS) {
                throw new IllegalStateException(
                    "Task " + id + " is in_progress; terminate or kill its agent to change its status");
            }
            if (patch.getStatus() != null && patch.getStatus() != task.getStatus()) {
                transition(task, patch.getStatus());
            }
            if (patch.getDescription() != null) {
                task.setDescription(patch.getDescription());
            }
            if (patch.getPriority() != null) {
                task.setPriority(patch.getPriority());
            }
            applyText(patch.getContext(), task::setContext);
            applyText(patch.getApp(), task::setApp);
            applyText(patch.getProvider(), task::setProvider);
            applyText(patch.getModel(), task::setModel);
            applyText(patch.getBlocker(), task::setBlocker);
            if (patch.getAttachments() != null) {
                task.setAttachments(new ArrayList<>(patch.getAttachments()));
            }
            persist(task.getQueue());
            result = task.copy();
        } finally {
            lock.unlock();
        }
        publish(result.getQueue(), id, "updated");
        return result;
    }

    /**
     * Deletes a task. A null queue searches both queues.
     */
    public Task delete(String id, TaskQueue queue) {
        Task removed;
        lock.lock();
        try {
            Task task = require(id);
            if (queue != null && task.getQueue() != queue) {
                throw new ResourceNotFoundException("Task not found in " + queue.getValue() + " queue: " + id);
            }
            queues.get(task.getQueue()).remove(task);
            persist(task.getQueue());
            removed = task.copy();
        } finally {
            lock.unlock();
        }
        log.info("Deleted task {}", id);
        publish(removed.getQueue(), id, "deleted");
        return removed;
    }

    /**
     * Re-sequences the pending tasks of a queue. Listed ids come first; unlisted pending
     * tasks keep their relative order after them. Orders are renumbered from 1.
     */
    public List<Task> reorder(TaskQueue queue, List<String> orderedIds) {
        List<Task> result;
        lock.lock();
        try {
            List<Task> pending = pendingSorted(queue);
            Map<String, Task> byId = pending.stream().collect(Collectors.toMap(Task::getId, t -> t));
            Set<String> seen = new HashSet<>();
            for (String id : orderedIds) {
                if (!seen.add(id)) {
                    throw new IllegalArgumentException("Duplicate task id in reorder: " + id);
                }
                if (!byId.containsKey(id)) {
                    throw new IllegalArgumentException("Task is not pending in " + queue.getValue() + " queue: " + id);
                }
            }

            List<Task> sequence = new ArrayList<>();
            orderedIds.forEach(id -> sequence.add(byId.get(id)));
            pending.stream().filter(t -> !seen.contains(t.getId())).forEach(sequence::add);
            int order = 1;
            for (Task task : sequence) {
                task.setOrder(order++);
            }
            persist(queue);
            result = copies(pendingSorted(queue));
        } finally {
            lock.unlock();
        }
        publish(queue, null, "reordered");
        return result;
    }

    public Task approve(String id) {
        Task result;
        lock.lock();
        try {
            Task task = require(id);
            if (!task.isAwaitingApproval()) {
                throw new IllegalArgumentException("Task does not require approval: " + id);
            }
            task.setAutoApproved(true);
            persist(task.getQueue());
            result = task.copy();
        } finally {
            lock.unlock();
        }
        log.info("Approved task {}", id);
        publish(result.getQueue(), id, "approved");
        return result;
    }

    public Task get(String id) {
        lock.lock();
        try {
            return require(id).copy();
        } finally {
            lock.unlock();
        }
    }

    public Optional<Task> findTask(String id) {
        lock.lock();
        try {
            return find(id).map(Task::copy);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lists a queue, optionally filtered by status. Pending tasks come back in run order.
     */
    public List<Task> listByStatus(TaskQueue queue, TaskStatus status) {
        lock.lock();
        try {
            if (status == TaskStatus.PENDING) {
                return copies(pendingSorted(queue));
            }
            return queues.get(queue).stream()
                .filter(t -> status == null || t.getStatus() == status)
                .map(Task::copy)
                .toList();
        } finally {
            lock.unlock();
        }
    }

    public List<Task> awaitingApproval() {
        lock.lock();
        try {
            List<Task> held = new ArrayList<>();
            for (TaskQueue queue : TaskQueue.values()) {
                pendingSorted(queue).stream().filter(Task::isAwaitingApproval).map(Task::copy).forEach(held::add);
            }
            return held;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Consistent copy of both queues taken under the store lock.
     */
    public Map<TaskQueue, List<Task>> snapshot() {
        lock.lock();
        try {
            Map<TaskQueue, List<Task>> copy = new EnumMap<>(TaskQueue.class);
            queues.forEach((queue, tasks) -> copy.put(queue, copies(tasks)));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    public Task markInProgress(String id, String agentId) {
        Task result;
        lock.lock();
        try {
            Task task = require(id);
            if (task.getStatus() != TaskStatus.PENDING) {
                throw new IllegalStateException("Task " + id + " is " + task.getStatus().getValue() + ", not pending");
            }
            task.setStatus(TaskStatus.IN_PROGRESS);
            task.setAgentId(agentId);
            task.setOrder(0);
            persist(task.getQueue());
            result = task.copy();
        } finally {
            lock.unlock();
        }
        publish(result.getQueue(), id, "started");
        return result;
    }

    public boolean markCompleted(String id) {
        return finish(id, TaskStatus.COMPLETED, null);
    }

    public boolean markBlocked(String id, String blocker) {
        return finish(id, TaskStatus.BLOCKED, blocker);
    }

    /**
     * Returns an in-progress task to the bottom of the pending order. Missing or
     * already-settled tasks are left alone.
     */
    public boolean returnToPending(String id) {
        TaskQueue queue;
        lock.lock();
        try {
            Optional<Task> found = find(id);
            if (found.isEmpty() || found.get().getStatus() != TaskStatus.IN_PROGRESS) {
                return false;
            }
            Task task = found.get();
            transition(task, TaskStatus.PENDING);
            persist(task.getQueue());
            queue = task.getQueue();
        } finally {
            lock.unlock();
        }
        publish(queue, id, "requeued");
        return true;
    }

    /**
     * Puts in-progress tasks without a live run back to pending. Returns the ids that were reset.
     */
    public List<String> resetOrphaned(Collection<String> activeTaskIds) {
        List<String> reset = new ArrayList<>();
        lock.lock();
        try {
            for (TaskQueue queue : TaskQueue.values()) {
                boolean changed = false;
                for (Task task : queues.get(queue)) {
                    if (task.getStatus() == TaskStatus.IN_PROGRESS && !activeTaskIds.contains(task.getId())) {
                        transition(task, TaskStatus.PENDING);
                        reset.add(task.getId());
                        changed = true;
                    }
                }
                if (changed) {
                    persist(queue);
                }
            }
        } finally {
            lock.unlock();
        }
        if (!reset.isEmpty()) {
            log.warn("Reset {} orphaned in-progress tasks: {}", reset.size(), reset);
        }
        return reset;
    }

    private boolean finish(String id, TaskStatus target, String blocker) {
        TaskQueue queue;
        lock.lock();
        try {
            Optional<Task> found = find(id);
            if (found.isEmpty()) {
                log.warn("Task {} disappeared before it could be marked {}", id, target.getValue());
                return false;
            }
            Task task = found.get();
            if (task.getStatus() != TaskStatus.IN_PROGRESS) {
                log.warn("Task {} is {}; not marking {}", id, task.getStatus().getValue(), target.getValue());
                return false;
            }
            transition(task, target);
            if (blocker != null) {
                task.setBlocker(blocker);
            }
            persist(task.getQueue());
            queue = task.getQueue();
        } finally {
            lock.unlock();
        }
        publish(queue, id, target.getValue());
        return true;
    }

    // Caller holds the lock.
    private void transition(Task task, TaskStatus target) {
        TaskStatus from = task.getStatus();
        if (!from.canTransitionTo(target)) {
            throw new IllegalArgumentException(
                "Cannot move task " + task.getId() + " from " + from.getValue() + " to " + target.getValue());
        }
        task.setStatus(target);
        switch (target) {
            case PENDING -> {
                task.setOrder(maxPendingOrder(task.getQueue()) + 1);
                task.setBlocker(null);
                task.setCompletedAt(null);
            }
            case COMPLETED -> {
                task.setOrder(0);
                task.setCompletedAt(clock.instant());
            }
            default -> task.setOrder(0);
        }
    }

    private Task require(String id) {
        return find(id).orElseThrow(() -> new ResourceNotFoundException("Task not found: " + id));
    }

    private Optional<Task> find(String id) {
        for (List<Task> tasks : queues.values()) {
            for (Task task : tasks) {
                if (task.getId().equals(id)) {
                    return Optional.of(task);
                }
            }
        }
        return Optional.empty();
    }

    private List<Task> pendingSorted(TaskQueue queue) {
        return queues.get(queue).stream()
            .filter(Task::isPending)
            .sorted(Comparator.comparingInt(Task::getOrder))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    private int minPendingOrder(TaskQueue queue) {
        return pendingSorted(queue).stream().mapToInt(Task::getOrder).min().orElse(2);
    }

    private int maxPendingOrder(TaskQueue queue) {
        return pendingSorted(queue).stream().mapToInt(Task::getOrder).max().orElse(0);
    }

    // Files written by hand may have no orders at all; give pending tasks 1..n in file order.
    private void normalizeOrder(TaskQueue queue) {
        List<Task> pending = queues.get(queue).stream().filter(Task::isPending).toList();
        boolean missing = pending.stream().anyMatch(t -> t.getOrder() == TaskMarkdownCodec.UNORDERED);
        long distinct = pending.stream().mapToInt(Task::getOrder).distinct().count();
        if (missing || distinct != pending.size()) {
            int order = 1;
            for (Task task : pending) {
                task.setOrder(order++);
            }
        }
    }

    private String nextId(TaskQueue queue) {
        long seed = clock.millis();
        String id = queue.getIdPrefix() + Long.toString(seed, 36);
        while (find(id).isPresent()) {
            seed++;
            id = queue.getIdPrefix() + Long.toString(seed, 36);
        }
        return id;
    }

    private void applyText(String value, Consumer<String> setter) {
        if (value != null) {
            setter.accept(value.isEmpty() ? null : value);
        }
    }

    private void persist(TaskQueue queue) {
        StateFileWriter.write(fileFor(queue), codec.render(queues.get(queue), queue));
    }

    private Path fileFor(TaskQueue queue) {
        String name = queue == TaskQueue.SYSTEM ? properties.getSystemTasksFile() : properties.getUserTasksFile();
        return Path.of(properties.getDataPath(), name);
    }

    private List<Task> copies(List<Task> tasks) {
        return tasks.stream().map(Task::copy).collect(Collectors.toCollection(ArrayList::new));
    }

    private void publish(TaskQueue queue, String taskId, String action) {
        events.publishEvent(new TaskQueueChangedEvent(queue, taskId, action));
    }
}
