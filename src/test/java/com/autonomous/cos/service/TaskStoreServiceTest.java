package com.autonomous.cos.service;

import com.autonomous.cos.config.CosProperties;
import com.autonomous.cos.event.TaskQueueChangedEvent;
import com.autonomous.cos.exception.ResourceNotFoundException;
import com.autonomous.cos.model.Task;
import com.autonomous.cos.model.TaskPatch;
import com.autonomous.cos.model.TaskPosition;
import com.autonomous.cos.model.TaskPriority;
import com.autonomous.cos.model.TaskQueue;
import com.autonomous.cos.model.TaskStatus;
import com.autonomous.cos.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskStoreServiceTest {

    @TempDir
    Path dataDir;

    @Mock
    private ApplicationEventPublisher events;

    private CosProperties properties;
    private MutableClock clock;
    private TaskStoreService store;

    @BeforeEach
    void setUp() {
        properties = new CosProperties();
        properties.setDataPath(dataDir.toString());
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        store = new TaskStoreService(properties, events, clock);
        store.load();
    }

    private Task add(String description) {
        clock.advance(Duration.ofMillis(1));
        return store.add(Task.builder().queue(TaskQueue.USER).description(description).build(), TaskPosition.BOTTOM);
    }

    @Test
    void shouldAssignQueuePrefixedIds() {
        Task user = add("User work");
        Task system = store.add(Task.builder().queue(TaskQueue.SYSTEM).description("System work").build(), TaskPosition.BOTTOM);

        assertTrue(user.getId().startsWith("task-"));
        assertTrue(system.getId().startsWith("sys-"));
        assertNotNull(user.getCreatedAt());
    }

    @Test
    void shouldGenerateDistinctIdsWithinSameMillisecond() {
        Task first = store.add(Task.builder().description("One").build(), TaskPosition.BOTTOM);
        Task second = store.add(Task.builder().description("Two").build(), TaskPosition.BOTTOM);

        assertNotEquals(first.getId(), second.getId());
    }

    @Test
    void shouldRejectBlankDescription() {
        assertThrows(IllegalArgumentException.class,
            () -> store.add(Task.builder().description("  ").build(), TaskPosition.BOTTOM));
    }

    @Test
    void shouldPlaceTopTasksFirst() {
        Task a = add("A");
        Task b = add("B");
        clock.advance(Duration.ofMillis(1));
        Task urgent = store.add(Task.builder().description("Urgent").build(), TaskPosition.TOP);

        List<String> ids = store.listByStatus(TaskQueue.USER, TaskStatus.PENDING).stream().map(Task::getId).toList();

        assertEquals(List.of(urgent.getId(), a.getId(), b.getId()), ids);
    }

    @Test
    void shouldPersistAndReloadBothQueues() throws Exception {
        Task user = add("Persisted user task");
        Task system = store.add(Task.builder().queue(TaskQueue.SYSTEM).description("Persisted system task")
            .priority(TaskPriority.HIGH).autoApproved(false).build(), TaskPosition.BOTTOM);

        assertTrue(Files.readString(dataDir.resolve("TASKS.md")).contains(user.getId()));
        assertTrue(Files.readString(dataDir.resolve("COS-TASKS.md")).contains(system.getId()));

        TaskStoreService reloaded = new TaskStoreService(properties, events, clock);
        reloaded.load();

        assertEquals("Persisted user task", reloaded.get(user.getId()).getDescription());
        Task reloadedSystem = reloaded.get(system.getId());
        assertEquals(TaskPriority.HIGH, reloadedSystem.getPriority());
        assertTrue(reloadedSystem.isAwaitingApproval());
    }

    @Test
    void shouldKeepTopInsertedOrdersAcrossReload() {
        Task bottom = add("Queued first");
        clock.advance(Duration.ofMillis(1));
        Task top = store.add(Task.builder().queue(TaskQueue.USER).description("Urgent").build(), TaskPosition.TOP);
        clock.advance(Duration.ofMillis(1));
        Task topAgain = store.add(Task.builder().queue(TaskQueue.USER).description("More urgent").build(), TaskPosition.TOP);

        assertEquals(1, bottom.getOrder());
        assertEquals(0, top.getOrder());
        assertEquals(-1, topAgain.getOrder());

        TaskStoreService reloaded = new TaskStoreService(properties, events, clock);
        reloaded.load();

        assertEquals(1, reloaded.get(bottom.getId()).getOrder());
        assertEquals(0, reloaded.get(top.getId()).getOrder());
        assertEquals(-1, reloaded.get(topAgain.getId()).getOrder());
        assertEquals(List.of(topAgain.getId(), top.getId(), bottom.getId()),
            reloaded.listByStatus(TaskQueue.USER, TaskStatus.PENDING).stream().map(Task::getId).toList());
    }

    @Test
    void shouldNumberHandWrittenTasksWithoutOrders() throws Exception {
        Files.writeString(dataDir.resolve("TASKS.md"), """
            # Tasks

            ## Pending
            - [ ] #task-h1 | MEDIUM | AUTO | First by hand
            - [ ] #task-h2 | HIGH | AUTO | Second by hand
            """);

        TaskStoreService reloaded = new TaskStoreService(properties, events, clock);
        reloaded.load();

        assertEquals(1, reloaded.get("task-h1").getOrder());
        assertEquals(2, reloaded.get("task-h2").getOrder());
    }

    @Test
    void shouldReturnCopiesFromReads() {
        Task task = add("Original");

        store.get(task.getId()).setDescription("Mutated outside");

        assertEquals("Original", store.get(task.getId()).getDescription());
    }

    @Test
    void shouldReorderIdempotently() {
        Task a = add("A");
        Task b = add("B");
        Task c = add("C");
        List<String> order = List.of(c.getId(), a.getId(), b.getId());

        List<Task> once = store.reorder(TaskQueue.USER, order);
        List<Task> twice = store.reorder(TaskQueue.USER, order);

        assertEquals(order, once.stream().map(Task::getId).toList());
        assertEquals(once, twice);
        assertEquals(List.of(1, 2, 3), twice.stream().map(Task::getOrder).toList());
    }

    @Test
    void shouldKeepUnlistedTasksAfterListedOnes() {
        Task a = add("A");
        Task b = add("B");
        Task c = add("C");

        List<Task> result = store.reorder(TaskQueue.USER, List.of(c.getId()));

        assertEquals(List.of(c.getId(), a.getId(), b.getId()), result.stream().map(Task::getId).toList());
    }

    @Test
    void shouldLeaveOrderUntouchedWhenReorderFails() {
        Task a = add("A");
        Task b = add("B");
        List<Task> before = store.listByStatus(TaskQueue.USER, TaskStatus.PENDING);

        assertThrows(IllegalArgumentException.class,
            () -> store.reorder(TaskQueue.USER, List.of(b.getId(), "task-missing")));
        assertThrows(IllegalArgumentException.class,
            () -> store.reorder(TaskQueue.USER, List.of(b.getId(), b.getId())));

        assertEquals(before, store.listByStatus(TaskQueue.USER, TaskStatus.PENDING));
        assertEquals(a.getId(), before.get(0).getId());
    }

    @Test
    void shouldApplyPartialUpdates() {
        Task task = store.add(Task.builder().description("Old").context("ctx").app("portal").build(), TaskPosition.BOTTOM);

        Task updated = store.update(task.getId(), TaskPatch.builder()
            .description("New")
            .priority(TaskPriority.CRITICAL)
            .app("")
            .build());

        assertEquals("New", updated.getDescription());
        assertEquals(TaskPriority.CRITICAL, updated.getPriority());
        assertEquals("ctx", updated.getContext());
        assertNull(updated.getApp());
    }

    @Test
    void shouldRejectIllegalTransitionsWithoutChangingTask() {
        Task task = add("Task");

        assertThrows(IllegalArgumentException.class,
            () -> store.update(task.getId(), TaskPatch.builder().status(TaskStatus.COMPLETED).description("Changed").build()));
        assertThrows(IllegalArgumentException.class,
            () -> store.update(task.getId(), TaskPatch.builder().status(TaskStatus.IN_PROGRESS).build()));

        Task current = store.get(task.getId());
        assertEquals(TaskStatus.PENDING, current.getStatus());
        assertEquals("Task", current.getDescription());
    }

    @Test
    void shouldMoveThroughAgentLifecycle() {
        Task task = add("Lifecycle");

        store.markInProgress(task.getId(), "agent-1");
        assertEquals(TaskStatus.IN_PROGRESS, store.get(task.getId()).getStatus());
        assertThrows(IllegalStateException.class, () -> store.markInProgress(task.getId(), "agent-2"));

        assertTrue(store.markBlocked(task.getId(), "tests failed"));
        Task blocked = store.get(task.getId());
        assertEquals(TaskStatus.BLOCKED, blocked.getStatus());
        assertEquals("tests failed", blocked.getBlocker());

        // retry by moving back to pending
        Task retried = store.update(task.getId(), TaskPatch.builder().status(TaskStatus.PENDING).build());
        assertEquals(TaskStatus.PENDING, retried.getStatus());
        assertNull(retried.getBlocker());

        store.markInProgress(task.getId(), "agent-3");
        assertTrue(store.markCompleted(task.getId()));
        assertNotNull(store.get(task.getId()).getCompletedAt());
        assertFalse(store.markCompleted(task.getId()));
    }

    @Test
    void shouldRefuseStatusPatchWhileAgentRuns() {
        Task task = add("Running");
        store.markInProgress(task.getId(), "agent-1");

        assertThrows(IllegalStateException.class,
            () -> store.update(task.getId(), TaskPatch.builder().status(TaskStatus.PENDING).build()));
        assertThrows(IllegalStateException.class,
            () -> store.update(task.getId(), TaskPatch.builder().status(TaskStatus.COMPLETED).build()));

        Task retitled = store.update(task.getId(), TaskPatch.builder().description("Running, renamed").build());
        assertEquals(TaskStatus.IN_PROGRESS, retitled.getStatus());
        assertEquals("agent-1", retitled.getAgentId());
        assertTrue(store.markCompleted(task.getId()));
    }

    @Test
    void shouldResetOrphanedInProgressTasks() {
        Task orphan = add("Orphan");
        Task live = add("Live");
        store.markInProgress(orphan.getId(), "agent-gone");
        store.markInProgress(live.getId(), "agent-live");

        List<String> reset = store.resetOrphaned(Set.of(live.getId()));

        assertEquals(List.of(orphan.getId()), reset);
        assertEquals(TaskStatus.PENDING, store.get(orphan.getId()).getStatus());
        assertEquals(TaskStatus.IN_PROGRESS, store.get(live.getId()).getStatus());
    }

    @Test
    void shouldApproveOnlyHeldTasks() {
        Task held = store.add(Task.builder().queue(TaskQueue.SYSTEM).description("Needs approval")
            .autoApproved(false).build(), TaskPosition.BOTTOM);
        Task auto = add("Auto");

        assertEquals(List.of(held.getId()), store.awaitingApproval().stream().map(Task::getId).toList());
        assertFalse(store.approve(held.getId()).isAwaitingApproval());
        assertThrows(IllegalArgumentException.class, () -> store.approve(auto.getId()));
        assertTrue(store.awaitingApproval().isEmpty());
    }

    @Test
    void shouldDeleteFromNamedQueueOnly() {
        Task task = add("Delete me");

        assertThrows(ResourceNotFoundException.class, () -> store.delete(task.getId(), TaskQueue.SYSTEM));
        store.delete(task.getId(), TaskQueue.USER);

        assertTrue(store.findTask(task.getId()).isEmpty());
        assertThrows(ResourceNotFoundException.class, () -> store.get(task.getId()));
    }

    @Test
    void shouldPublishQueueChanges() {
        Task task = add("Evented");

        verify(events).publishEvent(new TaskQueueChangedEvent(TaskQueue.USER, task.getId(), "added"));
    }

    @Test
    void shouldNormalizeOrdersOfHandWrittenFile() throws Exception {
        Files.writeString(dataDir.resolve("TASKS.md"), """
            # Tasks

            ## Pending
            - [ ] #task-x | MEDIUM | AUTO | First in file
            - [ ] #task-y | MEDIUM | AUTO | Second in file
            """);

        store.load();

        List<Task> pending = store.listByStatus(TaskQueue.USER, TaskStatus.PENDING);
        assertEquals(List.of("task-x", "task-y"), pending.stream().map(Task::getId).toList());
        assertEquals(List.of(1, 2), pending.stream().map(Task::getOrder).toList());
    }
}
