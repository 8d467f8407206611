package com.autonomous.cos.service;

import com.autonomous.cos.model.Task;
import com.autonomous.cos.model.TaskPriority;
import com.autonomous.cos.model.TaskQueue;
import com.autonomous.cos.model.TaskStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskMarkdownCodecTest {

    private final TaskMarkdownCodec codec = new TaskMarkdownCodec(new ObjectMapper());

    @Test
    void shouldParseHandWrittenFile() {
        String content = """
            # Tasks

            ## Pending
            - [ ] #task-a1 | HIGH | AUTO | Fix login redirect
              - Order: 2
              - App: portal
            - [ ] #task-b2 | low | Write release notes
              - Order: 1

            ## Blocked
            - [!] #task-c3 | MEDIUM | APPROVAL | Migrate database
              - Blocker: needs credentials
              - Owner: dana
            """;

        List<Task> tasks = codec.parse(content, TaskQueue.USER);

        assertEquals(3, tasks.size());
        Task first = tasks.get(0);
        assertEquals("task-a1", first.getId());
        assertEquals(TaskPriority.HIGH, first.getPriority());
        assertEquals(TaskStatus.PENDING, first.getStatus());
        assertEquals(2, first.getOrder());
        assertEquals("portal", first.getApp());
        assertEquals(TaskQueue.USER, first.getQueue());

        Task second = tasks.get(1);
        assertEquals(TaskPriority.LOW, second.getPriority());
        assertTrue(second.isAutoApproved());
        assertEquals("Write release notes", second.getDescription());

        Task blocked = tasks.get(2);
        assertEquals(TaskStatus.BLOCKED, blocked.getStatus());
        assertFalse(blocked.isAutoApproved());
        assertEquals("needs credentials", blocked.getBlocker());
        assertEquals(Map.of("Owner", "dana"), blocked.getExtra());
    }

    @Test
    void shouldSkipMalformedTaskLines() {
        String content = """
            ## Pending
            - [ ] no id here
            - [ ] #task-ok | MEDIUM | AUTO | Valid task
            """;

        List<Task> tasks = codec.parse(content, TaskQueue.USER);

        assertEquals(1, tasks.size());
        assertEquals("task-ok", tasks.get(0).getId());
    }

    @Test
    void shouldRenderPendingSectionInRunOrder() {
        Task later = Task.builder().id("task-2").description("Second").order(5).build();
        Task sooner = Task.builder().id("task-1").description("First").order(1).build();
        Task done = Task.builder().id("task-3").description("Done").status(TaskStatus.COMPLETED).build();

        String rendered = codec.render(List.of(later, done, sooner), TaskQueue.SYSTEM);

        assertTrue(rendered.startsWith("# CoS Tasks"));
        assertTrue(rendered.indexOf("#task-1") < rendered.indexOf("#task-2"));
        assertTrue(rendered.indexOf("## Pending") < rendered.indexOf("## Completed"));
        assertTrue(rendered.contains("- [x] #task-3 | MEDIUM | AUTO | Done"));
        // completed tasks carry no order
        assertFalse(rendered.substring(rendered.indexOf("#task-3")).contains("Order:"));
    }

    @Test
    void shouldKeepMultilineAndPaddedValuesIntact() {
        Task task = Task.builder()
            .id("sys-x1")
            .queue(TaskQueue.SYSTEM)
            .description("Audit \"auth\" module")
            .context("line one\nline two\\with backslash")
            .blocker("  padded  ")
            .attachments(List.of("a.png", "notes, final.txt"))
            .autoApproved(false)
            .taskType("security")
            .createdAt(Instant.parse("2026-02-01T08:00:00Z"))
            .order(1)
            .build();

        String rendered = codec.render(List.of(task), TaskQueue.SYSTEM);
        Task parsed = codec.parse(rendered, TaskQueue.SYSTEM).get(0);

        assertEquals(task.getDescription(), parsed.getDescription());
        assertEquals(task.getContext(), parsed.getContext());
        assertEquals(task.getBlocker(), parsed.getBlocker());
        assertEquals(task.getAttachments(), parsed.getAttachments());
        assertFalse(parsed.isAutoApproved());
        assertEquals("security", parsed.getTaskType());
        assertEquals(task.getCreatedAt(), parsed.getCreatedAt());
    }

    @Test
    void shouldEscapeOnlyValuesThatNeedIt() {
        assertEquals("plain value", codec.escape("plain value"));
        assertEquals("\"\"", codec.escape(""));
        assertEquals("\" lead\"", codec.escape(" lead"));
        assertEquals("\"a\\nb\"", codec.escape("a\nb"));
        assertEquals("a\nb", codec.unescape("\"a\\nb\""));
    }

    @Test
    void shouldRejectReservedOrInvalidMetadataKeys() {
        assertThrows(IllegalArgumentException.class, () -> TaskMarkdownCodec.sanitizeExtra(Map.of("Order", "3")));
        assertThrows(IllegalArgumentException.class, () -> TaskMarkdownCodec.sanitizeExtra(Map.of("bad key", "x")));
        assertEquals(Map.of("Owner", "dana"), TaskMarkdownCodec.sanitizeExtra(Map.of("Owner", "dana")));
    }
}
