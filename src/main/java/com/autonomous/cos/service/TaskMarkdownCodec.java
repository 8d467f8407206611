package com.autonomous.cos.service;

import com.autonomous.cos.model.Task;
import com.autonomous.cos.model.TaskPriority;
import com.autonomous.cos.model.TaskQueue;
import com.autonomous.cos.model.TaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the markdown task files.
 *
 * <pre>
 * ## Pending
 * - [ ] #task-lx2k9a | HIGH | AUTO | Fix login redirect
 *   - Order: 1
 *   - App: portal
 * </pre>
 *
 * Values that would not survive a single trimmed line are stored as JSON string literals.
 */
@Slf4j
public class TaskMarkdownCodec {

    private static final Pattern TASK_LINE = Pattern.compile(
        "^-\\s*\\[([ x~!])]\\s*#([\\w-]+)\\s*\\|\\s*(CRITICAL|HIGH|MEDIUM|LOW)\\s*\\|\\s*(?:(AUTO|APPROVAL)\\s*\\|\\s*)?(.+)$",
        Pattern.CASE_INSENSITIVE);
    private static final Set<String> RESERVED_KEYS = Set.of(
        "order", "context", "app", "provider", "model", "attachments",
        "blocker", "type", "agent", "created", "completed");
    private static final Pattern META_LINE = Pattern.compile("^\\s+-\\s*(\\w+):\\s*(.*)$");

    /** Order given to a parsed pending task whose file entry has no usable {@code Order:} line. */
    public static final int UNORDERED = Integer.MIN_VALUE;

    private final ObjectMapper mapper;

    public TaskMarkdownCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<Task> parse(String content, TaskQueue queue) {
        List<Task> tasks = new ArrayList<>();
        Task current = null;
        for (String line : content.split("\\r?\\n")) {
            if (line.startsWith("#") || line.isBlank()) {
                continue;
            }
            if (line.startsWith("- [")) {
                current = parseTaskLine(line, queue);
                if (current != null) {
                    tasks.add(current);
                } else {
                    log.warn("Skipping malformed task line: {}", line);
                }
                continue;
            }
            Matcher meta = META_LINE.matcher(line);
            if (current != null && meta.matches()) {
                applyMetadata(current, meta.group(1), unescape(meta.group(2).trim()));
            }
        }
        return tasks;
    }

    public String render(List<Task> tasks, TaskQueue queue) {
        StringBuilder out = new StringBuilder();
        out.append(queue == TaskQueue.SYSTEM ? "# CoS Tasks" : "# Tasks").append("\n\n");

        for (TaskStatus status : TaskStatus.values()) {
            List<Task> section = tasks.stream().filter(t -> t.getStatus() == status).toList();
            if (section.isEmpty()) {
                continue;
            }
            if (status == TaskStatus.PENDING) {
                section = section.stream().sorted(Comparator.comparingInt(Task::getOrder)).toList();
            }
            out.append("## ").append(status.getSectionTitle()).append('\n');
            for (Task task : section) {
                renderTask(out, task);
            }
            out.append('\n');
        }
        return out.toString();
    }

    private Task parseTaskLine(String line, TaskQueue queue) {
        Matcher m = TASK_LINE.matcher(line);
        if (!m.matches()) {
            return null;
        }
        String flag = m.group(4);
        TaskStatus status = TaskStatus.fromCheckbox("[" + m.group(1).toLowerCase(Locale.ROOT) + "]");
        return Task.builder()
            .id(m.group(2))
            .queue(queue)
            .status(status)
            .order(status == TaskStatus.PENDING ? UNORDERED : 0)
            .priority(TaskPriority.fromValue(m.group(3)))
            .autoApproved(flag == null || !"APPROVAL".equalsIgnoreCase(flag))
            .description(unescape(m.group(5).trim()))
            .build();
    }

    private void renderTask(StringBuilder out, Task task) {
        out.append("- ").append(task.getStatus().getCheckbox())
            .append(" #").append(task.getId())
            .append(" | ").append(task.getPriority().name())
            .append(" | ").append(task.isAutoApproved() ? "AUTO" : "APPROVAL")
            .append(" | ").append(escape(task.getDescription()))
            .append('\n');

        if (task.getStatus() == TaskStatus.PENDING) {
            meta(out, "Order", String.valueOf(task.getOrder()));
        }
        meta(out, "Context", task.getContext());
        meta(out, "App", task.getApp());
        meta(out, "Provider", task.getProvider());
        meta(out, "Model", task.getModel());
        if (task.getAttachments() != null && !task.getAttachments().isEmpty()) {
            meta(out, "Attachments", toJson(task.getAttachments()));
        }
        meta(out, "Blocker", task.getBlocker());
        meta(out, "Type", task.getTaskType());
        meta(out, "Agent", task.getAgentId());
        meta(out, "Created", task.getCreatedAt() == null ? null : task.getCreatedAt().toString());
        meta(out, "Completed", task.getCompletedAt() == null ? null : task.getCompletedAt().toString());
        if (task.getExtra() != null) {
            task.getExtra().forEach((k, v) -> meta(out, k, v));
        }
    }

    private void meta(StringBuilder out, String key, String value) {
        if (value == null) {
            return;
        }
        out.append("  - ").append(key).append(": ").append(escape(value)).append('\n');
    }

    private void applyMetadata(Task task, String key, String value) {
        switch (key.toLowerCase(Locale.ROOT)) {
            case "order" -> {
                Integer order = parseOrder(value);
                if (order != null) {
                    task.setOrder(order);
                }
            }
            case "context" -> task.setContext(value);
            case "app" -> task.setApp(value);
            case "provider" -> task.setProvider(value);
            case "model" -> task.setModel(value);
            case "attachments" -> task.setAttachments(parseList(value));
            case "blocker" -> task.setBlocker(value);
            case "type" -> task.setTaskType(value);
            case "agent" -> task.setAgentId(value);
            case "created" -> task.setCreatedAt(parseInstant(value));
            case "completed" -> task.setCompletedAt(parseInstant(value));
            default -> task.getExtra().put(key, value);
        }
    }

    String escape(String value) {
        boolean needsJson = value.isEmpty()
            || value.contains("\n")
            || value.contains("\r")
            || value.contains("\\")
            || value.startsWith("\"")
            || !value.equals(value.trim());
        return needsJson ? toJson(value) : value;
    }

    String unescape(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            try {
                return mapper.readValue(value, String.class);
            } catch (JsonProcessingException e) {
                log.debug("Value is not a JSON string literal, keeping raw text: {}", value);
            }
        }
        return value;
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode task metadata value", e);
        }
    }

    private List<String> parseList(String value) {
        try {
            return new ArrayList<>(mapper.readValue(value, new TypeReference<List<String>>() { }));
        } catch (JsonProcessingException e) {
            List<String> items = new ArrayList<>();
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    items.add(part.trim());
                }
            }
            return items;
        }
    }

    private Integer parseOrder(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid order value '{}'", value);
            return null;
        }
    }

    private Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring invalid timestamp '{}'", value);
            return null;
        }
    }

    /**
     * Validates free-form metadata so it can be written as {@code - Key: Value} lines
     * without shadowing a field.
     */
    static Map<String, String> sanitizeExtra(Map<String, String> extra) {
        Map<String, String> clean = new LinkedHashMap<>();
        if (extra == null) {
            return clean;
        }
        extra.forEach((k, v) -> {
            if (k == null || !k.matches("\\w+") || RESERVED_KEYS.contains(k.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Invalid metadata key: " + k);
            }
            if (v != null) {
                clean.put(k, v);
            }
        });
        return clean;
    }
}
