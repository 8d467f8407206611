package com.autonomous.cos.service;

import com.autonomous.cos.config.CosProperties;
import com.autonomous.cos.exception.ResourceNotFoundException;
import com.autonomous.cos.model.CooldownAdjustment;
import com.autonomous.cos.model.DurationEstimate;
import com.autonomous.cos.model.DurationStat;
import com.autonomous.cos.model.LearningState;
import com.autonomous.cos.model.SkippedTaskType;
import com.autonomous.cos.model.Task;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregates completion durations and outcomes per task bucket and turns them into
 * estimates and schedule cooldown adjustments.
 */
@Slf4j
@Service
public class TaskLearningService {

    private static final int MIN_SAMPLES_FOR_ADJUSTMENT = 3;
    private static final int MIN_SAMPLES_FOR_SKIP = 5;
    private static final int SKIP_FAILING_MAX_RATE = 30;
    static final Duration REHABILITATION_GRACE = Duration.ofDays(7);

    private final CosProperties properties;
    private final TaskClassifier classifier;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    private LearningState state = new LearningState();

    public TaskLearningService(CosProperties properties, TaskClassifier classifier, Clock clock) {
        this.properties = properties;
        this.classifier = classifier;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @PostConstruct
    public synchronized void load() {
        Path file = file();
        if (!Files.exists(file)) {
            state = new LearningState();
            return;
        }
        try {
            state = objectMapper.readValue(file.toFile(), LearningState.class);
            if (state.getBuckets() == null) {
                state.setBuckets(new LinkedHashMap<>());
            }
            if (state.getTypedDescriptions() == null) {
                state.setTypedDescriptions(new LinkedHashMap<>());
            }
            log.info("Loaded learning data for {} buckets", state.getBuckets().size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public String classify(String description) {
        return classifier.classify(description);
    }

    /**
     * Typed tasks are keyed by their task type. Untyped descriptions that a typed task
     * already recorded under resolve to that task's bucket, the rest go through the classifier.
     */
    public synchronized String bucketFor(Task task) {
        if (task.getTaskType() != null && !task.getTaskType().isBlank()) {
            return "task:" + task.getTaskType();
        }
        String known = state.getTypedDescriptions().get(descriptionKey(task.getDescription()));
        return known != null ? known : classifier.classify(task.getDescription());
    }

    /**
     * Records a finished task into {@link #bucketFor(Task)} and remembers the description of
     * a typed task so later lookups by description land in the same bucket.
     */
    public synchronized String recordCompletion(Task task, long durationMs, boolean success) {
        String bucket = bucketFor(task);
        String key = descriptionKey(task.getDescription());
        if (task.getTaskType() != null && !task.getTaskType().isBlank() && !key.isEmpty()) {
            state.getTypedDescriptions().put(key, bucket);
        }
        recordCompletion(bucket, durationMs, success);
        return bucket;
    }

    public synchronized void recordCompletion(String bucket, long durationMs, boolean success) {
        if (LearningState.OVERALL.equals(bucket)) {
            throw new IllegalArgumentException("Cannot record directly into " + LearningState.OVERALL);
        }
        long duration = Math.max(0, durationMs);
        state.getBuckets().computeIfAbsent(bucket, b -> new DurationStat()).record(duration, success, clock.instant());
        state.getBuckets().computeIfAbsent(LearningState.OVERALL, b -> new DurationStat()).record(duration, success, clock.instant());
        persist();
        log.debug("Recorded {} completion for {} in {}ms", success ? "successful" : "failed", bucket, duration);
    }

    public synchronized DurationEstimate estimate(String description) {
        return estimate(Task.builder().description(description).build());
    }

    public synchronized DurationEstimate estimate(Task task) {
        String bucket = bucketFor(task);
        DurationStat stat = state.getBuckets().get(bucket);
        boolean fromOverall = false;
        if (stat == null || stat.getCompleted() == 0) {
            stat = state.getBuckets().get(LearningState.OVERALL);
            fromOverall = true;
        }
        if (stat == null || stat.getCompleted() == 0) {
            return DurationEstimate.builder().bucket("none").basedOnCount(0).build();
        }
        return DurationEstimate.builder()
            .estimatedMin(toMinutes(stat.getP80DurationMs()))
            .avgMin(stat.getAvgDurationMin())
            .basedOnCount(stat.getCompleted())
            .successRate(stat.getSuccessRate())
            .bucket(fromOverall ? LearningState.OVERALL : bucket)
            .fromOverall(fromOverall)
            .build();
    }

    public synchronized Map<String, DurationStat> stats() {
        Map<String, DurationStat> copy = new LinkedHashMap<>();
        state.getBuckets().forEach((k, v) -> copy.put(k, v.copy()));
        return copy;
    }

    public synchronized Optional<DurationStat> stat(String bucket) {
        return Optional.ofNullable(state.getBuckets().get(bucket)).map(DurationStat::copy);
    }

    /**
     * Interval multiplier derived from a bucket's success rate. Buckets with fewer
     * than three samples are left at 1.0.
     */
    public synchronized CooldownAdjustment cooldownAdjustment(String bucket) {
        DurationStat stat = state.getBuckets().get(bucket);
        if (stat == null || stat.getCompleted() < MIN_SAMPLES_FOR_ADJUSTMENT) {
            return CooldownAdjustment.neutral("insufficient-data");
        }
        int rate = stat.getSuccessRate();
        if (rate >= 90) {
            return new CooldownAdjustment(0.7, false, "high-success");
        }
        if (rate >= 75) {
            return new CooldownAdjustment(0.85, false, "good-success");
        }
        if (rate >= 50) {
            return new CooldownAdjustment(1.0, false, "moderate-success");
        }
        if (rate >= SKIP_FAILING_MAX_RATE) {
            return new CooldownAdjustment(1.5, false, "low-success");
        }
        if (stat.getCompleted() >= MIN_SAMPLES_FOR_SKIP) {
            if (rehabilitationDue(stat)) {
                return CooldownAdjustment.neutral("rehabilitation-due");
            }
            return new CooldownAdjustment(0, true, "skip-failing");
        }
        return new CooldownAdjustment(2.0, false, "very-low-success");
    }

    /**
     * Buckets currently skipped for failing, with how long until each becomes eligible again.
     */
    public synchronized List<SkippedTaskType> skippedWithStatus() {
        Instant now = clock.instant();
        List<SkippedTaskType> skipped = new ArrayList<>();
        state.getBuckets().forEach((bucket, stat) -> {
            if (LearningState.OVERALL.equals(bucket) || !isSkipFailing(stat)) {
                return;
            }
            Instant eligibleAt = stat.getLastCompleted() == null ? now : stat.getLastCompleted().plus(REHABILITATION_GRACE);
            long remainingMs = Math.max(0, Duration.between(now, eligibleAt).toMillis());
            skipped.add(SkippedTaskType.builder()
                .bucket(bucket)
                .successRate(stat.getSuccessRate())
                .completed(stat.getCompleted())
                .lastCompleted(stat.getLastCompleted())
                .eligibleAt(eligibleAt)
                .eligibleForRehabilitation(remainingMs == 0)
                .daysUntilEligible((int) Math.ceil(remainingMs / (double) Duration.ofDays(1).toMillis()))
                .build());
        });
        return skipped;
    }

    /**
     * Resets every skipped bucket whose last completion is older than the grace period so the
     * task type gets a fresh start. Returns the buckets that were reset.
     */
    public synchronized List<String> rehabilitateSkipped() {
        List<String> due = new ArrayList<>();
        state.getBuckets().forEach((bucket, stat) -> {
            if (!LearningState.OVERALL.equals(bucket) && isSkipFailing(stat) && rehabilitationDue(stat)) {
                due.add(bucket);
            }
        });
        for (String bucket : due) {
            DurationStat removed = resetBucket(bucket);
            log.info("Rehabilitated {} after {} days without a run ({}% success over {} runs)",
                bucket, REHABILITATION_GRACE.toDays(), removed.getSuccessRate(), removed.getCompleted());
        }
        return due;
    }

    /**
     * Drops a bucket and removes its samples from the overall aggregate.
     */
    public synchronized DurationStat resetBucket(String bucket) {
        if (LearningState.OVERALL.equals(bucket)) {
            throw new IllegalArgumentException("The overall aggregate cannot be reset on its own");
        }
        DurationStat removed = state.getBuckets().remove(bucket);
        if (removed == null) {
            throw new ResourceNotFoundException("No learning data for bucket: " + bucket);
        }
        DurationStat overall = state.getBuckets().get(LearningState.OVERALL);
        if (overall != null) {
            overall.subtract(removed);
            if (overall.getCompleted() == 0) {
                state.getBuckets().remove(LearningState.OVERALL);
            }
        }
        persist();
        log.info("Reset learning bucket {} ({} samples)", bucket, removed.getCompleted());
        return removed;
    }

    private boolean isSkipFailing(DurationStat stat) {
        return stat.getCompleted() >= MIN_SAMPLES_FOR_SKIP && stat.getSuccessRate() < SKIP_FAILING_MAX_RATE;
    }

    private boolean rehabilitationDue(DurationStat stat) {
        return stat.getLastCompleted() != null
            && !stat.getLastCompleted().plus(REHABILITATION_GRACE).isAfter(clock.instant());
    }

    private static String descriptionKey(String description) {
        return description == null ? "" : description.trim().toLowerCase(Locale.ROOT);
    }

    private double toMinutes(long ms) {
        return Math.round(ms / 6000.0) / 10.0;
    }

    private void persist() {
        state.setLastUpdated(clock.instant());
        try {
            StateFileWriter.write(file(), objectMapper.writeValueAsString(state));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save learning data", e);
        }
    }

    private Path file() {
        return Path.of(properties.getDataPath(), properties.getLearningFile());
    }
}
