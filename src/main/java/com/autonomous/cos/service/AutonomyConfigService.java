package com.autonomous.cos.service;

import com.autonomous.cos.config.CosProperties;
import com.autonomous.cos.event.CosConfigChangedEvent;
import com.autonomous.cos.model.AutonomyLevel;
import com.autonomous.cos.model.CosConfig;
import com.autonomous.cos.model.CosConfigPatch;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Holds the active {@link CosConfig}, persisted as snake_case YAML. Every change is
 * published as a {@link CosConfigChangedEvent}.
 */
@Slf4j
@Service
public class AutonomyConfigService {

    private static final long MIN_INTERVAL_MS = 1000;

    private final CosProperties properties;
    private final ApplicationEventPublisher events;
    private final ObjectMapper yamlMapper;

    private volatile CosConfig config = new CosConfig();

    public AutonomyConfigService(CosProperties properties, ApplicationEventPublisher events) {
        this.properties = properties;
        this.events = events;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @PostConstruct
    public synchronized void loadConfig() {
        Path file = file();
        if (!Files.exists(file)) {
            log.info("No CoS config at {}, using {} defaults", file, config.getLevelName());
            return;
        }
        try {
            CosConfig loaded = yamlMapper.readValue(file.toFile(), CosConfig.class);
            validate(loaded);
            config = loaded;
            log.info("Loaded CoS config from {} (level: {})", file, loaded.getLevelName());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config from " + file, e);
        }
    }

    public CosConfig getConfig() {
        return config.copy();
    }

    public String levelName() {
        return config.getLevelName();
    }

    public synchronized CosConfig update(CosConfigPatch patch) {
        CosConfig next = config.copy();
        set(patch.getEvaluationIntervalMs(), next::setEvaluationIntervalMs);
        set(patch.getMaxConcurrentAgents(), next::setMaxConcurrentAgents);
        set(patch.getSelfImprovementEnabled(), next::setSelfImprovementEnabled);
        set(patch.getAppImprovementEnabled(), next::setAppImprovementEnabled);
        set(patch.getProactiveMode(), next::setProactiveMode);
        set(patch.getIdleReviewEnabled(), next::setIdleReviewEnabled);
        set(patch.getImmediateExecution(), next::setImmediateExecution);
        set(patch.getComprehensiveAppImprovement(), next::setComprehensiveAppImprovement);
        set(patch.getSpawnEnabled(), next::setSpawnEnabled);
        set(patch.getAutoApprove(), next::setAutoApprove);
        set(patch.getHealthCheckIntervalMs(), next::setHealthCheckIntervalMs);
        set(patch.getMaxProcessMemoryMb(), next::setMaxProcessMemoryMb);
        set(patch.getMaxTotalProcesses(), next::setMaxTotalProcesses);
        set(patch.getAppReviewCooldownMs(), next::setAppReviewCooldownMs);
        validate(next);
        return replace(next);
    }

    public synchronized CosConfig applyLevel(AutonomyLevel level) {
        log.info("Applying autonomy level {}", level.getValue());
        return replace(level.applyTo(config));
    }

    private CosConfig replace(CosConfig next) {
        CosConfig previous = config;
        save(next);
        config = next;
        events.publishEvent(new CosConfigChangedEvent(previous.copy(), next.copy()));
        return next.copy();
    }

    private void validate(CosConfig candidate) {
        if (candidate.getEvaluationIntervalMs() < MIN_INTERVAL_MS) {
            throw new IllegalArgumentException("evaluationIntervalMs must be at least " + MIN_INTERVAL_MS);
        }
        if (candidate.getHealthCheckIntervalMs() < MIN_INTERVAL_MS) {
            throw new IllegalArgumentException("healthCheckIntervalMs must be at least " + MIN_INTERVAL_MS);
        }
        if (candidate.getMaxConcurrentAgents() < 1) {
            throw new IllegalArgumentException("maxConcurrentAgents must be at least 1");
        }
        if (candidate.getMaxProcessMemoryMb() < 1 || candidate.getMaxTotalProcesses() < 1) {
            throw new IllegalArgumentException("Process limits must be positive");
        }
        if (candidate.getAppReviewCooldownMs() < 0) {
            throw new IllegalArgumentException("appReviewCooldownMs cannot be negative");
        }
    }

    private void save(CosConfig next) {
        try {
            StateFileWriter.write(file(), yamlMapper.writeValueAsString(next));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save CoS config", e);
        }
    }

    private Path file() {
        return Path.of(properties.getDataPath(), properties.getConfigFile());
    }

    private static <T> void set(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
