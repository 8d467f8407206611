package com.autonomous.cos.service;

import com.autonomous.cos.event.CosConfigChangedEvent;
import com.autonomous.cos.model.CosConfig;
import com.autonomous.cos.model.HealthIssue;
import com.autonomous.cos.model.HealthReport;
import com.autonomous.cos.model.ProcessSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Periodic resource check on its own tick lane. It shares no lock with the evaluator,
 * and a failing probe turns into an issue on the report instead of an exception.
 */
@Slf4j
@Service
public class HealthMonitorService {

    static final String TICK = "health";

    private final ProcessMetricsSource metricsSource;
    private final AutonomyConfigService configService;
    private final NotificationService notifications;
    private final TickSource tickSource;
    private final Clock clock;

    private volatile HealthReport latest;
    private volatile boolean running;

    public HealthMonitorService(ProcessMetricsSource metricsSource, AutonomyConfigService configService,
                                NotificationService notifications, TickSource tickSource, Clock clock) {
        this.metricsSource = metricsSource;
        this.configService = configService;
        this.notifications = notifications;
        this.tickSource = tickSource;
        this.clock = clock;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        schedule(configService.getConfig().getHealthCheckIntervalMs());
        log.info("Health monitor started");
    }

    public synchronized void stop() {
        running = false;
        tickSource.cancel(TICK);
    }

    public boolean isRunning() {
        return running;
    }

    public Optional<HealthReport> latest() {
        return Optional.ofNullable(latest);
    }

    public HealthReport runCheck() {
        CosConfig config = configService.getConfig();
        List<HealthIssue> issues = new ArrayList<>();
        List<ProcessSample> samples = List.of();
        try {
            samples = metricsSource.sample();
        } catch (Exception e) {
            log.error("Health probe failed", e);
            issues.add(HealthIssue.builder()
                .severity(HealthIssue.Severity.ERROR)
                .category("probe")
                .message("Health probe failed: " + e.getMessage())
                .build());
        }

        if (samples.size() > config.getMaxTotalProcesses()) {
            issues.add(HealthIssue.builder()
                .severity(HealthIssue.Severity.WARNING)
                .category("processes")
                .message(String.format("%d processes running (limit %d)", samples.size(), config.getMaxTotalProcesses()))
                .build());
        }
        for (ProcessSample sample : samples) {
            if (sample.isErrored()) {
                issues.add(HealthIssue.builder()
                    .severity(HealthIssue.Severity.ERROR)
                    .category("processes")
                    .process(sample.getName())
                    .message(sample.getName() + " is in errored state")
                    .build());
            }
            if (sample.getMemoryMb() > config.getMaxProcessMemoryMb()) {
                issues.add(HealthIssue.builder()
                    .severity(HealthIssue.Severity.WARNING)
                    .category("memory")
                    .process(sample.getName())
                    .message(String.format("%s uses %dMB (limit %dMB)",
                        sample.getName(), sample.getMemoryMb(), config.getMaxProcessMemoryMb()))
                    .build());
            }
        }

        HealthReport report = HealthReport.builder()
            .checkedAt(clock.instant())
            .processCount(samples.size())
            .totalMemoryMb(samples.stream().mapToLong(ProcessSample::getMemoryMb).sum())
            .issues(issues)
            .build();
        latest = report;

        if (!issues.isEmpty()) {
            log.warn("Health check found {} issue(s)", issues.size());
            try {
                notifications.notifyHealthIssues(report);
            } catch (RuntimeException e) {
                log.error("Could not deliver health notification", e);
            }
        }
        return report;
    }

    @EventListener
    public void onConfigChanged(CosConfigChangedEvent event) {
        if (running && event.healthIntervalChanged()) {
            schedule(event.current().getHealthCheckIntervalMs());
        }
    }

    private void schedule(long intervalMs) {
        tickSource.schedule(TICK, this::runCheck, intervalMs, intervalMs);
    }
}
