package com.autonomous.cos.service;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TickSource} backed by one single-threaded scheduled executor per name.
 */
@Slf4j
public class ExecutorTickSource implements TickSource {

    private final Map<String, ScheduledExecutorService> lanes = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> schedules = new ConcurrentHashMap<>();

    @Override
    public void schedule(String name, Runnable tick, long initialDelayMs, long periodMs) {
        cancel(name);
        ScheduledFuture<?> future = lane(name)
            .scheduleWithFixedDelay(guarded(name, tick), initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        schedules.put(name, future);
        log.debug("Scheduled tick '{}' every {}ms", name, periodMs);
    }

    @Override
    public void submit(String name, Runnable work) {
        lane(name).execute(guarded(name, work));
    }

    @Override
    public void cancel(String name) {
        ScheduledFuture<?> existing = schedules.remove(name);
        if (existing != null) {
            existing.cancel(false);
        }
    }

    @Override
    public boolean isScheduled(String name) {
        ScheduledFuture<?> future = schedules.get(name);
        return future != null && !future.isCancelled();
    }

    public void shutdown() {
        schedules.values().forEach(f -> f.cancel(false));
        schedules.clear();
        lanes.values().forEach(ScheduledExecutorService::shutdownNow);
        lanes.clear();
    }

    private ScheduledExecutorService lane(String name) {
        return lanes.computeIfAbsent(name, n -> Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "cos-" + n);
            thread.setDaemon(true);
            return thread;
        }));
    }

    // A throwing task would silently cancel its fixed-delay schedule.
    private Runnable guarded(String name, Runnable work) {
        return () -> {
            try {
                work.run();
            } catch (RuntimeException e) {
                log.error("Tick '{}' failed", name, e);
            }
        };
    }
}
