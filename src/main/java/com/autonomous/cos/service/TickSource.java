package com.autonomous.cos.service;

/**
 * Drives named periodic work. Each name owns a single serial lane: ticks and
 * submitted one-off runs for the same name never overlap.
 */
public interface TickSource {

    /**
     * Schedules {@code tick} every {@code periodMs}, replacing any existing schedule for the name.
     */
    void schedule(String name, Runnable tick, long initialDelayMs, long periodMs);

    /** Runs {@code work} once on the lane of the given name. */
    void submit(String name, Runnable work);

    void cancel(String name);

    boolean isScheduled(String name);
}
