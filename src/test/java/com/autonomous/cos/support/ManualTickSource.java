package com.autonomous.cos.support;

import com.autonomous.cos.service.TickSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tick source for tests: nothing runs on its own. Scheduled ticks run on {@link #fire(String)},
 * submitted work runs inline on the caller's thread.
 */
public class ManualTickSource implements TickSource {

    private final Map<String, Runnable> ticks = new HashMap<>();
    private final Map<String, Long> periods = new HashMap<>();
    private final List<String> submitted = new ArrayList<>();

    @Override
    public synchronized void schedule(String name, Runnable tick, long initialDelayMs, long periodMs) {
        ticks.put(name, tick);
        periods.put(name, periodMs);
    }

    @Override
    public void submit(String name, Runnable work) {
        synchronized (this) {
            submitted.add(name);
        }
        work.run();
    }

    @Override
    public synchronized void cancel(String name) {
        ticks.remove(name);
        periods.remove(name);
    }

    @Override
    public synchronized boolean isScheduled(String name) {
        return ticks.containsKey(name);
    }

    public void fire(String name) {
        Runnable tick;
        synchronized (this) {
            tick = ticks.get(name);
        }
        if (tick == null) {
            throw new IllegalStateException("Nothing scheduled for " + name);
        }
        tick.run();
    }

    public synchronized Long periodOf(String name) {
        return periods.get(name);
    }

    public synchronized List<String> submitted() {
        return new ArrayList<>(submitted);
    }
}
