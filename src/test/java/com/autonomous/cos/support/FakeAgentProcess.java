package com.autonomous.cos.support;

import com.autonomous.cos.service.AgentProcess;

import java.util.concurrent.CompletableFuture;

/**
 * Process handle whose exit is driven by the test.
 */
public class FakeAgentProcess implements AgentProcess {

    private final long pid;
    private final CompletableFuture<Integer> exit = new CompletableFuture<>();
    private volatile boolean destroyed;
    private volatile boolean forced;

    public FakeAgentProcess(long pid) {
        this.pid = pid;
    }

    @Override
    public Long pid() {
        return pid;
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return exit;
    }

    @Override
    public boolean isAlive() {
        return !exit.isDone();
    }

    @Override
    public void destroy() {
        destroyed = true;
        exit.complete(143);
    }

    @Override
    public void destroyForcibly() {
        forced = true;
        exit.complete(137);
    }

    public void exit(int code) {
        exit.complete(code);
    }

    public void crash(Throwable error) {
        exit.completeExceptionally(error);
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public boolean isForced() {
        return forced;
    }
}
