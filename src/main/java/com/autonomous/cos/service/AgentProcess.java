package com.autonomous.cos.service;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a running worker process.
 */
public interface AgentProcess {

    Long pid();

    /** Completes with the exit code once the process has exited and its output is drained. */
    CompletableFuture<Integer> onExit();

    boolean isAlive();

    void destroy();

    void destroyForcibly();
}
