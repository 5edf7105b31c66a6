package com.agentbacktest.engine.orchestrator;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag shared by a simulation run and its decision cycles.
 * Once cancelled it stays cancelled.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
