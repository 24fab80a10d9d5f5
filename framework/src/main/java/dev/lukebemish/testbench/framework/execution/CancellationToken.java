package dev.lukebemish.testbench.framework.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for one execution run. The engine only observes it between nodes, so a running leaf
 * always completes.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
