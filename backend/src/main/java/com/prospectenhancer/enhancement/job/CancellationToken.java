package com.prospectenhancer.enhancement.job;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for one run. The worker polls it between records; a model call in flight is
 * never interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean abandoned = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Set when stop() gave up waiting; the worker must then discard its in-flight result.
     * Blocks while an action passed to {@link #runUnlessAbandoned} is running.
     */
    synchronized void abandon() {
        cancelled.set(true);
        abandoned.set(true);
    }

    /**
     * Runs {@code action} only if the run has not been abandoned. Abandonment cannot interleave with it.
     *
     * @return false if the action was skipped
     */
    synchronized boolean runUnlessAbandoned(Runnable action) {
        if (abandoned.get()) {
            return false;
        }
        action.run();
        return true;
    }

    boolean isAbandoned() {
        return abandoned.get();
    }
}
